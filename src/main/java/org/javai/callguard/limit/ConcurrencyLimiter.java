package org.javai.callguard.limit;

import org.javai.callguard.ConfigurationException;
import org.javai.callguard.Futures;
import org.javai.callguard.Operation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounds how many operations run at once and queues the rest in arrival order.
 *
 * <p>A finishing operation hands its slot straight to the head of the queue, so the limiter is
 * never idle while work is waiting. Waiters are admitted strictly first-in, first-out.</p>
 *
 * <p>Cancelling a queued request removes it without ever starting the operation. Cancelling
 * an admitted request cancels the running operation and frees its slot at once.</p>
 *
 * <p>Handoffs run iteratively on the releasing thread, so a long queue of operations that
 * complete inline is drained without deepening the stack.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * ConcurrencyLimiter limiter = new ConcurrencyLimiter(4);
 * CompletableFuture<Page> page = limiter.run(() -> client.fetchPage(n));
 * }</pre>
 */
public final class ConcurrencyLimiter {

    private static final Logger log = LoggerFactory.getLogger(ConcurrencyLimiter.class);

    private final int maxConcurrency;
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<Admission<?>> queue = new ArrayDeque<>();
    private final ThreadLocal<Handoffs> draining = new ThreadLocal<>();
    private int inUse;

    /**
     * @param maxConcurrency the number of slots, at least 1
     * @throws ConfigurationException if {@code maxConcurrency} is below 1
     */
    public ConcurrencyLimiter(int maxConcurrency) {
        if (maxConcurrency < 1) {
            throw new ConfigurationException("maxConcurrency must be >= 1, was: " + maxConcurrency);
        }
        this.maxConcurrency = maxConcurrency;
    }

    /**
     * Runs {@code operation} as soon as a slot is free.
     *
     * @return a future settling like the operation; failures propagate unchanged
     */
    public <T> CompletableFuture<T> run(Operation<T> operation) {
        Objects.requireNonNull(operation, "operation must not be null");
        Admission<T> admission = new Admission<>(operation);

        boolean admitted;
        lock.lock();
        try {
            admitted = inUse < maxConcurrency;
            if (admitted) {
                inUse++;
            } else {
                queue.addLast(admission);
            }
        } finally {
            lock.unlock();
        }

        admission.result.whenComplete((ignored, error) -> {
            if (admission.result.isCancelled()) {
                cancel(admission);
            }
        });

        if (admitted) {
            admission.begin();
        } else {
            log.debug("All {} slots busy; request queued", maxConcurrency);
        }
        return admission.result;
    }

    /**
     * Runs every operation through this limiter.
     *
     * @return a future with the results in input order, failing with the first failure observed
     */
    public <T> CompletableFuture<List<T>> runAll(List<? extends Operation<T>> operations) {
        Objects.requireNonNull(operations, "operations must not be null");
        List<CompletableFuture<T>> started = new ArrayList<>(operations.size());
        for (Operation<T> operation : operations) {
            started.add(run(operation));
        }
        return CompletableFuture.allOf(started.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    List<T> results = new ArrayList<>(started.size());
                    for (CompletableFuture<T> future : started) {
                        results.add(future.join());
                    }
                    return results;
                });
    }

    public int maxConcurrency() {
        return maxConcurrency;
    }

    /**
     * @return the number of slots currently held
     */
    public int activeCount() {
        lock.lock();
        try {
            return inUse;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the number of requests waiting for a slot
     */
    public int queuedCount() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    private void cancel(Admission<?> admission) {
        boolean wasQueued;
        lock.lock();
        try {
            wasQueued = queue.remove(admission);
        } finally {
            lock.unlock();
        }
        if (wasQueued) {
            log.debug("Queued request cancelled before admission");
            return;
        }
        admission.release();
        CompletableFuture<?> running = admission.running;
        if (running != null) {
            running.cancel(true);
        }
    }

    private void release() {
        Handoffs handoffs = draining.get();
        if (handoffs != null) {
            // this thread is already handing off slots further up the stack
            handoffs.pending++;
            return;
        }
        handoffs = new Handoffs();
        draining.set(handoffs);
        try {
            while (handoffs.pending > 0) {
                handoffs.pending--;
                Admission<?> next = takeNextOrFree();
                // the slot passes straight to the next waiter
                if (next != null) {
                    next.begin();
                }
            }
        } finally {
            draining.remove();
        }
    }

    private Admission<?> takeNextOrFree() {
        lock.lock();
        try {
            Admission<?> next = queue.pollFirst();
            if (next == null) {
                inUse--;
            }
            return next;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Slots freed on one thread while it is already handing off, served by the outermost
     * {@link #release()} on that thread so inline completions never nest.
     */
    private static final class Handoffs {
        private int pending = 1;
    }

    private final class Admission<T> {
        private final Operation<T> operation;
        private final CompletableFuture<T> result = new CompletableFuture<>();
        private final AtomicBoolean released = new AtomicBoolean();
        private volatile CompletableFuture<T> running;

        Admission(Operation<T> operation) {
            this.operation = operation;
        }

        void begin() {
            if (result.isDone()) {
                release();
                return;
            }
            CompletableFuture<T> started = Futures.start(operation);
            running = started;
            started.whenComplete((value, error) -> {
                release();
                if (error == null) {
                    result.complete(value);
                } else {
                    result.completeExceptionally(Futures.unwrap(error));
                }
            });
            if (result.isCancelled()) {
                started.cancel(true);
            }
        }

        void release() {
            if (released.compareAndSet(false, true)) {
                ConcurrencyLimiter.this.release();
            }
        }
    }
}
