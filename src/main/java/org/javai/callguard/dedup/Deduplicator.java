package org.javai.callguard.dedup;

import org.javai.callguard.Futures;
import org.javai.callguard.Operation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Collapses concurrent calls for the same key into one execution.
 *
 * <p>The first caller for a key starts the operation; callers arriving while it is in flight
 * join it instead of starting another. When it settles, every joined caller receives the same
 * value, or the same exception instance. The pending entry is removed in the same step that
 * collects the callers to notify, so a caller either joins and is notified or arrives later and
 * starts a fresh execution.</p>
 *
 * <p>Each caller gets its own future. Cancelling it detaches only that caller; the shared
 * execution is cancelled once every caller has detached.</p>
 *
 * <p>This governs overlapping calls only; reuse across time is the cache's concern.</p>
 */
public final class Deduplicator {

    private static final Logger log = LoggerFactory.getLogger(Deduplicator.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Flight<?>> pending = new HashMap<>();

    /**
     * Runs {@code operation} for {@code key} unless an execution for that key is already in flight.
     *
     * <p>Callers sharing a key must expect the same result type.</p>
     */
    public <T> CompletableFuture<T> dedupe(String key, Operation<T> operation) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(operation, "operation must not be null");

        Flight<T> flight;
        CompletableFuture<T> waiter = new CompletableFuture<>();
        boolean leader;
        lock.lock();
        try {
            Flight<T> existing = lookup(key);
            leader = existing == null;
            flight = leader ? new Flight<>(key) : existing;
            if (leader) {
                pending.put(key, flight);
            }
            flight.waiters.add(waiter);
        } finally {
            lock.unlock();
        }

        waiter.whenComplete((ignored, error) -> {
            if (waiter.isCancelled()) {
                flight.leave(waiter);
            }
        });

        if (leader) {
            flight.launch(operation);
        } else {
            log.debug("Joined in-flight call for [{}]", key);
        }
        return waiter;
    }

    /**
     * @return the number of keys with an execution in flight
     */
    public int pendingCount() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isPending(String key) {
        lock.lock();
        try {
            return pending.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    // guarded by lock
    @SuppressWarnings("unchecked")
    private <T> Flight<T> lookup(String key) {
        return (Flight<T>) pending.get(key);
    }

    private final class Flight<T> {
        private final String key;
        // guarded by lock
        private final List<CompletableFuture<T>> waiters = new ArrayList<>();
        private CompletableFuture<T> underlying;
        private boolean settled;

        Flight(String key) {
            this.key = key;
        }

        void launch(Operation<T> operation) {
            CompletableFuture<T> started = Futures.start(operation);
            boolean abandoned;
            lock.lock();
            try {
                underlying = started;
                abandoned = waiters.isEmpty();
            } finally {
                lock.unlock();
            }
            started.whenComplete(this::settle);
            if (abandoned) {
                started.cancel(true);
            }
        }

        void settle(T value, Throwable error) {
            List<CompletableFuture<T>> recipients;
            lock.lock();
            try {
                pending.remove(key, this);
                settled = true;
                recipients = new ArrayList<>(waiters);
                waiters.clear();
            } finally {
                lock.unlock();
            }
            Throwable cause = error == null ? null : Futures.unwrap(error);
            for (CompletableFuture<T> recipient : recipients) {
                if (cause == null) {
                    recipient.complete(value);
                } else {
                    recipient.completeExceptionally(cause);
                }
            }
        }

        void leave(CompletableFuture<T> waiter) {
            CompletableFuture<T> toCancel = null;
            lock.lock();
            try {
                if (!waiters.remove(waiter) || settled || !waiters.isEmpty()) {
                    return;
                }
                pending.remove(key, this);
                toCancel = underlying;
            } finally {
                lock.unlock();
            }
            log.debug("Every caller of [{}] cancelled; cancelling the shared call", key);
            if (toCancel != null) {
                toCancel.cancel(true);
            }
        }
    }
}
