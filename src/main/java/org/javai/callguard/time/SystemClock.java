package org.javai.callguard.time;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * A {@link Clock} backed by a {@link java.time.Clock} and a single daemon timer thread.
 *
 * <p>The timer thread only fires; elapsed delays are completed on the callback executor so
 * that work chained onto a delay never runs on the timer thread.</p>
 */
public final class SystemClock implements Clock, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SystemClock.class);

    private static final class Holder {
        static final SystemClock SHARED = new SystemClock(java.time.Clock.systemUTC(), ForkJoinPool.commonPool());
    }

    private final java.time.Clock source;
    private final Executor callbackExecutor;
    private final ScheduledThreadPoolExecutor timer;

    public SystemClock(java.time.Clock source, Executor callbackExecutor) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.callbackExecutor = Objects.requireNonNull(callbackExecutor, "callbackExecutor must not be null");
        this.timer = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, "callguard-timer");
            thread.setDaemon(true);
            return thread;
        });
        this.timer.setRemoveOnCancelPolicy(true);
    }

    static SystemClock shared() {
        return Holder.SHARED;
    }

    @Override
    public Instant now() {
        return source.instant();
    }

    @Override
    public CompletableFuture<Void> after(Duration delay) {
        Objects.requireNonNull(delay, "delay must not be null");
        if (delay.isZero() || delay.isNegative()) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> elapsed = new CompletableFuture<>();
        ScheduledFuture<?> task = timer.schedule(
                () -> callbackExecutor.execute(() -> elapsed.complete(null)),
                delay.toNanos(),
                TimeUnit.NANOSECONDS);
        elapsed.whenComplete((ignored, error) -> {
            if (elapsed.isCancelled()) {
                task.cancel(false);
            }
        });
        return elapsed;
    }

    /**
     * Stops the timer thread. Pending delays never complete afterwards.
     */
    @Override
    public void close() {
        int pending = timer.shutdownNow().size();
        if (pending > 0) {
            log.debug("Timer stopped with {} pending delays", pending);
        }
    }
}
