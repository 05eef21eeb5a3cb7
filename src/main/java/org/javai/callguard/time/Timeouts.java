package org.javai.callguard.time;

import org.javai.callguard.Futures;
import org.javai.callguard.Operation;
import org.javai.callguard.TimeoutFailureException;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Races work against a timer.
 */
public final class Timeouts {

    private Timeouts() {
        // Utility class
    }

    /**
     * Returns a future that settles like {@code work}, or fails with {@link TimeoutFailureException}
     * if {@code timeout} elapses first. The loser of the race is cancelled. Cancelling the
     * returned future cancels both.
     *
     * @param clock the clock providing the timer
     * @param work the work to bound
     * @param timeout the limit, or null for no limit
     * @param operation name used in the timeout message
     */
    public static <T> CompletableFuture<T> within(Clock clock, CompletableFuture<T> work, Duration timeout, String operation) {
        Objects.requireNonNull(clock, "clock must not be null");
        Objects.requireNonNull(work, "work must not be null");
        if (timeout == null) {
            return work;
        }

        CompletableFuture<T> result = new CompletableFuture<>();
        CompletableFuture<Void> timer = clock.after(timeout);

        timer.thenRun(() -> {
            if (result.completeExceptionally(new TimeoutFailureException(operation, timeout))) {
                work.cancel(true);
            }
        });
        work.whenComplete((value, error) -> {
            timer.cancel(false);
            if (error == null) {
                result.complete(value);
            } else {
                result.completeExceptionally(Futures.unwrap(error));
            }
        });
        result.whenComplete((ignored, error) -> {
            if (result.isCancelled()) {
                work.cancel(true);
                timer.cancel(false);
            }
        });
        return result;
    }

    /**
     * Returns an operation whose every start is bounded by {@code timeout}.
     * A null timeout returns {@code operation} itself.
     */
    public static <T> Operation<T> bound(Clock clock, Operation<T> operation, Duration timeout, String name) {
        Objects.requireNonNull(operation, "operation must not be null");
        if (timeout == null) {
            return operation;
        }
        return () -> within(clock, Futures.start(operation), timeout, name);
    }
}
