package org.javai.callguard;

import org.javai.callguard.boundary.ThrowingSupplier;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * One unit of outbound work, such as an HTTP call.
 *
 * <p>Each call to {@link #start()} performs one attempt. The orchestrator never inspects or
 * mutates the operation; it only starts it, possibly several times when retrying, so the work
 * must be safe to repeat or the caller must classify its failures as permanent.</p>
 *
 * <p>{@code start()} must not block. Blocking clients go through {@link #blocking}.</p>
 *
 * @param <T> the type of the successful result
 */
@FunctionalInterface
public interface Operation<T> {

    /**
     * Begins one attempt.
     *
     * @return a future that settles with the result or the raw failure; cancelling it should
     *         abort the attempt where the underlying client allows
     */
    CompletableFuture<T> start();

    /**
     * Wraps work that runs on the calling thread and settles before {@code start()} returns.
     */
    static <T> Operation<T> of(ThrowingSupplier<T, ? extends Exception> work) {
        Objects.requireNonNull(work, "work must not be null");
        return () -> {
            try {
                return CompletableFuture.completedFuture(work.get());
            } catch (Exception e) {
                return CompletableFuture.failedFuture(e);
            }
        };
    }

    /**
     * Wraps blocking work so each attempt runs on {@code executor}.
     * Cancelling the returned future interrupts the worker thread.
     */
    static <T> Operation<T> blocking(ThrowingSupplier<T, ? extends Exception> work, ExecutorService executor) {
        Objects.requireNonNull(work, "work must not be null");
        Objects.requireNonNull(executor, "executor must not be null");
        return () -> {
            CompletableFuture<T> result = new CompletableFuture<>();
            Future<?> task = executor.submit(() -> {
                try {
                    result.complete(work.get());
                } catch (Throwable e) {
                    result.completeExceptionally(e);
                }
            });
            result.whenComplete((ignored, error) -> {
                if (result.isCancelled()) {
                    task.cancel(true);
                }
            });
            return result;
        };
    }
}
