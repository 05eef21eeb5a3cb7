package org.javai.callguard;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Small helpers for composing {@link CompletableFuture}s across the orchestration components.
 */
public final class Futures {

    private Futures() {
        // Utility class
    }

    /**
     * Strips the wrappers that {@link CompletableFuture} adds around a failure.
     *
     * @param error the failure as observed by a dependent stage
     * @return the failure the source actually completed with
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Starts an operation, turning a synchronous throw or a missing future into a failed future.
     */
    public static <T> CompletableFuture<T> start(Operation<T> operation) {
        Objects.requireNonNull(operation, "operation must not be null");
        try {
            CompletableFuture<T> started = operation.start();
            if (started == null) {
                return CompletableFuture.failedFuture(
                        new NullPointerException("operation returned no future"));
            }
            return started;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Cancels {@code upstream} when {@code downstream} is cancelled.
     */
    public static void propagateCancellation(CompletableFuture<?> downstream, CompletableFuture<?> upstream) {
        downstream.whenComplete((ignored, error) -> {
            if (downstream.isCancelled()) {
                upstream.cancel(true);
            }
        });
    }
}
