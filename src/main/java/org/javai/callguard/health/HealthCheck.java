package org.javai.callguard.health;

import org.javai.callguard.boundary.ThrowingSupplier;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * An independent probe of one dependency.
 *
 * <p>A probe that completes normally is healthy, and its value becomes the entry's detail.
 * A probe that fails, or that does not settle within its timeout, is unhealthy.</p>
 */
@FunctionalInterface
public interface HealthCheck {

    /**
     * Starts the probe.
     *
     * @return a future with a short human-readable detail, such as {@code "ok"} or a latency
     */
    CompletableFuture<String> probe();

    /**
     * Adapts a blocking probe. It runs on {@code executor}; a timed-out probe is interrupted.
     */
    static HealthCheck blocking(ThrowingSupplier<String, ? extends Exception> probe, ExecutorService executor) {
        Objects.requireNonNull(probe, "probe must not be null");
        Objects.requireNonNull(executor, "executor must not be null");
        return () -> {
            CompletableFuture<String> result = new CompletableFuture<>();
            Future<?> task = executor.submit(() -> {
                try {
                    result.complete(probe.get());
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
