package org.javai.callguard.ops;

import org.javai.callguard.Failure;

import java.time.Duration;

/**
 * Reports failures and retry activity for observability.
 * Implementations might emit metrics, structured logs, or alerts.
 *
 * <p>Reporting must never affect the call being reported on; implementations should not throw.</p>
 */
public interface OpReporter {

    /**
     * Reports a classified failure of one attempt.
     */
    void report(Failure failure);

    /**
     * Reports that a failed attempt will be retried.
     *
     * @param failure The failure that triggered the retry
     * @param attemptNumber The attempt that failed (1-based)
     * @param delay The wait before the next attempt
     */
    default void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports that the retry loop stopped on a failure.
     *
     * @param failure The final failure
     * @param totalAttempts The total number of attempts made
     * @param reason Why no further attempt was made
     */
    default void reportGaveUp(Failure failure, int totalAttempts, String reason) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports that a background refresh failed and the stale cached value was kept.
     *
     * @param key The cache key
     * @param error The terminal error of the refresh
     */
    default void reportRefreshFailure(String key, Throwable error) {
        // Default: no-op. Implementations may override.
    }

    /**
     * A reporter that does nothing.
     */
    static OpReporter noOp() {
        return failure -> {};
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     */
    static OpReporter composite(OpReporter... reporters) {
        return CompositeOpReporter.of(reporters);
    }
}
