package org.javai.callguard.retry;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Context provided to retry policies for making decisions.
 *
 * @param attemptNumber The attempt that just failed (1-based)
 * @param startedAt When the first attempt began
 * @param elapsed Time elapsed since the first attempt
 */
public record RetryContext(int attemptNumber, Instant startedAt, Duration elapsed) {

    public RetryContext {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be >= 1");
        }
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        Objects.requireNonNull(elapsed, "elapsed must not be null");
    }

    public static RetryContext first(Instant now) {
        return new RetryContext(1, now, Duration.ZERO);
    }

    public RetryContext next(Instant now) {
        return new RetryContext(attemptNumber + 1, startedAt, Duration.between(startedAt, now));
    }
}
