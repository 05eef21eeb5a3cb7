package org.javai.callguard.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * What a {@link RetryPolicy} decided after a failed attempt.
 */
public sealed interface RetryDecision permits RetryDecision.Retry, RetryDecision.GiveUp {

    /**
     * Start another attempt after waiting for the specified delay.
     */
    record Retry(Duration delay) implements RetryDecision {
        public Retry {
            Objects.requireNonNull(delay, "delay must not be null");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("delay must not be negative");
            }
        }

        public static Retry after(Duration delay) {
            return new Retry(delay);
        }
    }

    /**
     * Stop and surface the failure.
     *
     * @param reason why no further attempt is made
     * @param exhausted true when the failure was retryable but the attempt budget ran out;
     *                  false when the failure itself is not retryable
     */
    record GiveUp(String reason, boolean exhausted) implements RetryDecision {

        public static GiveUp exhausted(String reason) {
            return new GiveUp(reason, true);
        }

        public static GiveUp notRetryable(String reason) {
            return new GiveUp(reason, false);
        }
    }
}
