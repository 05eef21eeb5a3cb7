package org.javai.callguard.retry;

import org.javai.callguard.ConfigurationException;
import org.javai.callguard.Failure;
import org.javai.callguard.FailureType;

import java.time.Duration;
import java.util.Objects;

/**
 * Decides whether and when to retry after a failure.
 * Policies are pure: they look only at their arguments and have no side effects.
 */
public interface RetryPolicy {

    /**
     * A unique identifier for this policy, used in reporting.
     */
    String id();

    /**
     * Evaluates a failure and decides whether to retry.
     *
     * @param context The current retry context
     * @param failure The failure that occurred
     * @return Retry with a delay, or GiveUp
     */
    RetryDecision decide(RetryContext context, Failure failure);

    /**
     * Creates a policy that never retries.
     */
    static RetryPolicy noRetry() {
        return new RetryPolicy() {
            @Override
            public String id() {
                return "no-retry";
            }

            @Override
            public RetryDecision decide(RetryContext context, Failure failure) {
                return failure.type() == FailureType.TRANSIENT
                        ? RetryDecision.GiveUp.exhausted("no-retry policy")
                        : RetryDecision.GiveUp.notRetryable("failure is not retryable");
            }
        };
    }

    /**
     * Creates a policy that retries transient failures after a constant delay.
     */
    static RetryPolicy fixed(String id, int maxAttempts, Duration delay) {
        Objects.requireNonNull(id);
        Objects.requireNonNull(delay);
        if (maxAttempts < 1) {
            throw new ConfigurationException("maxAttempts must be >= 1");
        }

        return new RetryPolicy() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public RetryDecision decide(RetryContext context, Failure failure) {
                if (failure.type() != FailureType.TRANSIENT) {
                    return RetryDecision.GiveUp.notRetryable("failure is not retryable");
                }
                if (context.attemptNumber() >= maxAttempts) {
                    return RetryDecision.GiveUp.exhausted("max attempts reached");
                }
                return RetryDecision.Retry.after(delay);
            }
        };
    }

    /**
     * Creates a policy with exponential backoff and jitter.
     */
    static RetryPolicy backoff(RetryConfig config) {
        return new BackoffRetryPolicy(config);
    }
}
