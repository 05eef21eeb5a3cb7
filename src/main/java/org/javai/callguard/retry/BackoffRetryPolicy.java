package org.javai.callguard.retry;

import org.javai.callguard.Failure;
import org.javai.callguard.FailureType;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with jitter.
 *
 * <p><strong>Algorithm:</strong></p>
 * <pre>
 * capped  = min(baseDelay * backoffMultiplier^(attempt-1), maxDelay)
 * delay   = capped * (1 + jitter * (2r - 1)),  r uniform in [0, 1)
 * </pre>
 *
 * <p>With the defaults (100ms base, multiplier 2, jitter 0.2) the waits after attempts
 * 1, 2 and 3 are roughly 80-120ms, 160-240ms and 320-480ms.</p>
 *
 * <p>Failures that are not {@link FailureType#TRANSIENT}, or whose kind is listed in
 * {@link RetryConfig#nonRetryableKinds()}, are never retried. A retry-after hint longer than
 * the computed delay replaces it.</p>
 */
public final class BackoffRetryPolicy implements RetryPolicy {

    private final String id;
    private final RetryConfig config;
    private final DoubleSupplier random;

    public BackoffRetryPolicy(RetryConfig config) {
        this("backoff", config, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param id the policy id used in reporting
     * @param config backoff settings
     * @param random source of uniform values in [0, 1) for jitter
     */
    public BackoffRetryPolicy(String id, RetryConfig config, DoubleSupplier random) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    @Override
    public String id() {
        return id;
    }

    public RetryConfig config() {
        return config;
    }

    @Override
    public RetryDecision decide(RetryContext context, Failure failure) {
        if (failure.type() != FailureType.TRANSIENT) {
            return RetryDecision.GiveUp.notRetryable(failure.type() + " failure is not retryable");
        }
        if (config.nonRetryableKinds().contains(failure.id())) {
            return RetryDecision.GiveUp.notRetryable("kind " + failure.id() + " is configured as non-retryable");
        }
        if (context.attemptNumber() >= config.maxAttempts()) {
            return RetryDecision.GiveUp.exhausted("max attempts reached");
        }

        Duration delay = jittered(cappedDelay(context.attemptNumber()));

        Duration hint = failure.retryAfter();
        if (hint != null && hint.compareTo(delay) > 0) {
            delay = hint;
        }
        return RetryDecision.Retry.after(delay);
    }

    /**
     * The delay after {@code attempt} before jitter is applied.
     */
    Duration cappedDelay(int attempt) {
        double nanos = config.baseDelay().toNanos() * Math.pow(config.backoffMultiplier(), attempt - 1);
        long maxNanos = config.maxDelay().toNanos();
        if (Double.isNaN(nanos) || nanos >= maxNanos) {
            return config.maxDelay();
        }
        return Duration.ofNanos((long) nanos);
    }

    private Duration jittered(Duration capped) {
        if (config.jitter() == 0.0 || capped.isZero()) {
            return capped;
        }
        double factor = 1.0 + config.jitter() * (2.0 * random.getAsDouble() - 1.0);
        return Duration.ofNanos(Math.round(capped.toNanos() * factor));
    }
}
