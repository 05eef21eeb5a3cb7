package org.javai.callguard.retry;

import org.javai.callguard.ConfigurationException;
import org.javai.callguard.FailureId;

import java.time.Duration;
import java.util.Collection;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Settings for exponential backoff with jitter.
 *
 * @param maxAttempts total attempts allowed, including the first (at least 1)
 * @param baseDelay delay before the second attempt
 * @param maxDelay cap on the computed delay, applied before jitter
 * @param backoffMultiplier growth factor between consecutive delays (greater than 1)
 * @param jitter relative spread applied to each delay, in [0, 1); 0.2 means ±20%
 * @param nonRetryableKinds failure kinds that are never retried, whatever their type
 * @param attemptTimeout limit for a single attempt, or null for none
 */
public record RetryConfig(
        int maxAttempts,
        Duration baseDelay,
        Duration maxDelay,
        double backoffMultiplier,
        double jitter,
        Set<FailureId> nonRetryableKinds,
        Duration attemptTimeout
) {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(100);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(5);
    public static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;
    public static final double DEFAULT_JITTER = 0.2;

    public RetryConfig {
        if (maxAttempts < 1) {
            throw new ConfigurationException("maxAttempts must be >= 1, was: " + maxAttempts);
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new ConfigurationException("baseDelay must not be negative, was: " + baseDelay);
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new ConfigurationException("maxDelay must be >= baseDelay (base: " + baseDelay + ", max: " + maxDelay + ")");
        }
        if (!(backoffMultiplier > 1.0) || Double.isInfinite(backoffMultiplier)) {
            throw new ConfigurationException("backoffMultiplier must be > 1, was: " + backoffMultiplier);
        }
        if (!(jitter >= 0.0 && jitter < 1.0)) {
            throw new ConfigurationException("jitter must be in [0, 1), was: " + jitter);
        }
        if (attemptTimeout != null && (attemptTimeout.isZero() || attemptTimeout.isNegative())) {
            throw new ConfigurationException("attemptTimeout must be positive, was: " + attemptTimeout);
        }
        nonRetryableKinds = nonRetryableKinds == null ? Set.of() : Set.copyOf(nonRetryableKinds);
    }

    public static RetryConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-filled with this configuration.
     */
    public Builder toBuilder() {
        return new Builder()
                .maxAttempts(maxAttempts)
                .baseDelay(baseDelay)
                .maxDelay(maxDelay)
                .backoffMultiplier(backoffMultiplier)
                .jitter(jitter)
                .nonRetryableKinds(nonRetryableKinds)
                .attemptTimeout(attemptTimeout);
    }

    public static final class Builder {
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private Duration baseDelay = DEFAULT_BASE_DELAY;
        private Duration maxDelay = DEFAULT_MAX_DELAY;
        private double backoffMultiplier = DEFAULT_BACKOFF_MULTIPLIER;
        private double jitter = DEFAULT_JITTER;
        private final Set<FailureId> nonRetryableKinds = new HashSet<>();
        private Duration attemptTimeout;

        private Builder() {}

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder jitter(double jitter) {
            this.jitter = jitter;
            return this;
        }

        public Builder nonRetryableKind(FailureId kind) {
            this.nonRetryableKinds.add(Objects.requireNonNull(kind, "kind must not be null"));
            return this;
        }

        public Builder nonRetryableKinds(Collection<FailureId> kinds) {
            kinds.forEach(this::nonRetryableKind);
            return this;
        }

        public Builder attemptTimeout(Duration attemptTimeout) {
            this.attemptTimeout = attemptTimeout;
            return this;
        }

        /**
         * @throws ConfigurationException if any setting is out of range
         */
        public RetryConfig build() {
            return new RetryConfig(maxAttempts, baseDelay, maxDelay, backoffMultiplier, jitter,
                    nonRetryableKinds, attemptTimeout);
        }
    }
}
