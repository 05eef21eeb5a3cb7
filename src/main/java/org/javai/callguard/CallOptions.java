package org.javai.callguard;

import org.javai.callguard.retry.RetryConfig;

import java.time.Duration;

/**
 * Per-call overrides for {@link Orchestrator#execute(String, Operation, CallOptions)}.
 * A null field falls back to the orchestrator's configuration.
 *
 * @param ttl freshness window for the cached result, or null
 * @param retry retry settings for this call, or null
 */
public record CallOptions(Duration ttl, RetryConfig retry) {

    private static final CallOptions DEFAULTS = new CallOptions(null, null);

    public CallOptions {
        if (ttl != null && (ttl.isZero() || ttl.isNegative())) {
            throw new ConfigurationException("ttl must be positive, was: " + ttl);
        }
    }

    /**
     * @return options that override nothing
     */
    public static CallOptions defaults() {
        return DEFAULTS;
    }

    public static CallOptions ttl(Duration ttl) {
        return new CallOptions(ttl, null);
    }

    public static CallOptions retry(RetryConfig retry) {
        return new CallOptions(null, retry);
    }

    public Duration ttlOr(Duration fallback) {
        return ttl != null ? ttl : fallback;
    }

    public RetryConfig retryOr(RetryConfig fallback) {
        return retry != null ? retry : fallback;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration ttl;
        private RetryConfig retry;

        private Builder() {}

        public Builder ttl(Duration ttl) {
            this.ttl = ttl;
            return this;
        }

        public Builder retry(RetryConfig retry) {
            this.retry = retry;
            return this;
        }

        public CallOptions build() {
            return new CallOptions(ttl, retry);
        }
    }
}
