package org.javai.callguard;

import org.javai.callguard.retry.RetryConfig;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Construction-time settings for an {@link Orchestrator}.
 *
 * <p>Settings can be given in code through {@link #builder()}, or read from
 * {@code callguard.*} properties:</p>
 * <pre>
 * callguard.ttl=10m
 * callguard.max-concurrency=8
 * callguard.cache.capacity=1000
 * callguard.retry.max-attempts=3
 * callguard.retry.base-delay=100ms
 * callguard.retry.max-delay=5s
 * callguard.retry.backoff-multiplier=2.0
 * callguard.retry.jitter=0.2
 * callguard.retry.non-retryable-kinds=http:404,validation:bad_input
 * callguard.retry.attempt-timeout=PT2S
 * </pre>
 *
 * <p>Durations are plain milliseconds, a number with an {@code ms}, {@code s}, {@code m} or
 * {@code h} suffix, or ISO-8601.</p>
 *
 * @param ttl default freshness window for cached results
 * @param maxConcurrency size of the shared slot pool (at least 1)
 * @param cacheCapacity maximum cached entries, 0 for unbounded
 * @param retry default retry settings
 */
public record OrchestratorConfig(Duration ttl, int maxConcurrency, int cacheCapacity, RetryConfig retry) {

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(10);
    public static final int DEFAULT_MAX_CONCURRENCY = 10;
    public static final String PREFIX = "callguard.";
    public static final String RESOURCE = "callguard.properties";

    static final String TTL = PREFIX + "ttl";
    static final String MAX_CONCURRENCY = PREFIX + "max-concurrency";
    static final String CACHE_CAPACITY = PREFIX + "cache.capacity";
    static final String MAX_ATTEMPTS = PREFIX + "retry.max-attempts";
    static final String BASE_DELAY = PREFIX + "retry.base-delay";
    static final String MAX_DELAY = PREFIX + "retry.max-delay";
    static final String BACKOFF_MULTIPLIER = PREFIX + "retry.backoff-multiplier";
    static final String JITTER = PREFIX + "retry.jitter";
    static final String NON_RETRYABLE_KINDS = PREFIX + "retry.non-retryable-kinds";
    static final String ATTEMPT_TIMEOUT = PREFIX + "retry.attempt-timeout";

    static final List<String> KEYS = List.of(TTL, MAX_CONCURRENCY, CACHE_CAPACITY, MAX_ATTEMPTS,
            BASE_DELAY, MAX_DELAY, BACKOFF_MULTIPLIER, JITTER, NON_RETRYABLE_KINDS, ATTEMPT_TIMEOUT);

    public OrchestratorConfig {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new ConfigurationException("ttl must be positive, was: " + ttl);
        }
        if (maxConcurrency < 1) {
            throw new ConfigurationException("maxConcurrency must be >= 1, was: " + maxConcurrency);
        }
        if (cacheCapacity < 0) {
            throw new ConfigurationException("cacheCapacity must be >= 0, was: " + cacheCapacity);
        }
        Objects.requireNonNull(retry, "retry must not be null");
    }

    public static OrchestratorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads settings from {@code callguard.*} properties; absent keys keep their defaults.
     *
     * @throws ConfigurationException if a value cannot be parsed or is out of range
     */
    public static OrchestratorConfig fromProperties(Properties properties) {
        Builder builder = builder();
        RetryConfig.Builder retry = RetryConfig.builder();

        String value;
        if ((value = get(properties, TTL)) != null) {
            builder.ttl(parseDuration(TTL, value));
        }
        if ((value = get(properties, MAX_CONCURRENCY)) != null) {
            builder.maxConcurrency(parseInt(MAX_CONCURRENCY, value));
        }
        if ((value = get(properties, CACHE_CAPACITY)) != null) {
            builder.cacheCapacity(parseInt(CACHE_CAPACITY, value));
        }
        if ((value = get(properties, MAX_ATTEMPTS)) != null) {
            retry.maxAttempts(parseInt(MAX_ATTEMPTS, value));
        }
        if ((value = get(properties, BASE_DELAY)) != null) {
            retry.baseDelay(parseDuration(BASE_DELAY, value));
        }
        if ((value = get(properties, MAX_DELAY)) != null) {
            retry.maxDelay(parseDuration(MAX_DELAY, value));
        }
        if ((value = get(properties, BACKOFF_MULTIPLIER)) != null) {
            retry.backoffMultiplier(parseDouble(BACKOFF_MULTIPLIER, value));
        }
        if ((value = get(properties, JITTER)) != null) {
            retry.jitter(parseDouble(JITTER, value));
        }
        if ((value = get(properties, NON_RETRYABLE_KINDS)) != null) {
            retry.nonRetryableKinds(parseKinds(NON_RETRYABLE_KINDS, value));
        }
        if ((value = get(properties, ATTEMPT_TIMEOUT)) != null) {
            retry.attemptTimeout(parseDuration(ATTEMPT_TIMEOUT, value));
        }
        return builder.retry(retry.build()).build();
    }

    /**
     * Resolves settings from built-in defaults, overridden by {@value #RESOURCE} on the
     * classpath, overridden in turn by a system property or, where none is set, an
     * environment variable.
     *
     * <p>The environment variable for a key is its upper-cased name with dots and dashes
     * replaced by underscores, e.g. {@code CALLGUARD_RETRY_MAX_ATTEMPTS}.</p>
     */
    public static OrchestratorConfig load() {
        return load(RESOURCE, System.getProperties(), System.getenv());
    }

    /**
     * Package-private for testing.
     */
    static OrchestratorConfig load(String resource, Properties systemProperties, Map<String, String> environment) {
        Properties merged = new Properties();
        try (InputStream in = OrchestratorConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in != null) {
                merged.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource, e);
        }
        for (String key : KEYS) {
            String value = systemProperties.getProperty(key);
            if (value == null || value.isBlank()) {
                value = environment.get(environmentName(key));
            }
            if (value != null && !value.isBlank()) {
                merged.setProperty(key, value);
            }
        }
        return fromProperties(merged);
    }

    static String environmentName(String key) {
        return key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    /**
     * Parses {@code 250}, {@code 250ms}, {@code 2s}, {@code 5m}, {@code 1h} or ISO-8601 such as {@code PT2S}.
     *
     * @throws ConfigurationException if the value is not a duration
     */
    static Duration parseDuration(String key, String value) {
        String text = value.trim().toLowerCase(Locale.ROOT);
        try {
            if (text.startsWith("p")) {
                return Duration.parse(value.trim().toUpperCase(Locale.ROOT));
            }
            if (text.endsWith("ms")) {
                return Duration.ofMillis(Long.parseLong(text.substring(0, text.length() - 2).trim()));
            }
            if (text.endsWith("s")) {
                return Duration.ofSeconds(Long.parseLong(text.substring(0, text.length() - 1).trim()));
            }
            if (text.endsWith("m")) {
                return Duration.ofMinutes(Long.parseLong(text.substring(0, text.length() - 1).trim()));
            }
            if (text.endsWith("h")) {
                return Duration.ofHours(Long.parseLong(text.substring(0, text.length() - 1).trim()));
            }
            return Duration.ofMillis(Long.parseLong(text));
        } catch (NumberFormatException | DateTimeParseException | ArithmeticException e) {
            throw new ConfigurationException("Invalid duration for " + key + ": '" + value + "'", e);
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid integer for " + key + ": '" + value + "'", e);
        }
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid number for " + key + ": '" + value + "'", e);
        }
    }

    private static List<FailureId> parseKinds(String key, String value) {
        List<FailureId> kinds = new ArrayList<>();
        for (String part : value.split(",")) {
            if (part.isBlank()) {
                continue;
            }
            try {
                kinds.add(FailureId.parse(part.trim()));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid failure kind for " + key + ": '" + part.trim() + "'", e);
            }
        }
        return kinds;
    }

    private static String get(Properties properties, String key) {
        String value = properties.getProperty(key);
        return value == null || value.isBlank() ? null : value;
    }

    public static final class Builder {
        private Duration ttl = DEFAULT_TTL;
        private int maxConcurrency = DEFAULT_MAX_CONCURRENCY;
        private int cacheCapacity = 0;
        private RetryConfig retry = RetryConfig.defaults();

        private Builder() {}

        public Builder ttl(Duration ttl) {
            this.ttl = ttl;
            return this;
        }

        public Builder maxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        /**
         * Sets the cache capacity (optional, defaults to 0, unbounded).
         */
        public Builder cacheCapacity(int cacheCapacity) {
            this.cacheCapacity = cacheCapacity;
            return this;
        }

        public Builder retry(RetryConfig retry) {
            this.retry = retry;
            return this;
        }

        public OrchestratorConfig build() {
            return new OrchestratorConfig(ttl, maxConcurrency, cacheCapacity, retry);
        }
    }
}
