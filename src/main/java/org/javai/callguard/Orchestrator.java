package org.javai.callguard;

import org.javai.callguard.boundary.DefaultFailureClassifier;
import org.javai.callguard.boundary.FailureClassifier;
import org.javai.callguard.cache.TtlCache;
import org.javai.callguard.dedup.Deduplicator;
import org.javai.callguard.limit.ConcurrencyLimiter;
import org.javai.callguard.ops.OpReporter;
import org.javai.callguard.retry.BackoffRetryPolicy;
import org.javai.callguard.retry.Retrier;
import org.javai.callguard.retry.RetryConfig;
import org.javai.callguard.retry.RetryPolicy;
import org.javai.callguard.time.Clock;
import org.javai.callguard.time.Timeouts;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * The single entry point for resilient outbound calls.
 *
 * <p>{@link #execute} composes the components in this order:</p>
 * <ol>
 *   <li>{@link Deduplicator}: concurrent calls for the same key share one execution;</li>
 *   <li>{@link TtlCache}: a fresh value is returned, a stale one is returned and refreshed;</li>
 *   <li>{@link ConcurrencyLimiter}: a miss waits for a slot in the shared pool;</li>
 *   <li>{@link Retrier}: within the slot the operation runs under the retry policy.</li>
 * </ol>
 *
 * <p>The caller receives the value, or one terminal error: {@link RetriesExhaustedException}
 * carrying the attempt count and the last cause, or the original exception of a failure that
 * is not retryable.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Orchestrator orchestrator = Orchestrator.builder()
 *     .config(OrchestratorConfig.load())
 *     .reporter(new Log4jOpReporter())
 *     .build();
 *
 * CompletableFuture<User> user = orchestrator.execute("user:1", () -> client.fetchUser(1));
 * }</pre>
 */
public final class Orchestrator {

    private final OrchestratorConfig config;
    private final Clock clock;
    private final Deduplicator deduplicator;
    private final TtlCache cache;
    private final ConcurrencyLimiter limiter;
    private final Retrier retrier;
    private final DoubleSupplier jitter;

    private Orchestrator(Builder builder) {
        this.config = builder.config;
        this.clock = builder.clock;
        this.jitter = builder.jitter;
        this.deduplicator = new Deduplicator();
        this.cache = builder.cache != null
                ? builder.cache
                : new TtlCache(clock, config.cacheCapacity(), builder.reporter);
        this.limiter = new ConcurrencyLimiter(config.maxConcurrency());
        this.retrier = Retrier.builder()
                .classifier(builder.classifier)
                .reporter(builder.reporter)
                .clock(clock)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private OrchestratorConfig config = OrchestratorConfig.defaults();
        private Clock clock = Clock.system();
        private FailureClassifier classifier = new DefaultFailureClassifier();
        private OpReporter reporter = OpReporter.noOp();
        private TtlCache cache;
        private DoubleSupplier jitter = () -> ThreadLocalRandom.current().nextDouble();

        private Builder() {}

        public Builder config(OrchestratorConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public Builder classifier(FailureClassifier classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
            return this;
        }

        public Builder reporter(OpReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Uses a prebuilt cache (optional). By default one is created from the config's capacity.
         */
        public Builder cache(TtlCache cache) {
            this.cache = Objects.requireNonNull(cache, "cache must not be null");
            return this;
        }

        /**
         * Sets the source of uniform values in [0, 1) used for retry jitter.
         */
        public Builder jitter(DoubleSupplier jitter) {
            this.jitter = Objects.requireNonNull(jitter, "jitter must not be null");
            return this;
        }

        public Orchestrator build() {
            return new Orchestrator(this);
        }
    }

    /**
     * Executes with the configured ttl and retry settings.
     */
    public <T> CompletableFuture<T> execute(String key, Operation<T> operation) {
        return execute(key, operation, CallOptions.defaults());
    }

    /**
     * Executes {@code operation} for {@code key}.
     *
     * @param key identifies the result for deduplication and caching
     * @param operation the outbound call, started once per attempt
     * @param options per-call overrides of ttl and retry settings
     * @return a future with the value or the terminal error; cancelling it detaches this caller
     */
    public <T> CompletableFuture<T> execute(String key, Operation<T> operation, CallOptions options) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(options, "options must not be null");

        Duration ttl = options.ttlOr(config.ttl());
        RetryConfig retry = options.retryOr(config.retry());
        RetryPolicy policy = new BackoffRetryPolicy("backoff", retry, jitter);
        Operation<T> attempt = Timeouts.bound(clock, operation, retry.attemptTimeout(), key);
        Operation<T> fetch = () -> limiter.run(() -> retrier.execute(key, policy, attempt));

        return deduplicator.dedupe(key, () -> cache.getOrFetch(key, fetch, ttl));
    }

    /**
     * Drops the cached value for {@code key}; the next call fetches afresh.
     *
     * @return true if a value was cached
     */
    public boolean invalidate(String key) {
        return cache.invalidate(key);
    }

    public OrchestratorConfig config() {
        return config;
    }

    public TtlCache cache() {
        return cache;
    }

    public ConcurrencyLimiter limiter() {
        return limiter;
    }

    public Deduplicator deduplicator() {
        return deduplicator;
    }
}
