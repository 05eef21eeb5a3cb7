package org.javai.callguard.cache;

import org.javai.callguard.ConfigurationException;
import org.javai.callguard.Futures;
import org.javai.callguard.Operation;
import org.javai.callguard.ops.CompositeOpReporter;
import org.javai.callguard.ops.OpReporter;
import org.javai.callguard.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A time-to-live cache that serves stale values while refreshing them in the background.
 *
 * <p>{@link #getOrFetch} behaves as follows:</p>
 * <ul>
 *   <li>fresh hit: the stored value, without calling the fetcher;</li>
 *   <li>expired hit, no refresh running: the stale value at once, and one background refresh starts;</li>
 *   <li>expired hit, refresh running: the stale value, no second refresh;</li>
 *   <li>miss: the caller waits for the fetcher; success is stored, failure propagates and
 *       nothing is stored.</li>
 * </ul>
 *
 * <p>A failed refresh keeps the stale value; the failure is logged and reported, never
 * surfaced to callers. A refresh that settles after its entry was invalidated or replaced is
 * discarded.</p>
 *
 * <p>With a capacity, the least recently used entry is evicted before a new key is inserted,
 * so the cache never holds more than {@code capacity} entries. Capacity 0 means unbounded.</p>
 */
public final class TtlCache {

    private static final Logger log = LoggerFactory.getLogger(TtlCache.class);

    public static final int UNBOUNDED = 0;

    private final Clock clock;
    private final int capacity;
    private final OpReporter reporter;
    private final ReentrantLock lock = new ReentrantLock();
    // access order, eldest first
    private final LinkedHashMap<String, CacheEntry<?>> entries = new LinkedHashMap<>(16, 0.75f, true);

    public TtlCache(Clock clock) {
        this(clock, UNBOUNDED, OpReporter.noOp());
    }

    /**
     * @param clock time source for freshness checks
     * @param capacity maximum number of entries, or {@link #UNBOUNDED}
     * @param reporter receives background refresh failures
     * @throws ConfigurationException if capacity is negative
     */
    public TtlCache(Clock clock, int capacity, OpReporter reporter) {
        if (capacity < 0) {
            throw new ConfigurationException("capacity must be >= 0, was: " + capacity);
        }
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.capacity = capacity;
        this.reporter = CompositeOpReporter.of(Objects.requireNonNull(reporter, "reporter must not be null"));
    }

    /**
     * Returns the cached value for {@code key}, fetching it on a miss.
     *
     * @param key the cache key
     * @param fetcher produces the value on a miss or refresh
     * @param ttl freshness window for a newly stored value
     */
    public <V> CompletableFuture<V> getOrFetch(String key, Operation<V> fetcher, Duration ttl) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(fetcher, "fetcher must not be null");
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new ConfigurationException("ttl must be positive, was: " + ttl);
        }

        CacheEntry<V> entry;
        boolean refresh = false;
        lock.lock();
        try {
            entry = lookup(key);
            if (entry != null && !entry.refreshing() && entry.isExpired(clock.now())) {
                entry = entry.markRefreshing();
                entries.put(key, entry);
                refresh = true;
            }
        } finally {
            lock.unlock();
        }

        if (entry == null) {
            return fetchAndStore(key, fetcher, ttl);
        }
        if (refresh) {
            refreshInBackground(key, entry, fetcher, ttl);
        }
        return CompletableFuture.completedFuture(entry.value());
    }

    /**
     * @return the stored value whether fresh or stale, without fetching
     */
    public <V> Optional<V> peek(String key) {
        lock.lock();
        try {
            CacheEntry<V> entry = lookup(key);
            return entry == null ? Optional.empty() : Optional.ofNullable(entry.value());
        } finally {
            lock.unlock();
        }
    }

    public boolean isRefreshing(String key) {
        lock.lock();
        try {
            CacheEntry<?> entry = entries.get(key);
            return entry != null && entry.refreshing();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the entry for {@code key}. A refresh in flight for it is discarded when it settles.
     *
     * @return true if an entry was removed
     */
    public boolean invalidate(String key) {
        lock.lock();
        try {
            return entries.remove(key) != null;
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    private <V> CompletableFuture<V> fetchAndStore(String key, Operation<V> fetcher, Duration ttl) {
        CompletableFuture<V> fetched = Futures.start(fetcher);
        CompletableFuture<V> result = new CompletableFuture<>();
        fetched.whenComplete((value, error) -> {
            if (error != null) {
                result.completeExceptionally(Futures.unwrap(error));
                return;
            }
            store(key, CacheEntry.fresh(value, clock.now(), ttl));
            result.complete(value);
        });
        Futures.propagateCancellation(result, fetched);
        return result;
    }

    private <V> void refreshInBackground(String key, CacheEntry<V> marked, Operation<V> fetcher, Duration ttl) {
        log.debug("Entry [{}] expired; refreshing in background", key);
        Futures.start(fetcher).whenComplete((value, error) -> {
            lock.lock();
            try {
                // only the refresh that marked the current entry may replace it
                if (entries.get(key) == marked) {
                    entries.put(key, error == null
                            ? CacheEntry.fresh(value, clock.now(), ttl)
                            : marked.clearRefreshing());
                }
            } finally {
                lock.unlock();
            }
            if (error != null) {
                Throwable cause = Futures.unwrap(error);
                log.warn("Background refresh of [{}] failed; keeping stale value", key, cause);
                reporter.reportRefreshFailure(key, cause);
            }
        });
    }

    private void store(String key, CacheEntry<?> entry) {
        lock.lock();
        try {
            if (capacity != UNBOUNDED && !entries.containsKey(key)) {
                Iterator<Map.Entry<String, CacheEntry<?>>> eldest = entries.entrySet().iterator();
                while (entries.size() >= capacity && eldest.hasNext()) {
                    String evicted = eldest.next().getKey();
                    eldest.remove();
                    log.debug("Evicted least recently used entry [{}]", evicted);
                }
            }
            entries.put(key, entry);
        } finally {
            lock.unlock();
        }
    }

    @SuppressWarnings("unchecked")
    private <V> CacheEntry<V> lookup(String key) {
        return (CacheEntry<V>) entries.get(key);
    }
}
