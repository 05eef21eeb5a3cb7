package org.javai.callguard.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * An immutable cached value. Updates replace the whole entry, so a reader sees either the old
 * entry or the new one.
 *
 * @param value the cached value
 * @param storedAt when the value was stored
 * @param ttl how long the value stays fresh
 * @param refreshing whether a background refresh for this entry is in flight
 */
public record CacheEntry<V>(V value, Instant storedAt, Duration ttl, boolean refreshing) {

    public CacheEntry {
        Objects.requireNonNull(storedAt, "storedAt must not be null");
        Objects.requireNonNull(ttl, "ttl must not be null");
    }

    public static <V> CacheEntry<V> fresh(V value, Instant storedAt, Duration ttl) {
        return new CacheEntry<>(value, storedAt, ttl, false);
    }

    public Instant expiresAt() {
        return storedAt.plus(ttl);
    }

    /**
     * An entry is fresh while {@code now - storedAt < ttl}.
     */
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt());
    }

    CacheEntry<V> markRefreshing() {
        return new CacheEntry<>(value, storedAt, ttl, true);
    }

    CacheEntry<V> clearRefreshing() {
        return new CacheEntry<>(value, storedAt, ttl, false);
    }
}
