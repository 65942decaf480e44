package com.memeinsight.marketdata.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable cache entry: the fetched value with its fetch instant and the TTL it
 * was stored under.
 */
public record CacheEntry<T>(
    String key,
    T value,
    Instant fetchedAt,
    Duration ttl
) {
    public boolean isFresh(Instant now) {
        return now.isBefore(expiresAt());
    }

    public Instant expiresAt() {
        return fetchedAt.plus(ttl);
    }
}
