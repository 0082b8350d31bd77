package com.coinpulse.core.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * Cached value with the moment it was stored.
 */
public record CacheEntry(CacheKey key, Object value, Instant insertedAt) {

    /**
     * Fresh while {@code now - insertedAt < ttl}.
     */
    public boolean isFresh(Instant now, Duration ttl) {
        return Duration.between(insertedAt, now).compareTo(ttl) < 0;
    }
}
