package com.coinpulse.core.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory cache with a single TTL and lazy expiry.
 *
 * Expired entries are treated as absent but stay in the map until the same key is
 * written again. The key space is bounded by the distinct query shapes issued, so
 * there is no eviction beyond that.
 */
public class TtlCacheStore implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(TtlCacheStore.class);

    public static final Duration DEFAULT_TTL = Duration.ofSeconds(300);

    private final Map<CacheKey, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    public TtlCacheStore() {
        this(Clock.systemUTC(), DEFAULT_TTL);
    }

    public TtlCacheStore(Clock clock, Duration ttl) {
        this.clock = Objects.requireNonNull(clock, "clock");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive: " + ttl);
        }
        this.ttl = ttl;
    }

    @Override
    public Optional<Object> get(CacheKey key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!entry.isFresh(clock.instant(), ttl)) {
            log.debug("Cache entry expired: {}", key);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void put(CacheKey key, Object value) {
        Objects.requireNonNull(value, "value");
        entries.put(key, new CacheEntry(key, value, clock.instant()));
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public void clear() {
        entries.clear();
    }

    public Duration getTtl() {
        return ttl;
    }
}
