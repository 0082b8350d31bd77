package com.coinpulse.core.cache;

import java.util.Optional;

/**
 * Key/value store for aggregated results. Values are opaque to the store.
 */
public interface CacheStore {

    /**
     * Cached value, or empty when the key was never stored or has expired.
     */
    Optional<Object> get(CacheKey key);

    /**
     * Store a value, unconditionally replacing any previous one.
     */
    void put(CacheKey key, Object value);

    /**
     * Number of stored entries, expired ones included.
     */
    int size();

    void clear();
}
