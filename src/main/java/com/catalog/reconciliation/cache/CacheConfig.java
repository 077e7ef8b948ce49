package com.catalog.reconciliation.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for the memoized cache.
 *
 * @param maxSize    maximum number of entries
 * @param defaultTtl time-to-live used when a caller does not pass one
 * @param enabled    whether caching is enabled
 */
public record CacheConfig(int maxSize, Duration defaultTtl, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        Objects.requireNonNull(defaultTtl, "defaultTtl is required");
        if (defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new IllegalArgumentException("defaultTtl must be > 0");
        }
    }

    /**
     * Default cache configuration: 1,000 entries, 10 minute TTL, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(1_000, Duration.ofMinutes(10), true);
    }

    /**
     * Disabled cache configuration: every call runs its producer.
     */
    public static CacheConfig disabled() {
        return new CacheConfig(1, Duration.ofSeconds(1), false);
    }
}
