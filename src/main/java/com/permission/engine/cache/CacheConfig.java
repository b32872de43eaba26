package com.permission.engine.cache;

/**
 * Configuration for the permission cache tiers.
 *
 * @param maxSize    maximum number of entries per tier
 * @param ttlSeconds time-to-live in seconds for role and decision entries
 * @param enabled    whether caching is enabled
 */
public record CacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * Default cache configuration: 10,000 entries per tier, 600s TTL, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(10_000, 600, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }
}
