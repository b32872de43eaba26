package com.permission.engine.api;

import com.permission.engine.cache.CacheConfig;

/**
 * Options for a {@link PermissionEngine}: cache sizing and the actor recorded on audit entries.
 */
public class PermissionEngineOptions {

    private static final int DEFAULT_CACHE_MAX_SIZE = 10_000;
    private static final int DEFAULT_CACHE_TTL_SECONDS = 600;
    private static final String DEFAULT_ACTOR_ID = "SYSTEM";

    private final boolean cachingEnabled;
    private final int cacheMaxSize;
    private final int cacheTtlSeconds;
    private final String actorId;

    private PermissionEngineOptions(Builder builder) {
        this.cachingEnabled = builder.cachingEnabled;
        this.cacheMaxSize = builder.cacheMaxSize;
        this.cacheTtlSeconds = builder.cacheTtlSeconds;
        this.actorId = builder.actorId;
    }

    public boolean isCachingEnabled() {
        return cachingEnabled;
    }

    public int getCacheMaxSize() {
        return cacheMaxSize;
    }

    public int getCacheTtlSeconds() {
        return cacheTtlSeconds;
    }

    public String getActorId() {
        return actorId;
    }

    public CacheConfig toCacheConfig() {
        return new CacheConfig(cacheMaxSize, cacheTtlSeconds, cachingEnabled);
    }

    public static PermissionEngineOptions defaults() {
        return builder().build();
    }

    /**
     * Options with every cache tier disabled. Decisions are recomputed on each call.
     */
    public static PermissionEngineOptions uncached() {
        return builder().cachingEnabled(false).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean cachingEnabled = true;
        private int cacheMaxSize = DEFAULT_CACHE_MAX_SIZE;
        private int cacheTtlSeconds = DEFAULT_CACHE_TTL_SECONDS;
        private String actorId = DEFAULT_ACTOR_ID;

        public Builder cachingEnabled(boolean cachingEnabled) {
            this.cachingEnabled = cachingEnabled;
            return this;
        }

        public Builder cacheMaxSize(int cacheMaxSize) {
            if (cacheMaxSize <= 0) {
                throw new IllegalArgumentException("cacheMaxSize must be > 0");
            }
            this.cacheMaxSize = cacheMaxSize;
            return this;
        }

        public Builder cacheTtlSeconds(int cacheTtlSeconds) {
            if (cacheTtlSeconds <= 0) {
                throw new IllegalArgumentException("cacheTtlSeconds must be > 0");
            }
            this.cacheTtlSeconds = cacheTtlSeconds;
            return this;
        }

        public Builder actorId(String actorId) {
            if (actorId == null || actorId.isBlank()) {
                throw new IllegalArgumentException("actorId must not be blank");
            }
            this.actorId = actorId;
            return this;
        }

        public PermissionEngineOptions build() {
            return new PermissionEngineOptions(this);
        }
    }
}
