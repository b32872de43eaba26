package com.permission.engine.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.permission.engine.decision.PermissionDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Caffeine-backed permission cache with one bounded cache per {@link CacheTier}.
 *
 * <p>Compiled patterns do not depend on the configuration and carry no TTL, but they are
 * still dropped by {@link #invalidateAll()} so all tiers are reset together.</p>
 */
public class CaffeinePermissionCache implements PermissionCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeinePermissionCache.class);

    private final Cache<String, Set<String>> rolePermissions;
    private final Cache<String, Pattern> compiledPatterns;
    private final Cache<DecisionKey, PermissionDecision> decisions;

    public CaffeinePermissionCache(CacheConfig config) {
        Duration ttl = Duration.ofSeconds(config.ttlSeconds());
        this.rolePermissions = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(ttl)
                .recordStats()
                .build();
        this.compiledPatterns = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .recordStats()
                .build();
        this.decisions = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(ttl)
                .recordStats()
                .build();
        log.info("CaffeinePermissionCache initialized: maxSize={}, ttl={}s",
                config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<Set<String>> getRolePermissions(String roleName) {
        return Optional.ofNullable(rolePermissions.getIfPresent(roleName));
    }

    @Override
    public void putRolePermissions(String roleName, Set<String> permissions) {
        rolePermissions.put(roleName, permissions);
    }

    @Override
    public Pattern getCompiledPattern(String pattern, Function<String, Pattern> compiler) {
        return compiledPatterns.get(pattern, compiler);
    }

    @Override
    public Optional<PermissionDecision> getDecision(DecisionKey key) {
        return Optional.ofNullable(decisions.getIfPresent(key));
    }

    @Override
    public void putDecision(DecisionKey key, PermissionDecision decision) {
        decisions.put(key, decision);
    }

    @Override
    public void invalidateAll() {
        rolePermissions.invalidateAll();
        compiledPatterns.invalidateAll();
        decisions.invalidateAll();
        log.debug("Invalidated all permission cache tiers");
    }

    @Override
    public CacheStats getStats(CacheTier tier) {
        Cache<?, ?> cache = switch (tier) {
            case ROLE_PERMISSIONS -> rolePermissions;
            case COMPILED_PATTERNS -> compiledPatterns;
            case DECISIONS -> decisions;
        };
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }
}
