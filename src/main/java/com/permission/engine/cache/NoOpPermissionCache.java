package com.permission.engine.cache;

import com.permission.engine.decision.PermissionDecision;

import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Cache that never stores anything. Patterns are compiled on every call.
 * Used when caching is disabled.
 */
public class NoOpPermissionCache implements PermissionCache {

    @Override
    public Optional<Set<String>> getRolePermissions(String roleName) {
        return Optional.empty();
    }

    @Override
    public void putRolePermissions(String roleName, Set<String> permissions) {
        // no-op
    }

    @Override
    public Pattern getCompiledPattern(String pattern, Function<String, Pattern> compiler) {
        return compiler.apply(pattern);
    }

    @Override
    public Optional<PermissionDecision> getDecision(DecisionKey key) {
        return Optional.empty();
    }

    @Override
    public void putDecision(DecisionKey key, PermissionDecision decision) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats(CacheTier tier) {
        return CacheStats.empty();
    }
}
