package com.permission.engine.cache;

import com.permission.engine.decision.PermissionDecision;

import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Memoization for role resolution, wildcard compilation and final decisions.
 *
 * <p>The cache is purely an optimization: an entry is only valid for the configuration
 * snapshot it was computed from, and {@link #invalidateAll()} must be called before any
 * read that follows a configuration change.</p>
 */
public interface PermissionCache {

    /**
     * Gets the flattened permission set of a role.
     *
     * @param roleName the role name
     * @return the cached set, or empty if not cached
     */
    Optional<Set<String>> getRolePermissions(String roleName);

    /**
     * Caches the flattened permission set of a fully resolved role.
     */
    void putRolePermissions(String roleName, Set<String> permissions);

    /**
     * Returns the compiled form of a wildcard pattern, compiling it on a miss.
     *
     * @param pattern  the literal pattern string
     * @param compiler compiles the pattern on a miss
     * @return the compiled pattern
     */
    Pattern getCompiledPattern(String pattern, Function<String, Pattern> compiler);

    Optional<PermissionDecision> getDecision(DecisionKey key);

    void putDecision(DecisionKey key, PermissionDecision decision);

    /**
     * Drops every entry of every tier.
     */
    void invalidateAll();

    /**
     * Returns statistics for one tier.
     */
    CacheStats getStats(CacheTier tier);
}
