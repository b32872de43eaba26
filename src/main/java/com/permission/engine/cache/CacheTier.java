package com.permission.engine.cache;

/**
 * The three memoization tiers of the engine. All of them are dropped together
 * whenever the configuration changes.
 */
public enum CacheTier {
    /** Flattened permission set per role name. */
    ROLE_PERMISSIONS,
    /** Compiled wildcard matcher per literal pattern. */
    COMPILED_PATTERNS,
    /** Final decision per (user, role, permission, context). */
    DECISIONS
}
