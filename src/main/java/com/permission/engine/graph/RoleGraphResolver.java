package com.permission.engine.graph;

import com.permission.engine.cache.CacheTier;
import com.permission.engine.cache.PermissionCache;
import com.permission.engine.core.error.CircularInheritanceException;
import com.permission.engine.core.error.PermissionException;
import com.permission.engine.core.error.RoleNotFoundException;
import com.permission.engine.core.model.PermissionConfiguration;
import com.permission.engine.core.model.Role;
import com.permission.engine.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Flattens a role and everything it inherits, transitively, into one permission set.
 *
 * <h2>Algorithm</h2>
 * <p>Depth-first expansion starting with the role's own permissions, then each parent in
 * {@code inherits} order. Each top-level call tracks the roles on the current expansion
 * path; reaching a role that is already on the path raises
 * {@link CircularInheritanceException} for that role. A parent name absent from the
 * configuration raises {@link RoleNotFoundException}. Shared ancestors (diamonds) are legal
 * and expanded once per call.</p>
 *
 * <h2>Caching</h2>
 * <p>A role is written to the {@link CacheTier#ROLE_PERMISSIONS} tier only after its own
 * expansion completed, so a failed resolution never leaves a partial entry behind. Parents
 * resolved on the way are cached as well and serve later sibling lookups.</p>
 */
public class RoleGraphResolver {
    private static final Logger log = LoggerFactory.getLogger(RoleGraphResolver.class);

    private final PermissionCache cache;
    private final MetricsService metricsService;

    public RoleGraphResolver(PermissionCache cache, MetricsService metricsService) {
        this.cache = cache;
        this.metricsService = metricsService;
    }

    /**
     * Resolves the effective permission set of a role.
     *
     * @param configuration the snapshot to resolve against
     * @param roleName      the role to resolve
     * @return insertion-ordered, unmodifiable, duplicate-free permission set
     * @throws RoleNotFoundException        if the role or any ancestor does not exist
     * @throws CircularInheritanceException if the role graph reachable from the role has a cycle
     */
    public Set<String> resolvePermissions(PermissionConfiguration configuration, String roleName) {
        return new Expansion(configuration).resolve(roleName);
    }

    /**
     * Resolves every role of the configuration and collects the failures by role name.
     * Successful resolutions are cached like regular lookups.
     *
     * @return failures keyed by the role whose resolution failed, empty when the graph is sound
     */
    public Map<String, PermissionException> verify(PermissionConfiguration configuration) {
        Map<String, PermissionException> failures = new LinkedHashMap<>();
        for (String roleName : configuration.roleNames()) {
            try {
                resolvePermissions(configuration, roleName);
            } catch (RoleNotFoundException | CircularInheritanceException e) {
                failures.put(roleName, e);
            }
        }
        return failures;
    }

    /**
     * State of one top-level resolution.
     */
    private final class Expansion {
        private final PermissionConfiguration configuration;
        private final Set<String> path = new LinkedHashSet<>();
        private final Map<String, Set<String>> resolved = new HashMap<>();

        Expansion(PermissionConfiguration configuration) {
            this.configuration = configuration;
        }

        Set<String> resolve(String roleName) {
            Set<String> done = resolved.get(roleName);
            if (done != null) {
                return done;
            }

            Optional<Set<String>> cached = cache.getRolePermissions(roleName);
            if (cached.isPresent()) {
                metricsService.recordCacheHit(CacheTier.ROLE_PERMISSIONS);
                return cached.get();
            }
            metricsService.recordCacheMiss(CacheTier.ROLE_PERMISSIONS);

            Role role = configuration.getRole(roleName)
                    .orElseThrow(() -> new RoleNotFoundException(roleName));

            if (!path.add(roleName)) {
                throw new CircularInheritanceException(roleName);
            }

            Set<String> permissions = new LinkedHashSet<>(role.permissions());
            for (String parent : role.inherits()) {
                permissions.addAll(resolve(parent));
            }
            path.remove(roleName);

            Set<String> result = Collections.unmodifiableSet(permissions);
            resolved.put(roleName, result);
            cache.putRolePermissions(roleName, result);
            log.debug("Resolved role '{}' to {} permissions", roleName, result.size());
            return result;
        }
    }
}
