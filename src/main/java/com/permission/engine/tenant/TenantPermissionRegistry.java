package com.permission.engine.tenant;

import com.permission.engine.api.PermissionEngine;
import com.permission.engine.api.PermissionEngineOptions;
import com.permission.engine.core.model.PermissionConfiguration;
import com.permission.engine.core.model.User;
import com.permission.engine.event.PermissionEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Keeps one isolated {@link PermissionEngine} per tenant. Roles, overrides and caches are
 * never shared between tenants: a role created in tenant A is unknown in tenant B.
 */
public class TenantPermissionRegistry implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TenantPermissionRegistry.class);

    private final PermissionEngineOptions options;
    private final List<PermissionEventListener> listeners;
    private final ConcurrentMap<String, PermissionEngine> engines = new ConcurrentHashMap<>();

    public TenantPermissionRegistry() {
        this(PermissionEngineOptions.defaults(), List.of());
    }

    /**
     * @param options   options applied to every tenant engine
     * @param listeners listeners registered with every tenant engine, e.g. a shared audit service
     */
    public TenantPermissionRegistry(PermissionEngineOptions options, List<PermissionEventListener> listeners) {
        this.options = options;
        this.listeners = List.copyOf(listeners);
    }

    public PermissionEngine createTenant(String tenantId) {
        return createTenant(tenantId, PermissionConfiguration.empty());
    }

    /**
     * Creates a tenant with an initial configuration.
     *
     * @throws IllegalArgumentException if the id is blank or the tenant already exists
     */
    public PermissionEngine createTenant(String tenantId, PermissionConfiguration configuration) {
        validateTenantId(tenantId);
        PermissionEngine.Builder builder = PermissionEngine.builder()
                .configuration(configuration)
                .options(options);
        listeners.forEach(builder::listener);
        PermissionEngine engine = builder.build();
        if (engines.putIfAbsent(tenantId, engine) != null) {
            engine.close();
            throw new IllegalArgumentException("Tenant already exists: " + tenantId);
        }
        log.info("Created tenant {}", tenantId);
        return engine;
    }

    public void createRole(String tenantId, String roleName, List<String> permissions) {
        engine(tenantId).addRole(roleName, permissions);
    }

    public void createRole(String tenantId, String roleName, List<String> permissions, List<String> inherits) {
        engine(tenantId).addRole(roleName, permissions, inherits);
    }

    public boolean hasPermission(String tenantId, User user, String permission) {
        return engine(tenantId).hasPermission(user, permission);
    }

    public boolean hasPermission(String tenantId, User user, String permission, String context) {
        return engine(tenantId).hasPermission(user, permission, context);
    }

    public void addPermissionToRole(String tenantId, String roleName, String permission) {
        engine(tenantId).addPermissionToRole(roleName, permission);
    }

    public void revokePermissionFromRole(String tenantId, String roleName, String permission) {
        engine(tenantId).revokePermissionFromRole(roleName, permission);
    }

    /**
     * Returns the tenant's engine.
     *
     * @throws IllegalArgumentException if the tenant does not exist
     */
    public PermissionEngine engine(String tenantId) {
        PermissionEngine engine = engines.get(tenantId);
        if (engine == null) {
            throw new IllegalArgumentException("Unknown tenant: " + tenantId);
        }
        return engine;
    }

    public Optional<PermissionEngine> findTenant(String tenantId) {
        return Optional.ofNullable(engines.get(tenantId));
    }

    /**
     * Removes a tenant and closes its engine.
     *
     * @return true if the tenant existed
     */
    public boolean removeTenant(String tenantId) {
        PermissionEngine engine = engines.remove(tenantId);
        if (engine == null) {
            return false;
        }
        engine.close();
        log.info("Removed tenant {}", tenantId);
        return true;
    }

    public Set<String> tenantIds() {
        return new TreeSet<>(engines.keySet());
    }

    @Override
    public void close() {
        engines.values().forEach(PermissionEngine::close);
        engines.clear();
    }

    private static void validateTenantId(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
    }
}
