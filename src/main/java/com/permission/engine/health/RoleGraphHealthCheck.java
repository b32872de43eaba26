package com.permission.engine.health;

import com.permission.engine.cache.NoOpPermissionCache;
import com.permission.engine.core.error.PermissionException;
import com.permission.engine.core.model.PermissionConfiguration;
import com.permission.engine.graph.RoleGraphResolver;
import com.permission.engine.metrics.NoOpMetricsService;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Resolves every role of the current configuration. DOWN when any role has a missing
 * ancestor or sits on an inheritance cycle, with the failing roles as details.
 * Uses its own uncached resolver so checks never touch the engine's cache.
 */
public class RoleGraphHealthCheck implements HealthCheck {

    private final Supplier<PermissionConfiguration> configuration;
    private final RoleGraphResolver resolver = new RoleGraphResolver(new NoOpPermissionCache(), new NoOpMetricsService());

    public RoleGraphHealthCheck(Supplier<PermissionConfiguration> configuration) {
        this.configuration = configuration;
    }

    @Override
    public String getName() {
        return "roleGraph";
    }

    @Override
    public HealthStatus check() {
        PermissionConfiguration snapshot = configuration.get();
        Map<String, PermissionException> failures = resolver.verify(snapshot);
        if (failures.isEmpty()) {
            return HealthStatus.up().withDetail("roles", snapshot.getRoles().size());
        }
        Map<String, Object> details = new LinkedHashMap<>();
        failures.forEach((role, error) -> details.put(role, error.getCode().name() + ": " + error.getMessage()));
        return HealthStatus.down(failures.size() + " role(s) cannot be resolved").withDetails(details);
    }
}
