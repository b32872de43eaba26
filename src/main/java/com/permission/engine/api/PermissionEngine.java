package com.permission.engine.api;

import com.permission.engine.audit.AuditRepository;
import com.permission.engine.audit.AuditService;
import com.permission.engine.cache.CacheStats;
import com.permission.engine.cache.CacheTier;
import com.permission.engine.cache.CaffeinePermissionCache;
import com.permission.engine.cache.DecisionKey;
import com.permission.engine.cache.NoOpPermissionCache;
import com.permission.engine.cache.PermissionCache;
import com.permission.engine.config.ConfigurationFileWatcher;
import com.permission.engine.config.ConfigurationSource;
import com.permission.engine.config.ConfigurationValidator;
import com.permission.engine.config.JsonFileConfigurationSource;
import com.permission.engine.core.error.PermissionException;
import com.permission.engine.core.error.RoleAlreadyExistsException;
import com.permission.engine.core.error.RoleInUseException;
import com.permission.engine.core.error.RoleNotFoundException;
import com.permission.engine.core.model.PermissionConfiguration;
import com.permission.engine.core.model.Role;
import com.permission.engine.core.model.User;
import com.permission.engine.decision.DecisionEngine;
import com.permission.engine.decision.DecisionRequest;
import com.permission.engine.decision.PermissionDecision;
import com.permission.engine.event.PermissionEvent;
import com.permission.engine.event.PermissionEventListener;
import com.permission.engine.event.PermissionEventType;
import com.permission.engine.graph.RoleGraphResolver;
import com.permission.engine.health.HealthCheckRegistry;
import com.permission.engine.health.HealthStatus;
import com.permission.engine.health.RoleGraphHealthCheck;
import com.permission.engine.logging.LogContext;
import com.permission.engine.matcher.WildcardMatcher;
import com.permission.engine.metrics.MetricsService;
import com.permission.engine.metrics.NoOpMetricsService;
import com.permission.engine.tracing.NoOpTracingService;
import com.permission.engine.tracing.Span;
import com.permission.engine.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Main entry point of the permission engine. Decides whether a user holds a permission,
 * optionally scoped by a context, and manages the roles it decides against.
 *
 * <h2>Decision order</h2>
 * <ol>
 *   <li>a matching user deny wins,</li>
 *   <li>then a matching user grant,</li>
 *   <li>then any permission of the user's role, inherited ones included;</li>
 *   <li>anything else is denied.</li>
 * </ol>
 * A missing role or an inheritance cycle is raised as an exception, never reported as a deny.
 *
 * <h2>Consistency</h2>
 * <p>The configuration is an immutable snapshot. Checks and reads share a read lock;
 * mutations, replacements and {@link #clearCache()} take the write lock for the swap and
 * the invalidation of all cache tiers, so no check ever observes a new snapshot with stale
 * cache entries. Listeners are notified after the lock is released.</p>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * PermissionEngine engine = PermissionEngine.builder()
 *     .configuration(PermissionConfiguration.builder()
 *         .role("viewer", List.of("read:articles"))
 *         .role("editor", List.of("write:articles"), List.of("viewer"))
 *         .build())
 *     .build();
 *
 * engine.hasPermission(User.of("1", "editor"), "read", "articles"); // true
 * </pre>
 */
public class PermissionEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PermissionEngine.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final PermissionEngineOptions options;
    private final PermissionCache cache;
    private final RoleGraphResolver resolver;
    private final DecisionEngine decisionEngine;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final HealthCheckRegistry healthCheckRegistry;
    private final List<PermissionEventListener> listeners = new CopyOnWriteArrayList<>();
    private final ConfigurationFileWatcher watcher;

    private PermissionConfiguration configuration;

    private PermissionEngine(Builder builder) {
        this.options = builder.options;
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();

        if (builder.cache != null) {
            this.cache = builder.cache;
        } else if (options.isCachingEnabled()) {
            this.cache = new CaffeinePermissionCache(options.toCacheConfig());
        } else {
            this.cache = new NoOpPermissionCache();
        }

        this.resolver = new RoleGraphResolver(cache, metricsService);
        this.decisionEngine = DecisionEngine.standard(resolver, new WildcardMatcher(cache));

        PermissionConfiguration initial;
        if (builder.configuration != null) {
            initial = builder.configuration;
        } else if (builder.configurationSource != null) {
            initial = builder.configurationSource.load();
        } else {
            initial = PermissionConfiguration.empty();
        }
        this.configuration = ConfigurationValidator.validate(initial);

        if (builder.auditService != null) {
            listeners.add(builder.auditService);
        } else if (builder.auditRepository != null) {
            listeners.add(new AuditService(builder.auditRepository, options.getActorId()));
        }
        listeners.addAll(builder.listeners);

        this.healthCheckRegistry = new HealthCheckRegistry();
        healthCheckRegistry.register(new RoleGraphHealthCheck(this::getConfiguration));

        if (builder.watchConfigFile && builder.configurationSource instanceof JsonFileConfigurationSource fileSource) {
            this.watcher = new ConfigurationFileWatcher(fileSource.getPath(), () -> reload(fileSource));
            watcher.start();
        } else {
            if (builder.watchConfigFile) {
                log.warn("Config file watching requested without a file configuration source, ignoring");
            }
            this.watcher = null;
        }

        log.info("PermissionEngine initialized with {} roles and {} users (caching {})",
                configuration.getRoles().size(), configuration.getUsers().size(),
                options.isCachingEnabled() ? "enabled" : "disabled");
    }

    // ========== Decision API ==========

    /**
     * Checks a permission without context.
     *
     * @throws RoleNotFoundException if the user's role, or one it inherits, does not exist
     * @throws com.permission.engine.core.error.CircularInheritanceException if the user's role graph has a cycle
     */
    public boolean hasPermission(User user, String permission) {
        return hasPermission(user, permission, null);
    }

    /**
     * Checks a permission scoped by a context. The permission and context are joined as
     * {@code permission:context}; a {@code null} or empty context checks the bare permission.
     */
    public boolean hasPermission(User user, String permission, String context) {
        return explain(user, permission, context).isGranted();
    }

    /**
     * Checks a permission and reports which rule decided it and which pattern matched.
     */
    public PermissionDecision explain(User user, String permission, String context) {
        Objects.requireNonNull(user, "user is required");
        Objects.requireNonNull(permission, "permission is required");
        String permissionKey = DecisionEngine.permissionKey(permission, context);
        long start = System.nanoTime();

        lock.readLock().lock();
        try (Span span = tracingService.startSpan(Span.CHECK, Map.of(
                Span.USER_ID, user.id(), Span.USER_ROLE, user.role(), Span.PERMISSION_KEY, permissionKey));
             LogContext ignored = LogContext.forDecision(user.id(), user.role(), permissionKey)) {
            try {
                DecisionKey key = new DecisionKey(user.id(), user.role(), permission, context);
                PermissionDecision decision = cache.getDecision(key).orElse(null);
                boolean cacheHit = decision != null;
                if (cacheHit) {
                    metricsService.recordCacheHit(CacheTier.DECISIONS);
                } else {
                    metricsService.recordCacheMiss(CacheTier.DECISIONS);
                    decision = decisionEngine.decide(DecisionRequest.of(configuration, user, permissionKey));
                    cache.putDecision(key, decision);
                }
                metricsService.recordDecision(decision.isGranted(), decision.rule());
                span.recordDecision(decision, cacheHit);
                return decision;
            } catch (PermissionException e) {
                metricsService.incrementResolutionFailure(e.getCode());
                span.recordFailure(e);
                log.warn("Permission check for user {} on '{}' failed: {}", user.id(), permissionKey, e.getMessage());
                throw e;
            }
        } finally {
            lock.readLock().unlock();
            metricsService.recordDecisionDuration(Duration.ofNanos(System.nanoTime() - start));
        }
    }

    /**
     * Returns true when every permission is granted. Stops at the first denied one;
     * resolution failures propagate. An empty collection is trivially granted.
     */
    public boolean checkAll(User user, Collection<String> permissions, String context) {
        for (String permission : permissions) {
            if (!hasPermission(user, permission, context)) {
                return false;
            }
        }
        return true;
    }

    public boolean checkAll(User user, Collection<String> permissions) {
        return checkAll(user, permissions, null);
    }

    /**
     * Returns true when at least one permission is granted. Stops at the first granted one;
     * resolution failures propagate. An empty collection is never granted.
     */
    public boolean checkAny(User user, Collection<String> permissions, String context) {
        for (String permission : permissions) {
            if (hasPermission(user, permission, context)) {
                return true;
            }
        }
        return false;
    }

    public boolean checkAny(User user, Collection<String> permissions) {
        return checkAny(user, permissions, null);
    }

    // ========== Read API ==========

    /**
     * Returns the effective permission set of a role, inherited permissions included.
     *
     * @throws RoleNotFoundException if the role or one of its ancestors does not exist
     * @throws com.permission.engine.core.error.CircularInheritanceException if the role's graph has a cycle
     */
    public Set<String> getPermissionsForRole(String roleName) {
        lock.readLock().lock();
        try (Span span = tracingService.startSpan(Span.RESOLVE_ROLE, Map.of(Span.ROLE, roleName))) {
            try {
                Set<String> permissions = resolver.resolvePermissions(configuration, roleName);
                span.setAttribute(Span.PERMISSION_COUNT, permissions.size());
                span.setStatus(Span.SpanStatus.OK);
                return permissions;
            } catch (PermissionException e) {
                metricsService.incrementResolutionFailure(e.getCode());
                span.recordFailure(e);
                throw e;
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<String> listRoles() {
        return getConfiguration().roleNames();
    }

    public List<String> listUsers() {
        return getConfiguration().userIds();
    }

    public boolean hasRole(String roleName) {
        return getConfiguration().hasRole(roleName);
    }

    /**
     * Returns the current configuration snapshot. Snapshots are immutable; later changes
     * to the engine produce new snapshots and never affect one already returned.
     */
    public PermissionConfiguration getConfiguration() {
        lock.readLock().lock();
        try {
            return configuration;
        } finally {
            lock.readLock().unlock();
        }
    }

    public CacheStats getCacheStats(CacheTier tier) {
        return cache.getStats(tier);
    }

    // ========== Role management API ==========

    public void addRole(String roleName, List<String> permissions) {
        addRole(roleName, permissions, List.of());
    }

    /**
     * Adds a new role.
     *
     * @throws RoleAlreadyExistsException if a role with that name exists
     */
    public void addRole(String roleName, List<String> permissions, List<String> inherits) {
        Objects.requireNonNull(roleName, "roleName is required");
        Role role = new Role(roleName, permissions, inherits);
        mutate("addRole", roleName, current -> {
            if (current.hasRole(roleName)) {
                throw new RoleAlreadyExistsException(roleName);
            }
            return current.withRole(role);
        });
        emit(PermissionEventType.ROLE_ADDED, roleName, Map.of(
                PermissionEvent.PERMISSIONS, role.permissions(),
                PermissionEvent.INHERITS, role.inherits()));
    }

    /**
     * Removes a role that no other role inherits from.
     *
     * @throws RoleNotFoundException if the role does not exist
     * @throws RoleInUseException    naming the roles that still inherit from it
     */
    public void removeRole(String roleName) {
        Objects.requireNonNull(roleName, "roleName is required");
        mutate("removeRole", roleName, current -> {
            if (!current.hasRole(roleName)) {
                throw new RoleNotFoundException(roleName);
            }
            List<String> dependents = new ArrayList<>(current.dependentsOf(roleName));
            dependents.remove(roleName);
            if (!dependents.isEmpty()) {
                throw new RoleInUseException(roleName, dependents);
            }
            return current.withoutRole(roleName);
        });
        emit(PermissionEventType.ROLE_REMOVED, roleName, Map.of());
    }

    /**
     * Appends a permission to a role. Duplicates are kept as given.
     *
     * @throws RoleNotFoundException if the role does not exist
     */
    public void addPermissionToRole(String roleName, String permission) {
        Objects.requireNonNull(roleName, "roleName is required");
        Objects.requireNonNull(permission, "permission is required");
        mutate("addPermission", roleName, current -> {
            Role role = current.getRole(roleName).orElseThrow(() -> new RoleNotFoundException(roleName));
            return current.withRole(role.withPermission(permission));
        });
        emit(PermissionEventType.PERMISSION_ADDED, roleName, Map.of(PermissionEvent.PERMISSION, permission));
    }

    /**
     * Removes every occurrence of a permission from a role's own list. Inherited
     * permissions are not affected.
     *
     * @throws RoleNotFoundException if the role does not exist
     */
    public void revokePermissionFromRole(String roleName, String permission) {
        Objects.requireNonNull(roleName, "roleName is required");
        Objects.requireNonNull(permission, "permission is required");
        mutate("revokePermission", roleName, current -> {
            Role role = current.getRole(roleName).orElseThrow(() -> new RoleNotFoundException(roleName));
            return current.withRole(role.withoutPermission(permission));
        });
        emit(PermissionEventType.PERMISSION_REVOKED, roleName, Map.of(PermissionEvent.PERMISSION, permission));
    }

    // ========== Configuration API ==========

    /**
     * Replaces the whole configuration. The new configuration is validated first; when
     * validation fails the current configuration and all cache entries stay in place.
     *
     * @throws com.permission.engine.core.error.ConfigurationInvalidException if the configuration is missing
     */
    public void replaceConfiguration(PermissionConfiguration newConfiguration) {
        apply(newConfiguration, "replace");
    }

    /**
     * Loads a configuration from the source and installs it.
     *
     * @throws com.permission.engine.core.error.ConfigurationLoadException    if the source fails
     * @throws com.permission.engine.core.error.ConfigurationInvalidException if the document is malformed
     */
    public PermissionConfiguration reload(ConfigurationSource source) {
        PermissionConfiguration loaded;
        try (LogContext ignored = LogContext.forReload(source.describe())) {
            try {
                loaded = source.load();
            } catch (PermissionException e) {
                metricsService.recordReload(false);
                log.warn("Reload from {} failed, keeping previous configuration: {}", source.describe(), e.getMessage());
                throw e;
            }
        }
        apply(loaded, source.describe());
        return loaded;
    }

    /**
     * Loads a configuration asynchronously and installs it once loaded. The load runs
     * without holding any engine lock; only the swap does. A failed load completes the
     * future exceptionally and leaves the current configuration in place.
     */
    public CompletableFuture<PermissionConfiguration> reloadAsync(ConfigurationSource source) {
        return source.loadAsync()
                .whenComplete((loaded, error) -> {
                    if (error != null) {
                        metricsService.recordReload(false);
                        log.warn("Asynchronous reload from {} failed, keeping previous configuration: {}",
                                source.describe(), error.getMessage());
                    }
                })
                .thenApply(loaded -> {
                    apply(loaded, source.describe());
                    return loaded;
                });
    }

    private void apply(PermissionConfiguration newConfiguration, String sourceDescription) {
        try (LogContext ignored = LogContext.forReload(sourceDescription);
             Span span = tracingService.startSpan(Span.RELOAD, Map.of(Span.CONFIG_SOURCE, sourceDescription))) {
            try {
                ConfigurationValidator.validate(newConfiguration);
            } catch (PermissionException e) {
                metricsService.recordReload(false);
                span.recordFailure(e);
                log.warn("Rejected configuration from {}: {}", sourceDescription, e.getMessage());
                throw e;
            }

            lock.writeLock().lock();
            try {
                configuration = newConfiguration;
                cache.invalidateAll();
            } finally {
                lock.writeLock().unlock();
            }
            metricsService.recordReload(true);
            span.setAttribute(Span.ROLE_COUNT, newConfiguration.getRoles().size());
            span.setStatus(Span.SpanStatus.OK);
            log.info("Configuration installed from {}: {} roles, {} users", sourceDescription,
                    newConfiguration.getRoles().size(), newConfiguration.getUsers().size());
        }
        emit(PermissionEventType.CONFIGURATION_RELOADED, null, Map.of(
                PermissionEvent.SOURCE, sourceDescription,
                PermissionEvent.ROLE_COUNT, newConfiguration.getRoles().size(),
                PermissionEvent.USER_COUNT, newConfiguration.getUsers().size()));
    }

    /**
     * Drops every cache tier. Never changes the outcome of any check.
     */
    public void clearCache() {
        lock.writeLock().lock();
        try {
            cache.invalidateAll();
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Permission caches cleared");
    }

    // ========== Listeners ==========

    public void addListener(PermissionEventListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    public void removeListener(PermissionEventListener listener) {
        listeners.remove(listener);
    }

    // ========== Health ==========

    /**
     * Returns the aggregate health of the engine. DOWN when any role cannot be resolved.
     */
    public HealthStatus health() {
        return healthCheckRegistry.checkAll();
    }

    public PermissionEngineOptions getOptions() {
        return options;
    }

    @Override
    public void close() {
        if (watcher != null) {
            watcher.close();
        }
        log.info("PermissionEngine closed");
    }

    private interface Mutation {
        PermissionConfiguration apply(PermissionConfiguration current);
    }

    private void mutate(String operation, String roleName, Mutation mutation) {
        try (LogContext ignored = LogContext.forMutation(operation, roleName);
             Span span = tracingService.startSpan("permission." + operation, Map.of(Span.ROLE, roleName))) {
            lock.writeLock().lock();
            try {
                PermissionConfiguration updated = mutation.apply(configuration);
                configuration = updated;
                cache.invalidateAll();
            } catch (PermissionException e) {
                span.recordFailure(e);
                log.warn("{} rejected for role '{}': {}", operation, roleName, e.getMessage());
                throw e;
            } finally {
                lock.writeLock().unlock();
            }
            metricsService.incrementRoleMutation(operation);
            span.setStatus(Span.SpanStatus.OK);
            log.info("{} applied to role '{}'", operation, roleName);
        }
    }

    private void emit(PermissionEventType type, String roleName, Map<String, Object> details) {
        if (listeners.isEmpty()) {
            return;
        }
        PermissionEvent event = PermissionEvent.of(type, roleName, details);
        for (PermissionEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (Exception e) {
                log.warn("Permission event listener notification failed: {}", e.getMessage());
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private PermissionConfiguration configuration;
        private ConfigurationSource configurationSource;
        private boolean watchConfigFile = false;
        private PermissionEngineOptions options = PermissionEngineOptions.defaults();
        private PermissionCache cache;
        private MetricsService metricsService;
        private TracingService tracingService;
        private AuditService auditService;
        private AuditRepository auditRepository;
        private final List<PermissionEventListener> listeners = new ArrayList<>();

        /**
         * Sets the initial configuration. Takes precedence over a configuration source.
         */
        public Builder configuration(PermissionConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        /**
         * Loads the initial configuration from a source at build time.
         */
        public Builder configurationSource(ConfigurationSource configurationSource) {
            this.configurationSource = configurationSource;
            return this;
        }

        /**
         * Loads the initial configuration from a JSON file.
         */
        public Builder configFile(Path path) {
            return configurationSource(new JsonFileConfigurationSource(path));
        }

        /**
         * Reloads the configuration file whenever it changes. Requires a file source;
         * the watcher is stopped when the engine is closed.
         */
        public Builder watchConfigFile(boolean watchConfigFile) {
            this.watchConfigFile = watchConfigFile;
            return this;
        }

        public Builder options(PermissionEngineOptions options) {
            this.options = Objects.requireNonNull(options, "options is required");
            return this;
        }

        /**
         * Uses a custom cache instead of the one derived from the options.
         */
        public Builder cache(PermissionCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        /**
         * Records every committed change through the audit service.
         */
        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        /**
         * Records every committed change into the repository, attributed to the
         * options' actor id. Ignored when an audit service is set.
         */
        public Builder auditRepository(AuditRepository auditRepository) {
            this.auditRepository = auditRepository;
            return this;
        }

        public Builder listener(PermissionEventListener listener) {
            if (listener != null) {
                this.listeners.add(listener);
            }
            return this;
        }

        public PermissionEngine build() {
            return new PermissionEngine(this);
        }
    }
}
