package com.permission.engine.cdi;

import com.permission.engine.api.PermissionEngine;
import com.permission.engine.api.PermissionEngineOptions;
import com.permission.engine.audit.AuditRepository;
import com.permission.engine.audit.AuditService;
import com.permission.engine.audit.InMemoryAuditRepository;
import com.permission.engine.audit.JsonLinesAuditRepository;
import com.permission.engine.config.JsonFileConfigurationSource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * CDI producer that wires the permission engine from MicroProfile Config properties.
 *
 * <pre>
 * permission-engine:
 *   config:
 *     path: /etc/app/permissions.json
 *     watch: true
 *   cache:
 *     enabled: true
 *     max-size: 10000
 *     ttl-seconds: 600
 *   audit:
 *     log-path: /var/log/app/permission-audit.log
 *   actor-id: SYSTEM
 * </pre>
 *
 * <p>When the configuration file does not exist the engine starts with an empty
 * configuration and file watching is skipped.</p>
 */
@ApplicationScoped
public class PermissionEngineProducer {

    private static final Logger log = LoggerFactory.getLogger(PermissionEngineProducer.class);

    // ── Configuration source ──────────────────────────────────

    @Inject
    @ConfigProperty(name = "permission-engine.config.path", defaultValue = JsonFileConfigurationSource.DEFAULT_FILE_NAME)
    String configPath;

    @Inject
    @ConfigProperty(name = "permission-engine.config.watch", defaultValue = "false")
    boolean watchConfig;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "permission-engine.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "permission-engine.cache.max-size", defaultValue = "10000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "permission-engine.cache.ttl-seconds", defaultValue = "600")
    int cacheTtlSeconds;

    // ── Audit ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "permission-engine.audit.log-path")
    Optional<String> auditLogPath;

    @Inject
    @ConfigProperty(name = "permission-engine.actor-id", defaultValue = "SYSTEM")
    String actorId;

    @Produces
    @ApplicationScoped
    public AuditService auditService() {
        AuditRepository repository = auditLogPath
                .filter(path -> !path.isBlank())
                .<AuditRepository>map(path -> new JsonLinesAuditRepository(Path.of(path)))
                .orElseGet(InMemoryAuditRepository::new);
        log.info("Producing AuditService: repository={}", repository.getClass().getSimpleName());
        return new AuditService(repository, actorId);
    }

    @Produces
    @ApplicationScoped
    public PermissionEngine permissionEngine(AuditService auditService) {
        PermissionEngineOptions options = PermissionEngineOptions.builder()
                .cachingEnabled(cacheEnabled)
                .cacheMaxSize(cacheMaxSize)
                .cacheTtlSeconds(cacheTtlSeconds)
                .actorId(actorId)
                .build();

        PermissionEngine.Builder builder = PermissionEngine.builder()
                .options(options)
                .auditService(auditService);

        Path path = Path.of(configPath);
        if (Files.exists(path)) {
            builder.configFile(path).watchConfigFile(watchConfig);
            log.info("Producing PermissionEngine: config={} watch={}", path, watchConfig);
        } else {
            log.warn("Permission configuration {} not found, starting with an empty configuration", path);
        }
        return builder.build();
    }

    public void closeEngine(@Disposes PermissionEngine engine) {
        log.info("Closing PermissionEngine");
        engine.close();
    }
}
