package com.permission.engine.audit;

import com.permission.engine.event.PermissionEvent;
import com.permission.engine.event.PermissionEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Records configuration changes as audit entries. Registered with the engine as an
 * event listener, so every committed mutation and reload produces one entry.
 */
public class AuditService implements PermissionEventListener {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditRepository repository;
    private final String actorId;

    public AuditService() {
        this(new InMemoryAuditRepository(), "SYSTEM");
    }

    public AuditService(AuditRepository repository, String actorId) {
        this.repository = repository;
        this.actorId = actorId;
    }

    @Override
    public void onEvent(PermissionEvent event) {
        record(AuditEntry.fromEvent(event, actorId));
    }

    public AuditEntry record(AuditEntry entry) {
        repository.save(entry);
        log.debug("Audit entry recorded: {} for {} by {}", entry.action(), entry.subject(), entry.actorId());
        return entry;
    }

    public AuditEntry record(AuditAction action, String subject, Map<String, Object> details) {
        return record(AuditEntry.builder()
                .action(action)
                .subject(subject)
                .actorId(actorId)
                .details(details)
                .build());
    }

    public List<AuditEntry> getAllEntries() {
        return repository.findAll();
    }

    public List<AuditEntry> getEntriesForRole(String roleName) {
        return repository.findBySubject(roleName);
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return repository.findByAction(action);
    }

    public List<AuditEntry> getRecentEntries(int limit) {
        return repository.findRecent(limit);
    }

    public int size() {
        return repository.count();
    }

    public AuditRepository getRepository() {
        return repository;
    }
}
