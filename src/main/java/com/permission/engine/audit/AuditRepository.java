package com.permission.engine.audit;

import java.time.Instant;
import java.util.List;

/**
 * Storage for audit entries. Append-only.
 */
public interface AuditRepository {

    AuditEntry save(AuditEntry entry);

    List<AuditEntry> findAll();

    /**
     * Gets the entries recorded for a role.
     */
    List<AuditEntry> findBySubject(String subject);

    List<AuditEntry> findByAction(AuditAction action);

    /**
     * Gets the entries within a time range, both ends inclusive.
     */
    List<AuditEntry> findBetween(Instant start, Instant end);

    int count();

    /**
     * Gets the most recent entries, oldest first, up to the limit.
     */
    default List<AuditEntry> findRecent(int limit) {
        List<AuditEntry> all = findAll();
        int size = all.size();
        return size <= limit ? all : List.copyOf(all.subList(size - limit, size));
    }
}
