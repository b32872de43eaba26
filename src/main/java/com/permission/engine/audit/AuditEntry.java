package com.permission.engine.audit;

import com.permission.engine.event.PermissionEvent;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * One committed configuration change as written to the audit log.
 *
 * <p>{@code details} follows the keys of {@link PermissionEvent}: {@code permission} for
 * permission grants and revocations, {@code permissions} and {@code inherits} for new roles,
 * {@code source}, {@code roles} and {@code users} for reloads.</p>
 *
 * @param subject the role the change applies to; required for every role-scoped action,
 *                {@code null} for whole-configuration reloads
 */
public record AuditEntry(
        String id,
        AuditAction action,
        String subject,
        String actorId,
        Map<String, Object> details,
        Instant timestamp
) {
    public AuditEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        if (action.isRoleScoped() && subject == null) {
            throw new IllegalArgumentException("subject is required for " + action);
        }
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    /**
     * Audit entry for a committed event, timestamped when the event was.
     */
    public static AuditEntry fromEvent(PermissionEvent event, String actorId) {
        return builder()
                .action(AuditAction.from(event.type()))
                .subject(event.roleName())
                .actorId(actorId)
                .details(event.details())
                .timestamp(event.timestamp())
                .build();
    }

    /**
     * The permission granted or revoked, for {@code PERMISSION_*} entries.
     */
    public Optional<String> permission() {
        return detail(PermissionEvent.PERMISSION);
    }

    /**
     * The configuration source description, for reload entries.
     */
    public Optional<String> source() {
        return detail(PermissionEvent.SOURCE);
    }

    private Optional<String> detail(String key) {
        Object value = details.get(key);
        return value != null ? Optional.of(value.toString()) : Optional.empty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private AuditAction action;
        private String subject;
        private String actorId;
        private final Map<String, Object> details = new LinkedHashMap<>();
        private Instant timestamp = Instant.now();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder action(AuditAction action) {
            this.action = action;
            return this;
        }

        public Builder subject(String roleName) {
            this.subject = roleName;
            return this;
        }

        public Builder actorId(String actorId) {
            this.actorId = actorId;
            return this;
        }

        public Builder detail(String key, Object value) {
            this.details.put(key, value);
            return this;
        }

        public Builder details(Map<String, Object> details) {
            if (details != null) {
                this.details.putAll(details);
            }
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public AuditEntry build() {
            return new AuditEntry(id, action, subject, actorId, details, timestamp);
        }
    }
}
