package com.permission.engine.audit;

import com.permission.engine.event.PermissionEventType;

/**
 * Types of auditable configuration changes.
 */
public enum AuditAction {
    ROLE_ADDED,
    ROLE_REMOVED,
    PERMISSION_ADDED,
    PERMISSION_REVOKED,
    CONFIGURATION_RELOADED;

    /**
     * True for actions that change a single role and therefore name it as the subject.
     */
    public boolean isRoleScoped() {
        return this != CONFIGURATION_RELOADED;
    }

    public static AuditAction from(PermissionEventType type) {
        return switch (type) {
            case ROLE_ADDED -> ROLE_ADDED;
            case ROLE_REMOVED -> ROLE_REMOVED;
            case PERMISSION_ADDED -> PERMISSION_ADDED;
            case PERMISSION_REVOKED -> PERMISSION_REVOKED;
            case CONFIGURATION_RELOADED -> CONFIGURATION_RELOADED;
        };
    }
}
