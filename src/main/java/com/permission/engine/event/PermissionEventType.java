package com.permission.engine.event;

/**
 * Kinds of configuration changes the engine announces to listeners.
 */
public enum PermissionEventType {
    ROLE_ADDED,
    ROLE_REMOVED,
    PERMISSION_ADDED,
    PERMISSION_REVOKED,
    CONFIGURATION_RELOADED
}
