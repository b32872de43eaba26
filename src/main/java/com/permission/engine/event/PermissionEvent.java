package com.permission.engine.event;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A configuration change that has been committed. Emitted after the new snapshot is
 * visible to readers.
 *
 * @param type      what changed
 * @param roleName  the affected role, {@code null} for whole-configuration events
 * @param details   event specific data, such as the permission or the source description
 * @param timestamp when the change was committed
 */
public record PermissionEvent(PermissionEventType type, String roleName, Map<String, Object> details,
                              Instant timestamp) {

    /** Detail key of the permission added to or revoked from a role. */
    public static final String PERMISSION = "permission";
    /** Detail key of the own permissions of an added role. */
    public static final String PERMISSIONS = "permissions";
    /** Detail key of the parents of an added role. */
    public static final String INHERITS = "inherits";
    /** Detail key of the configuration source description of a reload. */
    public static final String SOURCE = "source";
    public static final String ROLE_COUNT = "roles";
    public static final String USER_COUNT = "users";

    public PermissionEvent {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public static PermissionEvent of(PermissionEventType type, String roleName, Map<String, Object> details) {
        return new PermissionEvent(type, roleName, details, Instant.now());
    }
}
