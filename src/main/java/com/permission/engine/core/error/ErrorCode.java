package com.permission.engine.core.error;

/**
 * Stable error codes carried by every {@link PermissionException}.
 */
public enum ErrorCode {
    CONFIGURATION_INVALID,
    CONFIGURATION_LOAD_FAILED,
    ROLE_NOT_FOUND,
    ROLE_ALREADY_EXISTS,
    ROLE_IN_USE,
    CIRCULAR_INHERITANCE
}
