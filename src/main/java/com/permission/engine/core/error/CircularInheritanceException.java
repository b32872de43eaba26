package com.permission.engine.core.error;

/**
 * Raised when role resolution re-enters a role that is already being expanded.
 * The role name is the one at which the cycle was detected.
 */
public class CircularInheritanceException extends PermissionException {

    private final String roleName;

    public CircularInheritanceException(String roleName) {
        super(ErrorCode.CIRCULAR_INHERITANCE, "Circular inheritance detected in role: " + roleName);
        this.roleName = roleName;
    }

    public String getRoleName() {
        return roleName;
    }
}
