package com.permission.engine.core.error;

import java.util.List;

/**
 * Raised by {@code removeRole} when other roles still inherit from the role.
 */
public class RoleInUseException extends PermissionException {

    private final String roleName;
    private final List<String> dependentRoles;

    public RoleInUseException(String roleName, List<String> dependentRoles) {
        super(ErrorCode.ROLE_IN_USE, "Cannot remove role " + roleName
                + " as it is inherited by roles: " + String.join(", ", dependentRoles));
        this.roleName = roleName;
        this.dependentRoles = List.copyOf(dependentRoles);
    }

    public String getRoleName() {
        return roleName;
    }

    /**
     * Roles whose {@code inherits} list references the role, in configuration order.
     */
    public List<String> getDependentRoles() {
        return dependentRoles;
    }
}
