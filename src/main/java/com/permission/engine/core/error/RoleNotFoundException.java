package com.permission.engine.core.error;

/**
 * Raised when a role is looked up, inherited from or mutated but does not exist.
 */
public class RoleNotFoundException extends PermissionException {

    private final String roleName;

    public RoleNotFoundException(String roleName) {
        super(ErrorCode.ROLE_NOT_FOUND, "Role " + roleName + " not found");
        this.roleName = roleName;
    }

    public String getRoleName() {
        return roleName;
    }
}
