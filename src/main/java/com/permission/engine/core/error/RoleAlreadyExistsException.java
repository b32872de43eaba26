package com.permission.engine.core.error;

/**
 * Raised by {@code addRole} when the name is already taken.
 */
public class RoleAlreadyExistsException extends PermissionException {

    private final String roleName;

    public RoleAlreadyExistsException(String roleName) {
        super(ErrorCode.ROLE_ALREADY_EXISTS, "Role " + roleName + " already exists");
        this.roleName = roleName;
    }

    public String getRoleName() {
        return roleName;
    }
}
