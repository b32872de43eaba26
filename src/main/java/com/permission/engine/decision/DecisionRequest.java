package com.permission.engine.decision;

import com.permission.engine.core.model.PermissionConfiguration;
import com.permission.engine.core.model.User;
import com.permission.engine.core.model.UserOverride;

/**
 * Input of the rule chain for one check.
 *
 * @param user          the user being checked
 * @param permissionKey the joined {@code permission[:context]} key
 * @param override      the user's override entry, empty when the user has none
 * @param configuration the snapshot the check runs against
 */
public record DecisionRequest(User user, String permissionKey, UserOverride override,
                              PermissionConfiguration configuration) {

    public static DecisionRequest of(PermissionConfiguration configuration, User user, String permissionKey) {
        return new DecisionRequest(user, permissionKey, configuration.getUserOverride(user.id()), configuration);
    }
}
