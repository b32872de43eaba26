package com.permission.engine.core.model;

import java.util.List;

/**
 * Per-user grants and denies that take precedence over role-derived permissions.
 * Denies win over grants.
 *
 * @param permissions patterns explicitly granted to the user
 * @param denies      patterns explicitly denied to the user
 */
public record UserOverride(List<String> permissions, List<String> denies) {

    private static final UserOverride EMPTY = new UserOverride(List.of(), List.of());

    public UserOverride {
        permissions = Role.copy(permissions, "permissions");
        denies = Role.copy(denies, "denies");
    }

    public static UserOverride empty() {
        return EMPTY;
    }

    public static UserOverride granting(List<String> permissions) {
        return new UserOverride(permissions, List.of());
    }

    public static UserOverride denying(List<String> denies) {
        return new UserOverride(List.of(), denies);
    }

    public boolean isEmpty() {
        return permissions.isEmpty() && denies.isEmpty();
    }
}
