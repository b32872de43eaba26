package com.permission.engine.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A named bundle of permission patterns with optional inheritance from other roles.
 *
 * <p>{@code permissions} keeps insertion order and tolerates duplicates; resolution
 * collapses them. {@code inherits} is the ordered list of parent role names.</p>
 *
 * @param name        unique role name
 * @param permissions permission patterns granted directly by this role
 * @param inherits    parent role names, possibly empty
 */
public record Role(String name, List<String> permissions, List<String> inherits) {

    public Role {
        Objects.requireNonNull(name, "name is required");
        permissions = copy(permissions, "permissions");
        inherits = copy(inherits, "inherits");
    }

    public static Role of(String name, List<String> permissions) {
        return new Role(name, permissions, List.of());
    }

    public static Role of(String name, List<String> permissions, List<String> inherits) {
        return new Role(name, permissions, inherits);
    }

    /**
     * Returns a copy of this role with the permission appended. Duplicates are kept.
     */
    public Role withPermission(String permission) {
        Objects.requireNonNull(permission, "permission is required");
        List<String> updated = new ArrayList<>(permissions);
        updated.add(permission);
        return new Role(name, updated, inherits);
    }

    /**
     * Returns a copy of this role with every occurrence of the permission removed.
     */
    public Role withoutPermission(String permission) {
        List<String> updated = new ArrayList<>(permissions);
        updated.removeIf(p -> p.equals(permission));
        return new Role(name, updated, inherits);
    }

    public boolean inheritsFrom(String roleName) {
        return inherits.contains(roleName);
    }

    static List<String> copy(List<String> values, String field) {
        if (values == null) {
            return List.of();
        }
        for (String value : values) {
            if (value == null) {
                throw new NullPointerException(field + " must not contain null");
            }
        }
        return List.copyOf(values);
    }
}
