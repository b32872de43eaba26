package com.permission.engine.core.model;

import java.util.Objects;

/**
 * The subject of a permission check. Only the id and the assigned role are inspected;
 * any other application-specific user data stays with the caller.
 *
 * @param id   user id, also the key of the user's override entry
 * @param role name of the assigned role
 */
public record User(String id, String role) {

    public User {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(role, "role is required");
    }

    public static User of(String id, String role) {
        return new User(id, role);
    }
}
