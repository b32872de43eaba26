package com.permission.engine.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of the roles and per-user overrides the engine decides against.
 *
 * <p>Role and user maps keep insertion order so listings are deterministic. Mutating
 * operations return a new snapshot; the engine swaps snapshots atomically and callers
 * only ever see complete ones.</p>
 */
public final class PermissionConfiguration {

    private static final PermissionConfiguration EMPTY = builder().build();

    private final Map<String, Role> roles;
    private final Map<String, UserOverride> users;

    private PermissionConfiguration(Map<String, Role> roles, Map<String, UserOverride> users) {
        this.roles = Collections.unmodifiableMap(new LinkedHashMap<>(roles));
        this.users = Collections.unmodifiableMap(new LinkedHashMap<>(users));
    }

    public static PermissionConfiguration empty() {
        return EMPTY;
    }

    public Map<String, Role> getRoles() {
        return roles;
    }

    public Map<String, UserOverride> getUsers() {
        return users;
    }

    public Optional<Role> getRole(String roleName) {
        return Optional.ofNullable(roles.get(roleName));
    }

    public boolean hasRole(String roleName) {
        return roles.containsKey(roleName);
    }

    /**
     * Returns the user's override entry, or {@link UserOverride#empty()} when the user has none.
     */
    public UserOverride getUserOverride(String userId) {
        UserOverride override = users.get(userId);
        return override != null ? override : UserOverride.empty();
    }

    public List<String> roleNames() {
        return List.copyOf(roles.keySet());
    }

    public List<String> userIds() {
        return List.copyOf(users.keySet());
    }

    /**
     * Returns the names of the roles whose {@code inherits} list references the given role.
     */
    public List<String> dependentsOf(String roleName) {
        List<String> dependents = new ArrayList<>();
        for (Role role : roles.values()) {
            if (role.inheritsFrom(roleName)) {
                dependents.add(role.name());
            }
        }
        return dependents;
    }

    /**
     * Returns a snapshot with the role added, or replaced if a role with the same name exists.
     */
    public PermissionConfiguration withRole(Role role) {
        Map<String, Role> updated = new LinkedHashMap<>(roles);
        updated.put(role.name(), role);
        return new PermissionConfiguration(updated, users);
    }

    public PermissionConfiguration withoutRole(String roleName) {
        Map<String, Role> updated = new LinkedHashMap<>(roles);
        updated.remove(roleName);
        return new PermissionConfiguration(updated, users);
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        roles.values().forEach(builder::role);
        users.forEach(builder::user);
        return builder;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, Role> roles = new LinkedHashMap<>();
        private final Map<String, UserOverride> users = new LinkedHashMap<>();

        public Builder role(Role role) {
            Objects.requireNonNull(role, "role is required");
            this.roles.put(role.name(), role);
            return this;
        }

        public Builder role(String name, List<String> permissions) {
            return role(new Role(name, permissions, List.of()));
        }

        public Builder role(String name, List<String> permissions, List<String> inherits) {
            return role(new Role(name, permissions, inherits));
        }

        public Builder user(String userId, UserOverride override) {
            Objects.requireNonNull(userId, "userId is required");
            this.users.put(userId, override != null ? override : UserOverride.empty());
            return this;
        }

        public Builder user(String userId, List<String> permissions, List<String> denies) {
            return user(userId, new UserOverride(permissions, denies));
        }

        public PermissionConfiguration build() {
            return new PermissionConfiguration(roles, users);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PermissionConfiguration that)) return false;
        return roles.equals(that.roles) && users.equals(that.users);
    }

    @Override
    public int hashCode() {
        return Objects.hash(roles, users);
    }

    @Override
    public String toString() {
        return "PermissionConfiguration{roles=" + roles.size() + ", users=" + users.size() + '}';
    }
}
