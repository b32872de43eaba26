package com.permission.engine.decision;

import com.permission.engine.graph.RoleGraphResolver;
import com.permission.engine.matcher.WildcardMatcher;

import java.util.Optional;
import java.util.Set;

/**
 * Grants when any permission of the user's resolved role matches, denies otherwise.
 * Always fires. Resolution failures propagate to the caller.
 */
public class RolePermissionRule implements DecisionRule {

    public static final String NAME = "role-permissions";

    private final RoleGraphResolver resolver;
    private final WildcardMatcher matcher;

    public RolePermissionRule(RoleGraphResolver resolver, WildcardMatcher matcher) {
        this.resolver = resolver;
        this.matcher = matcher;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<PermissionDecision> evaluate(DecisionRequest request) {
        Set<String> rolePermissions = resolver.resolvePermissions(request.configuration(), request.user().role());
        String key = request.permissionKey();
        return Optional.of(matcher.firstMatch(rolePermissions, key)
                .map(pattern -> PermissionDecision.granted(NAME, key, pattern))
                .orElseGet(() -> PermissionDecision.denied(NAME, key, null)));
    }
}
