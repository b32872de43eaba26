package com.permission.engine.decision;

import com.permission.engine.matcher.WildcardMatcher;

import java.util.Optional;

/**
 * Grants when any of the user's override {@code permissions} matches, regardless of the role.
 */
public class GrantOverrideRule implements DecisionRule {

    public static final String NAME = "grant-override";

    private final WildcardMatcher matcher;

    public GrantOverrideRule(WildcardMatcher matcher) {
        this.matcher = matcher;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<PermissionDecision> evaluate(DecisionRequest request) {
        return matcher.firstMatch(request.override().permissions(), request.permissionKey())
                .map(pattern -> PermissionDecision.granted(NAME, request.permissionKey(), pattern));
    }
}
