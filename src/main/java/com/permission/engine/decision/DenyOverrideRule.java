package com.permission.engine.decision;

import com.permission.engine.matcher.WildcardMatcher;

import java.util.Optional;

/**
 * Denies when any of the user's {@code denies} patterns matches. Runs first, so an explicit
 * deny beats both the user's own grants and anything the role provides.
 */
public class DenyOverrideRule implements DecisionRule {

    public static final String NAME = "deny-override";

    private final WildcardMatcher matcher;

    public DenyOverrideRule(WildcardMatcher matcher) {
        this.matcher = matcher;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<PermissionDecision> evaluate(DecisionRequest request) {
        return matcher.firstMatch(request.override().denies(), request.permissionKey())
                .map(pattern -> PermissionDecision.denied(NAME, request.permissionKey(), pattern));
    }
}
