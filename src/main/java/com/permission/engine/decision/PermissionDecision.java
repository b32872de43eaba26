package com.permission.engine.decision;

import java.util.Objects;

/**
 * Result of a permission check together with the rule that decided it.
 *
 * @param outcome        granted or denied
 * @param rule           name of the deciding rule
 * @param permissionKey  the {@code permission[:context]} key that was checked
 * @param matchedPattern the pattern that matched, or {@code null} when nothing matched
 */
public record PermissionDecision(DecisionOutcome outcome, String rule, String permissionKey,
                                 String matchedPattern) {

    public PermissionDecision {
        Objects.requireNonNull(outcome, "outcome is required");
        Objects.requireNonNull(rule, "rule is required");
        Objects.requireNonNull(permissionKey, "permissionKey is required");
    }

    public static PermissionDecision granted(String rule, String permissionKey, String matchedPattern) {
        return new PermissionDecision(DecisionOutcome.GRANTED, rule, permissionKey, matchedPattern);
    }

    public static PermissionDecision denied(String rule, String permissionKey, String matchedPattern) {
        return new PermissionDecision(DecisionOutcome.DENIED, rule, permissionKey, matchedPattern);
    }

    public boolean isGranted() {
        return outcome == DecisionOutcome.GRANTED;
    }
}
