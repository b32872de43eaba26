package com.permission.engine.decision;

import java.util.Optional;

/**
 * One step of the ordered decision chain. The first rule returning a decision wins;
 * later rules are not consulted.
 */
public interface DecisionRule {

    /**
     * Stable rule name, reported in {@link PermissionDecision#rule()} and in metrics.
     */
    String name();

    /**
     * Evaluates the rule.
     *
     * @return the decision if this rule fires, empty to defer to the next rule
     */
    Optional<PermissionDecision> evaluate(DecisionRequest request);
}
