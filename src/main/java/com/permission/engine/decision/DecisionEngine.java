package com.permission.engine.decision;

import com.permission.engine.graph.RoleGraphResolver;
import com.permission.engine.matcher.WildcardMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Runs a request through an ordered list of {@link DecisionRule}s; the first rule that
 * fires decides. The standard chain is deny override, grant override, role permissions.
 * A request no rule decides is denied.
 */
public class DecisionEngine {
    private static final Logger log = LoggerFactory.getLogger(DecisionEngine.class);

    public static final String DEFAULT_DENY = "default-deny";

    private final List<DecisionRule> rules;

    public DecisionEngine(List<DecisionRule> rules) {
        if (rules == null || rules.isEmpty()) {
            throw new IllegalArgumentException("At least one decision rule is required");
        }
        this.rules = List.copyOf(rules);
    }

    /**
     * Creates the standard chain: deny override, grant override, role permissions.
     */
    public static DecisionEngine standard(RoleGraphResolver resolver, WildcardMatcher matcher) {
        return new DecisionEngine(List.of(
                new DenyOverrideRule(matcher),
                new GrantOverrideRule(matcher),
                new RolePermissionRule(resolver, matcher)
        ));
    }

    /**
     * Joins a permission and an optional context into the key patterns are matched against.
     * A {@code null} or empty context leaves the bare permission.
     */
    public static String permissionKey(String permission, String context) {
        return context != null && !context.isEmpty() ? permission + ":" + context : permission;
    }

    public PermissionDecision decide(DecisionRequest request) {
        for (DecisionRule rule : rules) {
            Optional<PermissionDecision> decision = rule.evaluate(request);
            if (decision.isPresent()) {
                log.debug("Rule {} decided {} for user {} on '{}'", rule.name(),
                        decision.get().outcome(), request.user().id(), request.permissionKey());
                return decision.get();
            }
        }
        return PermissionDecision.denied(DEFAULT_DENY, request.permissionKey(), null);
    }

    public List<String> ruleNames() {
        return rules.stream().map(DecisionRule::name).toList();
    }
}
