package com.permission.engine.tracing;

import com.permission.engine.decision.PermissionDecision;

/**
 * A traced unit of engine work: a permission check, a role resolution, a mutation or a
 * reload. Closing the span ends it, so it is meant for try-with-resources:
 *
 * <pre>
 * try (Span span = tracingService.startSpan(Span.CHECK, attributes)) {
 *     span.recordDecision(decision, cacheHit);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    String CHECK = "permission.check";
    String RESOLVE_ROLE = "permission.resolveRole";
    String RELOAD = "permission.reload";

    String USER_ID = "permission.user.id";
    String USER_ROLE = "permission.user.role";
    String PERMISSION_KEY = "permission.key";
    String ROLE = "permission.role";
    String GRANTED = "permission.granted";
    String RULE = "permission.rule";
    String MATCHED_PATTERN = "permission.matched_pattern";
    String CACHE_HIT = "permission.cache_hit";
    String PERMISSION_COUNT = "permission.count";
    String ROLE_COUNT = "permission.role_count";
    String CONFIG_SOURCE = "permission.config.source";
    String ERROR_CODE = "permission.error.code";

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setAttribute(String key, boolean value);

    void setStatus(SpanStatus status);

    /**
     * Tags the span with the outcome of a check and marks it {@link SpanStatus#OK}.
     * A denial is a successful check, not an error.
     */
    default void recordDecision(PermissionDecision decision, boolean cacheHit) {
        setAttribute(GRANTED, decision.isGranted());
        setAttribute(RULE, decision.rule());
        if (decision.matchedPattern() != null) {
            setAttribute(MATCHED_PATTERN, decision.matchedPattern());
        }
        setAttribute(CACHE_HIT, cacheHit);
        setStatus(SpanStatus.OK);
    }

    /**
     * Records the failure and marks the span as {@link SpanStatus#ERROR}.
     */
    void recordFailure(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
