package com.permission.engine.decision;

/**
 * Outcome of a permission check.
 */
public enum DecisionOutcome {
    /** A grant override or a role permission matched, and no deny override did. */
    GRANTED,

    /** A deny override matched, or nothing granted the key. */
    DENIED
}
