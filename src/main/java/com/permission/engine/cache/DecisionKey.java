package com.permission.engine.cache;

/**
 * Key of the decision tier. A {@code null} context and an empty context are distinct keys.
 * The role is part of the key so a caller passing the same user id with another role
 * never sees a decision computed for the first one.
 *
 * @param userId     the user id
 * @param role       the user's role at the time of the check
 * @param permission the requested permission, without context
 * @param context    the requested context, or {@code null}
 */
public record DecisionKey(String userId, String role, String permission, String context) {
}
