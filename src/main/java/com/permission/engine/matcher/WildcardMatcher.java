package com.permission.engine.matcher;

import com.permission.engine.cache.PermissionCache;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Matches granted or denied permission patterns against a requested permission key.
 *
 * <p>A pattern without {@code *} matches by exact, case-sensitive equality. Each {@code *}
 * matches any run of zero or more characters; every other character is literal and the
 * pattern must cover the whole requested key. {@code write:articles.*} therefore matches
 * {@code write:articles.section1} and {@code write:articles.} but not {@code write:articles}.</p>
 *
 * <p>The matcher knows nothing about contexts: it sees the already joined
 * {@code permission:context} key. Compiled patterns are memoized in the
 * {@link com.permission.engine.cache.CacheTier#COMPILED_PATTERNS} tier.</p>
 */
public class WildcardMatcher {

    static final String WILDCARD = "*";

    private final PermissionCache cache;

    public WildcardMatcher(PermissionCache cache) {
        this.cache = cache;
    }

    public boolean matches(String pattern, String requested) {
        if (!pattern.contains(WILDCARD)) {
            return pattern.equals(requested);
        }
        return cache.getCompiledPattern(pattern, WildcardMatcher::compile)
                .matcher(requested)
                .matches();
    }

    /**
     * Returns the first pattern, in iteration order, that matches the requested key.
     */
    public Optional<String> firstMatch(Iterable<String> patterns, String requested) {
        for (String pattern : patterns) {
            if (matches(pattern, requested)) {
                return Optional.of(pattern);
            }
        }
        return Optional.empty();
    }

    /**
     * Translates a wildcard pattern into an anchored regular expression.
     */
    public static Pattern compile(String pattern) {
        StringBuilder regex = new StringBuilder("^");
        int start = 0;
        int star;
        while ((star = pattern.indexOf('*', start)) >= 0) {
            appendLiteral(regex, pattern.substring(start, star));
            regex.append(".*");
            start = star + 1;
        }
        appendLiteral(regex, pattern.substring(start));
        regex.append('$');
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    private static void appendLiteral(StringBuilder regex, String literal) {
        if (!literal.isEmpty()) {
            regex.append(Pattern.quote(literal));
        }
    }
}
