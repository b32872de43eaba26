package com.permission.engine.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forDecision("user-1", "editor", "read:articles")) {
 *     log.debug("permission.checked granted={}", granted);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a permission check.
     */
    public static LogContext forDecision(String userId, String role, String permissionKey) {
        LogContext ctx = new LogContext();
        ctx.put("userId", userId);
        ctx.put("role", role);
        ctx.put("permission", permissionKey);
        ctx.put("operation", "decide");
        return ctx;
    }

    /**
     * Creates a log context for a role mutation such as {@code addRole}.
     */
    public static LogContext forMutation(String operation, String roleName) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", generateCorrelationId());
        ctx.put("roleName", roleName);
        ctx.put("operation", operation);
        return ctx;
    }

    /**
     * Creates a log context for a configuration replacement or reload.
     */
    public static LogContext forReload(String source) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", generateCorrelationId());
        ctx.put("configSource", source);
        ctx.put("operation", "reload");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
