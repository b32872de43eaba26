package com.permission.engine.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of a health check. Statuses are ordered by severity, {@code DOWN} being the worst.
 *
 * @param details check specific values in insertion order, e.g. the roles that fail to resolve
 */
public record HealthStatus(Status status, String message, Map<String, Object> details) {

    public enum Status { UP, DEGRADED, DOWN }

    public HealthStatus {
        Objects.requireNonNull(status, "status is required");
        message = message != null ? message : status.name();
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public static HealthStatus up() {
        return up("OK");
    }

    public static HealthStatus up(String message) {
        return new HealthStatus(Status.UP, message, Map.of());
    }

    public static HealthStatus degraded(String message) {
        return new HealthStatus(Status.DEGRADED, message, Map.of());
    }

    public static HealthStatus down(String message) {
        return new HealthStatus(Status.DOWN, message, Map.of());
    }

    public HealthStatus withDetail(String key, Object value) {
        return withDetails(Map.of(key, value));
    }

    public HealthStatus withDetails(Map<String, ?> extra) {
        Map<String, Object> merged = new LinkedHashMap<>(details);
        merged.putAll(extra);
        return new HealthStatus(status, message, merged);
    }

    /**
     * True when this status is strictly more severe than the other one.
     */
    public boolean isWorseThan(HealthStatus other) {
        return status.compareTo(other.status) > 0;
    }

    public boolean isUp() {
        return status == Status.UP;
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }
}
