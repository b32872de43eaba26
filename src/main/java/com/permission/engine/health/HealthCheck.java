package com.permission.engine.health;

/**
 * A single health check of one engine component.
 */
public interface HealthCheck {

    String getName();

    HealthStatus check();
}
