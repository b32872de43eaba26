package com.permission.engine.metrics;

import com.permission.engine.cache.CacheTier;
import com.permission.engine.core.error.ErrorCode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code permission.decision} - Counter (tags: outcome, rule)</li>
 *   <li>{@code permission.decision.duration} - Timer</li>
 *   <li>{@code permission.cache.hit} / {@code permission.cache.miss} - Counter (tag: tier)</li>
 *   <li>{@code permission.resolution.failure} - Counter (tag: code)</li>
 *   <li>{@code permission.role.mutation} - Counter (tag: operation)</li>
 *   <li>{@code permission.config.reload} - Counter (tag: outcome)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Timer decisionTimer;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.decisionTimer = Timer.builder("permission.decision.duration")
                .description("Duration of permission checks")
                .register(registry);
    }

    @Override
    public void recordDecision(boolean granted, String decidingRule) {
        String outcome = granted ? "granted" : "denied";
        counter("decision:" + outcome + ":" + decidingRule, () ->
                Counter.builder("permission.decision")
                        .description("Number of permission decisions")
                        .tag("outcome", outcome)
                        .tag("rule", decidingRule)
                        .register(registry))
                .increment();
    }

    @Override
    public void recordDecisionDuration(Duration duration) {
        decisionTimer.record(duration);
    }

    @Override
    public void recordCacheHit(CacheTier tier) {
        counter("hit:" + tier.name(), () ->
                Counter.builder("permission.cache.hit")
                        .description("Number of permission cache hits")
                        .tag("tier", tier.name())
                        .register(registry))
                .increment();
    }

    @Override
    public void recordCacheMiss(CacheTier tier) {
        counter("miss:" + tier.name(), () ->
                Counter.builder("permission.cache.miss")
                        .description("Number of permission cache misses")
                        .tag("tier", tier.name())
                        .register(registry))
                .increment();
    }

    @Override
    public void incrementResolutionFailure(ErrorCode code) {
        counter("failure:" + code.name(), () ->
                Counter.builder("permission.resolution.failure")
                        .description("Number of checks that failed on a misconfigured role graph")
                        .tag("code", code.name())
                        .register(registry))
                .increment();
    }

    @Override
    public void incrementRoleMutation(String operation) {
        counter("mutation:" + operation, () ->
                Counter.builder("permission.role.mutation")
                        .description("Number of role mutations")
                        .tag("operation", operation)
                        .register(registry))
                .increment();
    }

    @Override
    public void recordReload(boolean success) {
        String outcome = success ? "success" : "failure";
        counter("reload:" + outcome, () ->
                Counter.builder("permission.config.reload")
                        .description("Number of configuration reloads")
                        .tag("outcome", outcome)
                        .register(registry))
                .increment();
    }

    private Counter counter(String key, Supplier<Counter> factory) {
        return counterCache.computeIfAbsent(key, k -> factory.get());
    }
}
