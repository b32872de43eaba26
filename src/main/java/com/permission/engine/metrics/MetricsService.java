package com.permission.engine.metrics;

import com.permission.engine.cache.CacheTier;
import com.permission.engine.core.error.ErrorCode;

import java.time.Duration;

/**
 * Interface for recording permission engine metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine works without any
 * metrics library on the classpath.
 */
public interface MetricsService {

    /**
     * Records a final decision and the rule that produced it.
     */
    void recordDecision(boolean granted, String decidingRule);

    void recordDecisionDuration(Duration duration);

    void recordCacheHit(CacheTier tier);

    void recordCacheMiss(CacheTier tier);

    /**
     * Records a failed check or resolution (missing role, cycle).
     */
    void incrementResolutionFailure(ErrorCode code);

    /**
     * Records a successful role mutation, e.g. {@code addRole}.
     */
    void incrementRoleMutation(String operation);

    void recordReload(boolean success);
}
