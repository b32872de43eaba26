package com.permission.engine.metrics;

import com.permission.engine.cache.CacheTier;
import com.permission.engine.core.error.ErrorCode;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordDecision(boolean granted, String decidingRule) {
    }

    @Override
    public void recordDecisionDuration(Duration duration) {
    }

    @Override
    public void recordCacheHit(CacheTier tier) {
    }

    @Override
    public void recordCacheMiss(CacheTier tier) {
    }

    @Override
    public void incrementResolutionFailure(ErrorCode code) {
    }

    @Override
    public void incrementRoleMutation(String operation) {
    }

    @Override
    public void recordReload(boolean success) {
    }
}
