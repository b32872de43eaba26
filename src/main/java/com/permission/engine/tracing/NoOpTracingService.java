package com.permission.engine.tracing;

import com.permission.engine.decision.PermissionDecision;

import java.util.Map;

/**
 * Tracing service that hands out one shared span which ignores every call.
 */
public class NoOpTracingService implements TracingService {

    private static final Span NO_OP_SPAN = new NoOpSpan();

    @Override
    public Span startSpan(String operationName) {
        return NO_OP_SPAN;
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        return NO_OP_SPAN;
    }

    private static final class NoOpSpan implements Span {
        @Override
        public void setAttribute(String key, String value) {
        }

        @Override
        public void setAttribute(String key, long value) {
        }

        @Override
        public void setAttribute(String key, boolean value) {
        }

        @Override
        public void setStatus(SpanStatus status) {
        }

        @Override
        public void recordDecision(PermissionDecision decision, boolean cacheHit) {
        }

        @Override
        public void recordFailure(Throwable t) {
        }

        @Override
        public void close() {
        }
    }
}
