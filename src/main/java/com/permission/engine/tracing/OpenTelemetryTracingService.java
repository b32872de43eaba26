package com.permission.engine.tracing;

import com.permission.engine.core.error.PermissionException;
import com.permission.engine.decision.PermissionDecision;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;

/**
 * {@link TracingService} backed by an OpenTelemetry {@link Tracer}.
 * Requires {@code opentelemetry-api} on the classpath (optional dependency).
 *
 * <p>Engine spans are {@link SpanKind#INTERNAL}. Decision outcomes are written in one
 * batch of typed attributes, and failures of the permission model carry their
 * {@link com.permission.engine.core.error.ErrorCode} as {@value Span#ERROR_CODE}.</p>
 */
public class OpenTelemetryTracingService implements TracingService {

    static final AttributeKey<Boolean> GRANTED = AttributeKey.booleanKey(Span.GRANTED);
    static final AttributeKey<String> RULE = AttributeKey.stringKey(Span.RULE);
    static final AttributeKey<String> MATCHED_PATTERN = AttributeKey.stringKey(Span.MATCHED_PATTERN);
    static final AttributeKey<Boolean> CACHE_HIT = AttributeKey.booleanKey(Span.CACHE_HIT);
    static final AttributeKey<String> ERROR_CODE = AttributeKey.stringKey(Span.ERROR_CODE);

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public Span startSpan(String operationName) {
        return startSpan(operationName, Map.of());
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        SpanBuilder builder = tracer.spanBuilder(operationName);
        builder.setSpanKind(SpanKind.INTERNAL);
        if (attributes != null) {
            attributes.forEach(builder::setAttribute);
        }
        return new EngineSpan(builder.startSpan());
    }

    private static final class EngineSpan implements Span {

        private final io.opentelemetry.api.trace.Span delegate;

        EngineSpan(io.opentelemetry.api.trace.Span delegate) {
            this.delegate = delegate;
        }

        @Override
        public void setAttribute(String key, String value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, long value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, boolean value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setStatus(SpanStatus status) {
            delegate.setStatus(status == SpanStatus.OK ? StatusCode.OK : StatusCode.ERROR);
        }

        @Override
        public void recordDecision(PermissionDecision decision, boolean cacheHit) {
            AttributesBuilder attributes = Attributes.builder()
                    .put(GRANTED, decision.isGranted())
                    .put(RULE, decision.rule())
                    .put(CACHE_HIT, cacheHit);
            if (decision.matchedPattern() != null) {
                attributes.put(MATCHED_PATTERN, decision.matchedPattern());
            }
            delegate.setAllAttributes(attributes.build());
            delegate.setStatus(StatusCode.OK);
        }

        @Override
        public void recordFailure(Throwable t) {
            if (t instanceof PermissionException permissionException) {
                delegate.setAttribute(ERROR_CODE, permissionException.getCode().name());
            }
            delegate.recordException(t);
            delegate.setStatus(StatusCode.ERROR, t.getMessage() != null ? t.getMessage() : t.getClass().getName());
        }

        @Override
        public void close() {
            delegate.end();
        }
    }
}
