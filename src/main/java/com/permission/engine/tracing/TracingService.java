package com.permission.engine.tracing;

import java.util.Map;

/**
 * Starts spans around engine operations. {@link NoOpTracingService} is the default,
 * {@link OpenTelemetryTracingService} bridges to an OpenTelemetry {@code Tracer}.
 */
public interface TracingService {

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);
}
