package com.permission.engine.tracing;

import com.permission.engine.core.error.RoleNotFoundException;
import com.permission.engine.decision.PermissionDecision;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("TracingService Tests")
class TracingServiceTest {

    @Nested
    @DisplayName("NoOpTracingService")
    class NoOpTests {

        @Test
        void spanIgnoresEveryCall() {
            NoOpTracingService noOp = new NoOpTracingService();

            assertDoesNotThrow(() -> {
                try (Span span = noOp.startSpan("permission.check", Map.of("permission.key", "read:articles"))) {
                    span.setAttribute("permission.granted", true);
                    span.setAttribute("permission.roles", 3L);
                    span.recordFailure(new IllegalStateException("cycle"));
                    span.setStatus(Span.SpanStatus.ERROR);
                }
            });
        }

        @Test
        void ignoresDecisions() {
            Span span = new NoOpTracingService().startSpan(Span.CHECK);
            assertDoesNotThrow(() -> span.recordDecision(
                    PermissionDecision.granted("role-permissions", "read:articles", "read:*"), false));
        }

        @Test
        void sharesOneSpan() {
            NoOpTracingService noOp = new NoOpTracingService();
            assertSame(noOp.startSpan("permission.check"), noOp.startSpan("permission.resolveRole"));
        }
    }

    @Nested
    @DisplayName("OpenTelemetryTracingService")
    class OTelTests {

        private Tracer tracer;
        private SpanBuilder builder;
        private io.opentelemetry.api.trace.Span otelSpan;
        private OpenTelemetryTracingService service;

        @BeforeEach
        void setUp() {
            tracer = mock(Tracer.class);
            builder = mock(SpanBuilder.class);
            otelSpan = mock(io.opentelemetry.api.trace.Span.class);
            when(tracer.spanBuilder(anyString())).thenReturn(builder);
            when(builder.startSpan()).thenReturn(otelSpan);
            service = new OpenTelemetryTracingService(tracer);
        }

        @Test
        @DisplayName("Should start a span named after the operation and end it on close")
        void startsAndEnds() {
            try (Span span = service.startSpan("permission.check")) {
                span.setAttribute("permission.key", "read:articles");
                span.setAttribute("permission.granted", true);
                span.setAttribute("permission.roles", 2L);
            }

            verify(tracer).spanBuilder("permission.check");
            verify(builder).setSpanKind(SpanKind.INTERNAL);
            verify(otelSpan).setAttribute("permission.key", "read:articles");
            verify(otelSpan).setAttribute("permission.granted", true);
            verify(otelSpan).setAttribute("permission.roles", 2L);
            verify(otelSpan).end();
        }

        @Test
        void passesInitialAttributesToBuilder() {
            service.startSpan("permission.resolveRole", Map.of("role", "editor")).close();

            verify(builder).setAttribute("role", "editor");
        }

        @Test
        void mapsStatus() {
            Span span = service.startSpan("permission.check");
            span.setStatus(Span.SpanStatus.OK);
            span.setStatus(Span.SpanStatus.ERROR);

            verify(otelSpan).setStatus(StatusCode.OK);
            verify(otelSpan).setStatus(StatusCode.ERROR);
        }

        @Test
        @DisplayName("Failures are recorded as exceptions with an error status")
        void recordsFailure() {
            IllegalStateException failure = new IllegalStateException("Circular inheritance: a -> b -> a");

            service.startSpan("permission.check").recordFailure(failure);

            verify(otelSpan).recordException(failure);
            verify(otelSpan).setStatus(StatusCode.ERROR, "Circular inheritance: a -> b -> a");
        }

        @Test
        @DisplayName("Decision outcomes are written as one batch of typed attributes")
        void recordsDecisionAttributes() {
            PermissionDecision decision = PermissionDecision.denied("deny-override", "read:secrets", "read:secrets");

            service.startSpan(Span.CHECK).recordDecision(decision, true);

            ArgumentCaptor<Attributes> captor = ArgumentCaptor.forClass(Attributes.class);
            verify(otelSpan).setAllAttributes(captor.capture());
            Attributes attributes = captor.getValue();
            assertEquals(false, attributes.get(OpenTelemetryTracingService.GRANTED));
            assertEquals("deny-override", attributes.get(OpenTelemetryTracingService.RULE));
            assertEquals("read:secrets", attributes.get(OpenTelemetryTracingService.MATCHED_PATTERN));
            assertEquals(true, attributes.get(OpenTelemetryTracingService.CACHE_HIT));
            verify(otelSpan).setStatus(StatusCode.OK);
        }

        @Test
        void omitsPatternWhenNothingMatched() {
            service.startSpan(Span.CHECK).recordDecision(
                    PermissionDecision.denied("role-permissions", "write:articles", null), false);

            ArgumentCaptor<Attributes> captor = ArgumentCaptor.forClass(Attributes.class);
            verify(otelSpan).setAllAttributes(captor.capture());
            assertNull(captor.getValue().get(OpenTelemetryTracingService.MATCHED_PATTERN));
        }

        @Test
        void permissionFailuresCarryErrorCode() {
            RoleNotFoundException failure = new RoleNotFoundException("ghost");

            service.startSpan(Span.CHECK).recordFailure(failure);

            verify(otelSpan).setAttribute(OpenTelemetryTracingService.ERROR_CODE, "ROLE_NOT_FOUND");
            verify(otelSpan).recordException(failure);
        }
    }

    @Nested
    @DisplayName("Default decision recording")
    class DefaultRecordDecision {

        @Test
        void setsOutcomeAttributesAndOkStatus() {
            RecordingSpan span = new RecordingSpan();

            span.recordDecision(PermissionDecision.granted("grant-override", "read:restricted-docs",
                    "read:restricted-docs"), false);

            assertEquals(true, span.attributes.get(Span.GRANTED));
            assertEquals("grant-override", span.attributes.get(Span.RULE));
            assertEquals("read:restricted-docs", span.attributes.get(Span.MATCHED_PATTERN));
            assertEquals(false, span.attributes.get(Span.CACHE_HIT));
            assertEquals(Span.SpanStatus.OK, span.status);
        }
    }

    private static final class RecordingSpan implements Span {
        final Map<String, Object> attributes = new LinkedHashMap<>();
        SpanStatus status;

        @Override
        public void setAttribute(String key, String value) {
            attributes.put(key, value);
        }

        @Override
        public void setAttribute(String key, long value) {
            attributes.put(key, value);
        }

        @Override
        public void setAttribute(String key, boolean value) {
            attributes.put(key, value);
        }

        @Override
        public void setStatus(SpanStatus status) {
            this.status = status;
        }

        @Override
        public void recordFailure(Throwable t) {
            status = SpanStatus.ERROR;
        }

        @Override
        public void close() {
        }
    }
}
