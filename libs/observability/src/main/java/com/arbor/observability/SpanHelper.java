package com.arbor.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that runs a unit of work inside an
 * {@link SpanKind#INTERNAL} span and attaches the current correlation context to it.
 * <p>
 * Does NOT configure the SDK. Without one, the global tracer is a no-op and spans cost nothing.
 */
public final class SpanHelper {

    private final Tracer tracer;

    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Executes {@code work} within a new span and returns its result. Runtime exceptions are
     * recorded on the span, which is marked ERROR, and rethrown unchanged.
     *
     * @param spanName   name for the span (e.g., "hierarchy.move")
     * @param attributes span attributes; null values are skipped
     * @param work       the work to execute
     */
    public <T> T inSpan(String spanName, Map<String, String> attributes, Supplier<T> work) {
        var spanBuilder = tracer.spanBuilder(spanName).setSpanKind(SpanKind.INTERNAL);
        attributes.forEach((key, value) -> {
            if (value != null) {
                spanBuilder.setAttribute(key, value);
            }
        });
        Span span = spanBuilder.startSpan();

        CorrelationContextHolder.get().ifPresent(ctx -> {
            span.setAttribute("correlation.id", ctx.correlationId());
            if (ctx.actorId() != null) {
                span.setAttribute("actor.id", ctx.actorId());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    public Tracer tracer() {
        return tracer;
    }
}
