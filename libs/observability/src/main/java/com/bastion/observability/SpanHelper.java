package com.bastion.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that tags every span with the current
 * {@link CorrelationContext}.
 * <p>
 * The helper does not configure the SDK. The gateway obtains its tracer from
 * {@code GlobalOpenTelemetry}, which is a no-op until an agent or SDK is installed.
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
     * Runs {@code work} inside an internal span named {@code spanName}.
     */
    public <T> T inSpan(String spanName, Supplier<T> work) {
        return inSpan(spanName, SpanKind.INTERNAL, Map.of(), work);
    }

    /**
     * Runs {@code work} inside a span with explicit kind and attributes. A runtime exception
     * thrown by {@code work} marks the span as failed and is re-thrown unchanged.
     */
    public <T> T inSpan(String spanName, SpanKind kind, Map<String, String> attributes, Supplier<T> work) {
        var spanBuilder = tracer.spanBuilder(spanName).setSpanKind(kind);
        attributes.forEach(spanBuilder::setAttribute);
        Span span = spanBuilder.startSpan();

        CorrelationContextHolder.get().ifPresent(ctx -> {
            span.setAttribute("correlation.id", ctx.correlationId());
            if (ctx.tenantId() != null) {
                span.setAttribute("tenant.id", ctx.tenantId());
            }
            if (ctx.subjectId() != null) {
                span.setAttribute("subject.id", ctx.subjectId());
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

    /**
     * Marks the current span (if any) with an attribute. Stages use this to record their
     * outcome without threading the span through their signatures.
     */
    public static void annotateCurrent(String key, String value) {
        Span.current().setAttribute(key, value);
    }

    public Tracer tracer() {
        return tracer;
    }
}
