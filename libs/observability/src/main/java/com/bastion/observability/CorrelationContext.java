package com.bastion.observability;

/**
 * Immutable correlation context that flows with a single admitted (or rejected) request.
 * <p>
 * The gateway establishes a context as soon as a request arrives, before the tenant is known.
 * Once the admission pipeline has resolved the tenant and verified the caller, the context is
 * replaced with a copy carrying {@code tenantId} and {@code subjectId} so that every log line
 * written by downstream handlers is attributable to a tenant.
 *
 * @param correlationId unique ID for the business flow, propagated via {@code X-Correlation-ID}
 * @param tenantId      resolved tenant identifier (null until the tenant stage succeeds)
 * @param subjectId     verified token subject (null until the token stage succeeds)
 * @param requestId     unique ID for this specific HTTP request
 * @param spanId        current OpenTelemetry span ID (nullable if tracing is not active)
 * @param traceId       current OpenTelemetry trace ID (nullable if tracing is not active)
 */
public record CorrelationContext(
        String correlationId,
        String tenantId,
        String subjectId,
        String requestId,
        String spanId,
        String traceId
) {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_TENANT_ID = "tenantId";
    public static final String MDC_SUBJECT_ID = "subjectId";
    public static final String MDC_REQUEST_ID = "requestId";
    public static final String MDC_SPAN_ID = "spanId";
    public static final String MDC_TRACE_ID = "traceId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Creates a context that only knows its correlation and request identifiers.
     */
    public static CorrelationContext forRequest(String correlationId, String requestId) {
        return new CorrelationContext(correlationId, null, null, requestId, null, null);
    }

    /**
     * Returns a copy bound to the admitted tenant and subject.
     */
    public CorrelationContext withPrincipal(String tenantId, String subjectId) {
        return new CorrelationContext(correlationId, tenantId, subjectId, requestId, spanId, traceId);
    }
}
