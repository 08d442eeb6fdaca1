package com.keystone.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;

/**
 * Immutable correlation context that flows with a request through the trust layer.
 * <p>
 * Every inbound HTTP request establishes a {@code CorrelationContext}. Once the bearer
 * token has been verified, the context is replaced with one that also carries the
 * authenticated customer id, so authentication, authorization and encryption log lines
 * can be tied back to the same caller. Values are injected into SLF4J MDC by
 * {@link CorrelationContextHolder}.
 *
 * @param correlationId unique ID for the business flow, propagated from {@code X-Correlation-ID}
 * @param customerId    authenticated customer (nullable until the token is verified)
 * @param requestId     unique ID for this specific request
 * @param spanId        current OpenTelemetry span ID (nullable if tracing is not active)
 * @param traceId       current OpenTelemetry trace ID (nullable if tracing is not active)
 */
public record CorrelationContext(
        String correlationId,
        String customerId,
        String requestId,
        String spanId,
        String traceId
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for the authenticated customer. */
    public static final String MDC_CUSTOMER_ID = "customerId";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    /** MDC key for span ID. */
    public static final String MDC_SPAN_ID = "spanId";

    /** MDC key for trace ID. */
    public static final String MDC_TRACE_ID = "traceId";

    /**
     * Compact constructor; ensures correlationId is never null.
     */
    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Creates a context carrying only a correlation ID and a request ID.
     */
    public static CorrelationContext of(String correlationId, String requestId) {
        return new CorrelationContext(correlationId, null, requestId, null, null);
    }

    /**
     * Creates a context for a new request, picking up the trace and span ids of the
     * current OpenTelemetry span when one is active.
     */
    public static CorrelationContext ofCurrentSpan(String correlationId, String requestId) {
        return of(correlationId, requestId).withSpan(Span.current().getSpanContext());
    }

    /**
     * Returns a copy of this context carrying the ids of the given span. An invalid span
     * context leaves the ids unchanged.
     */
    public CorrelationContext withSpan(SpanContext span) {
        if (span == null || !span.isValid()) {
            return this;
        }
        return new CorrelationContext(correlationId, customerId, requestId, span.getSpanId(), span.getTraceId());
    }

    /**
     * Returns a copy of this context bound to the given customer.
     */
    public CorrelationContext withCustomer(String customerId) {
        return new CorrelationContext(correlationId, customerId, requestId, spanId, traceId);
    }
}
