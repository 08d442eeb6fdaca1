package com.keystone.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} for the trust layer's outbound calls
 * (key-set fetches, role lookups).
 * <p>
 * Spans are {@link SpanKind#CLIENT} and carry the correlation id and customer id from
 * {@link CorrelationContextHolder}. While the call runs, the bound context carries the
 * client span's trace and span ids, so log lines from the call can be joined to the trace.
 * The helper does not configure the SDK.
 */
public final class SpanHelper {

    private final Tracer tracer;

    /**
     * Creates a SpanHelper backed by the given OTel tracer.
     *
     * @param tracer the OpenTelemetry tracer
     */
    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Runs an outbound call inside a client span. Runtime exceptions are recorded on the
     * span and rethrown unchanged.
     *
     * @param spanName   name for the span
     * @param attributes additional span attributes
     * @param call       the outbound call
     * @param <T>        return type
     * @return the result of the call
     */
    public <T> T inClientSpan(String spanName, Map<String, String> attributes, Supplier<T> call) {
        var spanBuilder = tracer.spanBuilder(spanName).setSpanKind(SpanKind.CLIENT);
        attributes.forEach(spanBuilder::setAttribute);

        Span span = spanBuilder.startSpan();
        Optional<CorrelationContext> outer = CorrelationContextHolder.get();
        outer.ifPresent(ctx -> {
            span.setAttribute("correlation.id", ctx.correlationId());
            if (ctx.customerId() != null) {
                span.setAttribute("customer.id", ctx.customerId());
            }
            CorrelationContextHolder.set(ctx.withSpan(span.getSpanContext()));
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = call.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getClass().getSimpleName());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
            outer.ifPresent(CorrelationContextHolder::set);
        }
    }
}
