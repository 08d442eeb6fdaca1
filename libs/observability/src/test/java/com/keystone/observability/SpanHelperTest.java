package com.keystone.observability;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SpanHelper} using an {@link InMemorySpanExporter}.
 */
@DisplayName("SpanHelper")
class SpanHelperTest {

    private InMemorySpanExporter spanExporter;
    private SpanHelper spanHelper;

    @BeforeEach
    void setUp() {
        spanExporter = InMemorySpanExporter.create();
        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(SimpleSpanProcessor.create(spanExporter))
                .build();
        OpenTelemetrySdk otelSdk = OpenTelemetrySdk.builder()
                .setTracerProvider(tracerProvider)
                .build();
        spanHelper = new SpanHelper(otelSdk.getTracer("test-tracer"));
    }

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
        spanExporter.reset();
    }

    @Test
    @DisplayName("should reject a null tracer")
    void rejectsNullTracer() {
        assertThatThrownBy(() -> new SpanHelper(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("records a client span with attributes and correlation context")
    void recordsClientSpan() {
        CorrelationContextHolder.set(new CorrelationContext("corr-9", "cust_1", null, null, null));

        String result = spanHelper.inClientSpan("jwks.fetch", Map.of("http.url", "https://id/jwks"), () -> "ok");

        assertThat(result).isEqualTo("ok");
        SpanData span = spanExporter.getFinishedSpanItems().get(0);
        assertThat(span.getName()).isEqualTo("jwks.fetch");
        assertThat(span.getKind()).isEqualTo(SpanKind.CLIENT);
        assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.OK);
        assertThat(span.getAttributes().get(AttributeKey.stringKey("http.url"))).isEqualTo("https://id/jwks");
        assertThat(span.getAttributes().get(AttributeKey.stringKey("correlation.id"))).isEqualTo("corr-9");
        assertThat(span.getAttributes().get(AttributeKey.stringKey("customer.id"))).isEqualTo("cust_1");
    }

    @Test
    @DisplayName("marks the span as failed and rethrows")
    void recordsFailure() {
        assertThatThrownBy(() -> spanHelper.inClientSpan("role.lookup", Map.of(), () -> {
            throw new IllegalStateException("down");
        })).isInstanceOf(IllegalStateException.class).hasMessage("down");

        SpanData span = spanExporter.getFinishedSpanItems().get(0);
        assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
        assertThat(span.getEvents()).isNotEmpty();
    }

    @Test
    @DisplayName("binds the client span's trace and span ids for the duration of the call")
    void bindsSpanIds() {
        CorrelationContextHolder.set(CorrelationContext.of("corr-10", "req-1"));

        CorrelationContext during = spanHelper.inClientSpan("role.lookup", Map.of(),
                () -> CorrelationContextHolder.get().orElseThrow());

        SpanData span = spanExporter.getFinishedSpanItems().get(0);
        assertThat(during.traceId()).isEqualTo(span.getTraceId());
        assertThat(during.spanId()).isEqualTo(span.getSpanId());
        assertThat(during.correlationId()).isEqualTo("corr-10");
        assertThat(CorrelationContextHolder.get()).contains(CorrelationContext.of("corr-10", "req-1"));
        assertThat(MDC.get(CorrelationContext.MDC_TRACE_ID)).isNull();
    }
}
