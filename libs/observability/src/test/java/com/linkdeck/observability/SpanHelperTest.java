package com.linkdeck.observability;

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

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SpanHelper}, collecting spans with {@link InMemorySpanExporter}.
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
    @DisplayName("should reject null tracer")
    void shouldRejectNullTracer() {
        assertThatThrownBy(() -> new SpanHelper(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("tracer");
    }

    @Test
    @DisplayName("should create a span and return the result")
    void shouldCreateSpanAndReturnResult() {
        String result = spanHelper.inSpan("identity.validate", () -> "ok");

        assertThat(result).isEqualTo("ok");
        List<SpanData> spans = spanExporter.getFinishedSpanItems();
        assertThat(spans).hasSize(1);
        assertThat(spans.get(0).getName()).isEqualTo("identity.validate");
        assertThat(spans.get(0).getStatus().getStatusCode()).isEqualTo(StatusCode.OK);
    }

    @Test
    @DisplayName("should record error on exception and re-throw")
    void shouldRecordErrorOnException() {
        assertThatThrownBy(() -> spanHelper.inSpan("failing", () -> {
            throw new IllegalStateException("upstream down");
        })).isInstanceOf(IllegalStateException.class).hasMessage("upstream down");

        SpanData span = spanExporter.getFinishedSpanItems().get(0);
        assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
        assertThat(span.getStatus().getDescription()).contains("upstream down");
        assertThat(span.getEvents()).isNotEmpty();
    }

    @Test
    @DisplayName("should attach correlation attributes with a truncated user id")
    void shouldAttachCorrelationContext() {
        CorrelationContextHolder.set(
                new CorrelationContext("corr-abc", "org-xyz", "user-123456789", null, null, null));

        spanHelper.inSpan("correlated-op", () -> "ok");

        var attributes = spanExporter.getFinishedSpanItems().get(0).getAttributes();
        assertThat(attributes.get(AttributeKey.stringKey("correlation.id"))).isEqualTo("corr-abc");
        assertThat(attributes.get(AttributeKey.stringKey("org.id"))).isEqualTo("org-xyz");
        assertThat(attributes.get(AttributeKey.stringKey("user.id"))).isEqualTo("user-123…");
    }

    @Test
    @DisplayName("should set span kind and custom attributes")
    void shouldSetKindAndAttributes() {
        spanHelper.inSpan("client-op", SpanKind.CLIENT, Map.of("idp.endpoint", "public"), () -> "ok");

        SpanData span = spanExporter.getFinishedSpanItems().get(0);
        assertThat(span.getKind()).isEqualTo(SpanKind.CLIENT);
        assertThat(span.getAttributes().get(AttributeKey.stringKey("idp.endpoint"))).isEqualTo("public");
    }
}
