package com.mylab.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SpanHelper")
class SpanHelperTest {

    private InMemorySpanExporter exporter;
    private SpanHelper spans;

    @BeforeEach
    void setUp() {
        exporter = InMemorySpanExporter.create();
        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(SimpleSpanProcessor.create(exporter))
                .build();
        spans = new SpanHelper(OpenTelemetrySdk.builder()
                .setTracerProvider(tracerProvider)
                .build()
                .getTracer("lab-test"));
    }

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
        exporter.reset();
    }

    @Test
    @DisplayName("requires a tracer")
    void rejectsNullTracer() {
        assertThatThrownBy(() -> new SpanHelper(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("tracer");
    }

    @Nested
    @DisplayName("traced")
    class Traced {

        @Test
        @DisplayName("names the object and the tenant of the request")
        void tagsObjectAndTenant() {
            UUID sampleId = UUID.randomUUID();
            CorrelationContextHolder.set(new CorrelationContext("corr-9", "ws-9", "user-9", null));

            String result = spans.traced("analysis.submit", "sample", sampleId,
                    Map.of("lab.analysis.type", "hplc"), () -> "done");

            assertThat(result).isEqualTo("done");
            SpanData span = exporter.getFinishedSpanItems().get(0);
            assertThat(span.getName()).isEqualTo("analysis.submit");
            assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.OK);
            assertThat(span.getAttributes().get(SpanHelper.OBJECT_TYPE)).isEqualTo("sample");
            assertThat(span.getAttributes().get(SpanHelper.OBJECT_ID)).isEqualTo(sampleId.toString());
            assertThat(span.getAttributes().get(SpanHelper.WORKSPACE_ID)).isEqualTo("ws-9");
            assertThat(span.getAttributes().get(SpanHelper.CORRELATION_ID)).isEqualTo("corr-9");
            assertThat(span.getAttributes().get(AttributeKey.stringKey("lab.analysis.type"))).isEqualTo("hplc");
        }

        @Test
        @DisplayName("creates without an object ID or request context")
        void withoutIdOrContext() {
            spans.traced("batch.create", "batch", null, () -> 1);

            SpanData span = exporter.getFinishedSpanItems().get(0);
            assertThat(span.getAttributes().get(SpanHelper.OBJECT_ID)).isNull();
            assertThat(span.getAttributes().get(SpanHelper.WORKSPACE_ID)).isNull();
        }

        @Test
        @DisplayName("ends in error with the failure class and rethrows")
        void recordsFailure() {
            assertThatThrownBy(() -> spans.traced("analysis.submit", "sample", "s-1", () -> {
                throw new IllegalStateException("stale");
            })).isInstanceOf(IllegalStateException.class).hasMessage("stale");

            SpanData span = exporter.getFinishedSpanItems().get(0);
            assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
            assertThat(span.getAttributes().get(SpanHelper.FAILURE)).isEqualTo("IllegalStateException");
            assertThat(span.getEvents()).anyMatch(e -> e.getName().equals("exception"));
        }
    }
}
