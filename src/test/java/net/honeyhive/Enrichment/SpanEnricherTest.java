package net.honeyhive.Enrichment;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import net.honeyhive.Aspect.Components.Utility.MetricsRecorder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SpanEnricherTest {

    @Mock
    private MetricsRecorder metricsRecorder;

    private InMemorySpanExporter exporter;
    private SdkTracerProvider provider;
    private Tracer tracer;
    private SpanEnricher enricher;

    record Document(String id, int rank) {
    }

    @BeforeEach
    void setUp() {
        exporter = InMemorySpanExporter.create();
        provider = SdkTracerProvider.builder().addSpanProcessor(SimpleSpanProcessor.create(exporter)).build();
        tracer = provider.get("enricher-test");
        enricher = new SpanEnricher(new SpanAttributeWriter(new ObjectMapper()), metricsRecorder);
    }

    @AfterEach
    void tearDown() {
        provider.shutdown();
    }

    @Test
    void testDirectEnrichmentWithoutActiveSpanReturnsFalse() {
        boolean applied = enricher.enrichSpanDirect(SpanEnrichment.builder().metadata("k", "v").build());

        assertFalse(applied);
        verify(metricsRecorder).recordEnrichment("span", false);
    }

    @Test
    void testDirectEnrichmentFlattensValues() {
        SpanEnrichment enrichment = SpanEnrichment.builder()
                .metadata(Map.of("user", Map.of("tier", "gold", "age", 41)))
                .metric("latency_ms", 12.5)
                .metric("tokens", 300)
                .input("documents", List.of(new Document("d1", 1), new Document("d2", 2)))
                .output("score", new BigDecimal("0.125"))
                .feedback(Map.of("accepted", true))
                .attribute("gen_ai.system", "openai")
                .extra("model_family", "gpt")
                .eventType("chain")
                .eventName("retrieve")
                .build();

        SpanData span = inSpan(() -> assertTrue(enricher.enrichSpanDirect(enrichment)));

        assertEquals("gold", span.getAttributes().get(AttributeKey.stringKey("honeyhive_metadata.user.tier")));
        assertEquals(41L, span.getAttributes().get(AttributeKey.longKey("honeyhive_metadata.user.age")));
        assertEquals(12.5, span.getAttributes().get(AttributeKey.doubleKey("honeyhive_metrics.latency_ms")));
        assertEquals(300L, span.getAttributes().get(AttributeKey.longKey("honeyhive_metrics.tokens")));
        assertEquals("{\"id\":\"d2\",\"rank\":2}",
                span.getAttributes().get(AttributeKey.stringKey("honeyhive_inputs.documents.1")));
        assertEquals("0.125", span.getAttributes().get(AttributeKey.stringKey("honeyhive_outputs.score")));
        assertEquals(true, span.getAttributes().get(AttributeKey.booleanKey("honeyhive_feedback.accepted")));
        assertEquals("openai", span.getAttributes().get(AttributeKey.stringKey("gen_ai.system")));
        assertEquals("gpt", span.getAttributes().get(AttributeKey.stringKey("honeyhive_model_family")));
        assertEquals("chain", span.getAttributes().get(AttributeKey.stringKey("honeyhive_event_type")));
        assertEquals("retrieve", span.getAttributes().get(AttributeKey.stringKey("honeyhive_event_name")));
        verify(metricsRecorder).recordEnrichment("span", true);
    }

    @Test
    void testExperimentConfigIsMirroredIntoContextNamespaces() {
        SpanEnrichment enrichment = SpanEnrichment.builder()
                .config(Map.of("experiment_id", "exp-1", "model", "gpt-4o"))
                .build();

        SpanData span = inSpan(() -> enricher.enrichSpanDirect(enrichment));

        assertEquals("gpt-4o", span.getAttributes().get(AttributeKey.stringKey("honeyhive_config.model")));
        assertEquals("exp-1", span.getAttributes().get(AttributeKey.stringKey("honeyhive.experiment_id")));
        assertEquals("exp-1",
                span.getAttributes().get(AttributeKey.stringKey("traceloop.association.properties.experiment_id")));
    }

    @Test
    void testErrorMarksSpanFailed() {
        SpanData span = inSpan(() -> enricher.enrichSpanDirect(
                SpanEnrichment.builder().error(new IllegalArgumentException("bad prompt")).build()));

        assertEquals(StatusCode.ERROR, span.getStatus().getStatusCode());
        assertEquals("bad prompt", span.getAttributes().get(AttributeKey.stringKey("honeyhive_error")));
        assertEquals("IllegalArgumentException",
                span.getAttributes().get(AttributeKey.stringKey("honeyhive_error_type")));
        assertEquals(1, span.getEvents().size());
    }

    @Test
    void testScopedEnrichmentIsWrittenOnCloseToTheEntrySpan() {
        Span outer = tracer.spanBuilder("outer").startSpan();
        try (Scope ignored = outer.makeCurrent()) {
            try (EnrichmentScope scope = enricher.enrichSpanScoped(SpanEnrichment.builder().eventName("rank").build())) {
                Span inner = tracer.spanBuilder("inner").startSpan();
                try (Scope ignoredInner = inner.makeCurrent()) {
                    scope.addOutput("top", "doc-1");
                    scope.addMetric("candidates", 4);
                } finally {
                    inner.end();
                }
                assertTrue(scope.isRecording());
                assertEquals(outer.getSpanContext(), ((Span) scope.getSpan().getUnderlyingSpan()).getSpanContext());
            }
        } finally {
            outer.end();
        }

        SpanData outerData = exporter.getFinishedSpanItems().stream()
                .filter(s -> s.getName().equals("outer")).findFirst().orElseThrow();
        SpanData innerData = exporter.getFinishedSpanItems().stream()
                .filter(s -> s.getName().equals("inner")).findFirst().orElseThrow();
        assertEquals("doc-1", outerData.getAttributes().get(AttributeKey.stringKey("honeyhive_outputs.top")));
        assertEquals(4L, outerData.getAttributes().get(AttributeKey.longKey("honeyhive_metrics.candidates")));
        assertEquals("rank", outerData.getAttributes().get(AttributeKey.stringKey("honeyhive_event_name")));
        assertTrue(innerData.getAttributes().isEmpty());
    }

    @Test
    void testScopedEnrichmentRecordsErrorAndExceptionStillPropagates() {
        Span outer = tracer.spanBuilder("outer").startSpan();
        IllegalStateException thrown;
        try (Scope ignored = outer.makeCurrent()) {
            thrown = assertThrows(IllegalStateException.class, () -> {
                try (EnrichmentScope scope = enricher.enrichSpanScoped(SpanEnrichment.empty())) {
                    IllegalStateException e = new IllegalStateException("index offline");
                    scope.recordError(e);
                    throw e;
                }
            });
        } finally {
            outer.end();
        }

        assertEquals("index offline", thrown.getMessage());
        SpanData span = exporter.getFinishedSpanItems().get(0);
        assertEquals(StatusCode.ERROR, span.getStatus().getStatusCode());
        assertEquals("IllegalStateException", span.getAttributes().get(AttributeKey.stringKey("honeyhive_error_type")));
    }

    @Test
    void testScopeWithoutSpanClosesQuietly() {
        EnrichmentScope scope = enricher.enrichSpanScoped(SpanEnrichment.builder().metadata("k", "v").build());

        assertFalse(scope.isRecording());
        assertDoesNotThrow(scope::close);
        assertDoesNotThrow(scope::close);
        verify(metricsRecorder, times(1)).recordEnrichment("span", false);
    }

    private SpanData inSpan(Runnable body) {
        Span span = tracer.spanBuilder("target").startSpan();
        try (Scope ignored = span.makeCurrent()) {
            body.run();
        } finally {
            span.end();
        }
        List<SpanData> spans = exporter.getFinishedSpanItems();
        assertEquals(1, spans.size());
        return spans.get(0);
    }
}
