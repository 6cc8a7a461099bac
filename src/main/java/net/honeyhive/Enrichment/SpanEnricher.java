package net.honeyhive.Enrichment;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.context.Context;
import net.honeyhive.Aspect.Components.Utility.MetricsRecorder;
import net.honeyhive.Experiment.ExperimentContext;
import net.honeyhive.Tracing.AttributeNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes {@link SpanEnrichment}s onto spans.
 *
 * {@link #enrichSpanDirect} applies to the active span immediately and reports whether
 * it could. {@link #enrichSpanScoped} captures the active span and applies everything
 * gathered in the scope when it is closed.
 */
public class SpanEnricher {

    private static final Logger logger = LoggerFactory.getLogger(SpanEnricher.class);

    static final String TARGET = "span";

    private final SpanAttributeWriter writer;
    private final MetricsRecorder metricsRecorder;

    public SpanEnricher(SpanAttributeWriter writer, MetricsRecorder metricsRecorder) {
        this.writer = writer;
        this.metricsRecorder = metricsRecorder;
    }

    /**
     * @return false when there is no recording span or the write failed
     */
    public boolean enrichSpanDirect(SpanEnrichment enrichment) {
        return apply(Span.current(), enrichment);
    }

    public EnrichmentScope enrichSpanScoped(SpanEnrichment enrichment) {
        return new EnrichmentScope(this, Span.current(), Context.current(), enrichment);
    }

    boolean apply(Span span, SpanEnrichment enrichment) {
        if (!span.isRecording()) {
            logger.debug("No recording span to enrich");
            metricsRecorder.recordEnrichment(TARGET, false);
            return false;
        }
        try {
            write(span, enrichment);
            metricsRecorder.recordEnrichment(TARGET, true);
            return true;
        } catch (RuntimeException e) {
            logger.warn("Failed to enrich span: {}", e.getMessage());
            metricsRecorder.recordEnrichment(TARGET, false);
            return false;
        }
    }

    private void write(Span span, SpanEnrichment enrichment) {
        writer.writeAll(span, AttributeNames.METADATA, enrichment.getMetadata());
        writer.writeAll(span, AttributeNames.METRICS, enrichment.getMetrics());
        writer.writeAll(span, AttributeNames.CONFIG, enrichment.getConfig());
        writer.writeAll(span, AttributeNames.FEEDBACK, enrichment.getFeedback());
        writer.writeAll(span, AttributeNames.INPUTS, enrichment.getInputs());
        writer.writeAll(span, AttributeNames.OUTPUTS, enrichment.getOutputs());
        enrichment.getAttributes().forEach((key, value) -> writer.write(span, key, value));
        enrichment.getExtras().forEach((key, value) -> writer.write(span, AttributeNames.EXTRA_PREFIX + key, value));

        if (enrichment.getEventType() != null) {
            span.setAttribute(AttributeNames.EVENT_TYPE, enrichment.getEventType());
        }
        if (enrichment.getEventName() != null) {
            span.setAttribute(AttributeNames.EVENT_NAME, enrichment.getEventName());
        }
        if (enrichment.getEventId() != null) {
            span.setAttribute(AttributeNames.EVENT_ID, enrichment.getEventId());
        }

        Throwable error = enrichment.getError();
        if (error != null) {
            span.recordException(error);
            String message = error.getMessage() != null ? error.getMessage() : error.getClass().getName();
            span.setAttribute(AttributeNames.ERROR, message);
            span.setAttribute(AttributeNames.ERROR_TYPE, error.getClass().getSimpleName());
            span.setStatus(StatusCode.ERROR, message);
        } else if (enrichment.getErrorMessage() != null) {
            span.setAttribute(AttributeNames.ERROR, enrichment.getErrorMessage());
            span.setStatus(StatusCode.ERROR, enrichment.getErrorMessage());
        }

        ExperimentContext experiment = ExperimentContext.fromConfig(enrichment.getConfig());
        experiment.toBaggage().forEach((key, value) -> {
            span.setAttribute(AttributeNames.primary(key), value);
            span.setAttribute(AttributeNames.legacy(key), value);
        });
    }
}
