package net.honeyhive.Enrichment;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.context.Context;
import net.honeyhive.Tracing.OpenTelemetryTracingSpan;
import net.honeyhive.Tracing.TracingSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scoped enrichment of the span that was active when the scope was opened.
 *
 * <pre>{@code
 * try (EnrichmentScope scope = tracer.enrichSpanScoped(SpanEnrichment.builder().eventName("rank").build())) {
 *     scope.addOutput("top", results.get(0));
 * } catch (IOException e) {
 *     ...
 * }
 * }</pre>
 *
 * Everything is written on {@link #close()}, which never throws. Exceptions raised in
 * the block propagate as usual; record them with {@link #recordError} first to have
 * them attached.
 */
public class EnrichmentScope implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(EnrichmentScope.class);

    private final SpanEnricher enricher;
    private final Span span;
    private final Context context;
    private final SpanEnrichment.Builder accumulated;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    EnrichmentScope(SpanEnricher enricher, Span span, Context context, SpanEnrichment initial) {
        this.enricher = enricher;
        this.span = span;
        this.context = context;
        this.accumulated = initial.toBuilder();
    }

    public synchronized EnrichmentScope addMetadata(String key, Object value) {
        accumulated.metadata(key, value);
        return this;
    }

    public synchronized EnrichmentScope addMetric(String key, Object value) {
        accumulated.metric(key, value);
        return this;
    }

    public synchronized EnrichmentScope addOutput(String key, Object value) {
        accumulated.output(key, value);
        return this;
    }

    public synchronized EnrichmentScope recordError(Throwable error) {
        accumulated.error(error);
        return this;
    }

    /**
     * The span captured at entry.
     */
    public TracingSpan getSpan() {
        return new OpenTelemetryTracingSpan(span, context);
    }

    public boolean isRecording() {
        return span.isRecording();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        SpanEnrichment enrichment;
        synchronized (this) {
            enrichment = accumulated.build();
        }
        try {
            enricher.apply(span, enrichment);
        } catch (RuntimeException e) {
            logger.debug("Scoped enrichment failed: {}", e.getMessage());
        }
    }
}
