package net.honeyhive.Enrichment;

import io.opentelemetry.api.baggage.Baggage;
import io.opentelemetry.context.Context;
import io.opentelemetry.sdk.trace.ReadWriteSpan;
import io.opentelemetry.sdk.trace.ReadableSpan;
import io.opentelemetry.sdk.trace.SpanProcessor;
import net.honeyhive.Context.BaggageKeys;
import net.honeyhive.Tracing.AttributeNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies session, project, source and experiment baggage onto every span as it starts.
 *
 * Each entry is written under {@code honeyhive.} and again under the legacy
 * {@code traceloop.association.properties.} namespace. Reads only the parent context,
 * holds no per-tracer state, and never throws.
 */
public class EnrichmentSpanProcessor implements SpanProcessor {

    private static final Logger logger = LoggerFactory.getLogger(EnrichmentSpanProcessor.class);

    @Override
    public void onStart(Context parentContext, ReadWriteSpan span) {
        try {
            Baggage baggage = Baggage.fromContext(parentContext);
            if (baggage.isEmpty()) {
                return;
            }
            for (String key : BaggageKeys.ENRICHED_KEYS) {
                setBoth(span, key, baggage.getEntryValue(key));
            }
            baggage.forEach((key, entry) -> {
                if (key.startsWith(BaggageKeys.EXPERIMENT_METADATA_PREFIX)) {
                    setBoth(span, key, entry.getValue());
                }
            });
        } catch (RuntimeException e) {
            logger.debug("Skipping enrichment of span {}: {}", span.getName(), e.getMessage());
        }
    }

    private static void setBoth(ReadWriteSpan span, String baggageKey, String value) {
        if (value == null || value.isEmpty()) {
            return;
        }
        span.setAttribute(AttributeNames.primary(baggageKey), value);
        span.setAttribute(AttributeNames.legacy(baggageKey), value);
    }

    @Override
    public boolean isStartRequired() {
        return true;
    }

    @Override
    public void onEnd(ReadableSpan span) {
    }

    @Override
    public boolean isEndRequired() {
        return false;
    }

    @Override
    public String toString() {
        return "EnrichmentSpanProcessor";
    }
}
