package net.honeyhive.Enrichment;

import com.fasterxml.jackson.databind.ObjectMapper;
import net.honeyhive.Aspect.Components.Utility.NoOpMetricsRecorder;
import net.honeyhive.Context.ContextPropagator;
import net.honeyhive.Registry.TracerRegistry;
import net.honeyhive.Session.SessionEnrichment;
import net.honeyhive.Tracing.HoneyHiveTracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

/**
 * Static entry points for code that has no tracer reference at hand.
 *
 * The tracer is the one set on the enrichment, or else the one whose baggage is
 * current. Direct span enrichment and session enrichment need a tracer and return
 * false without one; scoped enrichment works on the active span regardless.
 */
public final class Enrichment {

    private static final Logger logger = LoggerFactory.getLogger(Enrichment.class);

    private static final SpanEnricher DETACHED = new SpanEnricher(
            new SpanAttributeWriter(new ObjectMapper()), NoOpMetricsRecorder.INSTANCE);

    private Enrichment() {
    }

    public static boolean enrichSpan(SpanEnrichment enrichment) {
        HoneyHiveTracer tracer = resolve(enrichment.getTracer());
        if (tracer == null) {
            logger.debug("enrichSpan called with no tracer in scope");
            return false;
        }
        return tracer.enrichSpanDirect(enrichment);
    }

    public static EnrichmentScope enrichSpanScoped(SpanEnrichment enrichment) {
        HoneyHiveTracer tracer = resolve(enrichment.getTracer());
        return tracer != null ? tracer.enrichSpanScoped(enrichment) : DETACHED.enrichSpanScoped(enrichment);
    }

    public static boolean enrichSession(SessionEnrichment enrichment) {
        return enrichSession(null, enrichment);
    }

    public static boolean enrichSession(@Nullable HoneyHiveTracer tracer, SessionEnrichment enrichment) {
        HoneyHiveTracer resolved = resolve(tracer);
        if (resolved == null) {
            logger.debug("enrichSession called with no tracer in scope");
            return false;
        }
        return resolved.enrichSession(enrichment);
    }

    @Nullable
    private static HoneyHiveTracer resolve(@Nullable HoneyHiveTracer explicit) {
        return TracerRegistry.processWide().discover(explicit, ContextPropagator.current());
    }
}
