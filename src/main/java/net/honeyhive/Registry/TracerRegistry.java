package net.honeyhive.Registry;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import net.honeyhive.Context.BaggageKeys;
import net.honeyhive.Context.TracingContext;
import net.honeyhive.Tracing.HoneyHiveTracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

/**
 * Live tracer instances, keyed by tracer id.
 *
 * Values are held weakly, so a tracer nobody references any more drops out without an
 * explicit {@link #unregister}. The only implicit way to find a tracer is the
 * {@code honeyhive_tracer_id} baggage entry of the current context.
 */
public class TracerRegistry {

    private static final Logger logger = LoggerFactory.getLogger(TracerRegistry.class);

    private static final TracerRegistry PROCESS_WIDE = new TracerRegistry();

    private final Cache<String, HoneyHiveTracer> tracers;

    public TracerRegistry() {
        this.tracers = Caffeine.newBuilder()
                .weakValues()
                .build();
    }

    public static TracerRegistry processWide() {
        return PROCESS_WIDE;
    }

    public void register(HoneyHiveTracer tracer) {
        tracers.put(tracer.getTracerId(), tracer);
        logger.debug("Registered tracer {}", tracer.getTracerId());
    }

    public void unregister(String tracerId) {
        tracers.invalidate(tracerId);
        logger.debug("Unregistered tracer {}", tracerId);
    }

    @Nullable
    public HoneyHiveTracer lookup(@Nullable String tracerId) {
        if (tracerId == null) {
            return null;
        }
        return tracers.getIfPresent(tracerId);
    }

    /**
     * Resolves the tracer for a call: the explicit one if given, otherwise the one named
     * by the context's baggage.
     *
     * @return the tracer, or null if neither source names a live one
     */
    @Nullable
    public HoneyHiveTracer discover(@Nullable HoneyHiveTracer explicit, TracingContext context) {
        if (explicit != null) {
            return explicit;
        }
        return lookup(context.getBaggage(BaggageKeys.TRACER_ID));
    }

    public long size() {
        tracers.cleanUp();
        return tracers.estimatedSize();
    }
}
