package net.honeyhive.Provider;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.baggage.propagation.W3CBaggagePropagator;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.context.propagation.TextMapPropagator;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.trace.SpanProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.util.function.Supplier;

/**
 * Holds the process's main trace provider.
 *
 * At most one provider is main at a time. The first tracer to acquire creates it and
 * becomes its owner; later tracers attach to it. Once the last tracer releases the main
 * provider the slot is cleared and the next acquire creates a fresh one.
 */
public class ProviderRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ProviderRegistry.class);

    private static final ProviderRegistry PROCESS_WIDE = new ProviderRegistry(true);

    private final boolean registerGlobal;

    @Nullable
    private TraceProvider main;

    /**
     * @param registerGlobal also publish a newly created main provider as
     *                       {@link GlobalOpenTelemetry}, for third-party instrumentation
     */
    public ProviderRegistry(boolean registerGlobal) {
        this.registerGlobal = registerGlobal;
    }

    public static ProviderRegistry processWide() {
        return PROCESS_WIDE;
    }

    /**
     * Attaches {@code processor} to the main provider, creating one with {@code factory}
     * if there is none.
     *
     * @throws RuntimeException whatever {@code factory} throws; nothing is registered then
     */
    public synchronized ProviderLease acquire(Supplier<TraceProvider> factory, SpanProcessor processor) {
        if (main != null && !main.isShutdown()) {
            main.attach(processor);
            logger.info("Attached to existing trace provider ({} tracers)", main.references());
            return new ProviderLease(main, false, main.isDegraded());
        }
        TraceProvider created = factory.get();
        created.attach(processor);
        main = created;
        publishGlobal(created);
        logger.info("Created and registered main trace provider");
        return new ProviderLease(created, true, created.isDegraded());
    }

    /**
     * Returns a lease. The provider shuts down when its last lease is returned.
     */
    public synchronized void release(ProviderLease lease, SpanProcessor processor) {
        TraceProvider provider = lease.provider();
        if (provider.release(processor) && provider == main) {
            main = null;
        }
    }

    @Nullable
    public synchronized TraceProvider current() {
        return main;
    }

    private void publishGlobal(TraceProvider provider) {
        if (!registerGlobal) {
            return;
        }
        OpenTelemetrySdk sdk = OpenTelemetrySdk.builder()
                .setTracerProvider(provider.getSdkTracerProvider())
                .setPropagators(ContextPropagators.create(TextMapPropagator.composite(
                        W3CTraceContextPropagator.getInstance(),
                        W3CBaggagePropagator.getInstance())))
                .build();
        try {
            GlobalOpenTelemetry.set(sdk);
        } catch (IllegalStateException e) {
            // already set by the application or a previous main provider
            logger.debug("GlobalOpenTelemetry already set, leaving it in place: {}", e.getMessage());
        }
    }
}
