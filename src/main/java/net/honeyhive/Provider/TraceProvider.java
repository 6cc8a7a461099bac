package net.honeyhive.Provider;

import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.SpanProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * An SDK tracer provider together with the processors attached to it.
 *
 * Each tracer using the provider holds one reference, taken by {@link #attach} and
 * returned by {@link #release}. The SDK provider is shut down when the last reference
 * is returned.
 */
public class TraceProvider {

    private static final Logger logger = LoggerFactory.getLogger(TraceProvider.class);

    static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

    private final SdkTracerProvider sdkTracerProvider;
    private final AttachableSpanProcessor attachable;
    private final boolean degraded;
    private final AtomicInteger references = new AtomicInteger();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    TraceProvider(SdkTracerProvider sdkTracerProvider, AttachableSpanProcessor attachable, boolean degraded) {
        this.sdkTracerProvider = sdkTracerProvider;
        this.attachable = attachable;
        this.degraded = degraded;
    }

    /**
     * Adds a tracer's processor and takes a reference.
     *
     * @throws IllegalStateException if the provider was already shut down
     */
    public void attach(SpanProcessor processor) {
        if (shutdown.get()) {
            throw new IllegalStateException("trace provider already shut down");
        }
        attachable.attach(processor);
        references.incrementAndGet();
    }

    /**
     * Detaches the caller's own processor and returns its reference.
     *
     * @return true if this release shut the provider down
     */
    public boolean release(SpanProcessor processor) {
        if (!attachable.detach(processor)) {
            return false;
        }
        if (references.decrementAndGet() > 0) {
            return false;
        }
        shutdown();
        return true;
    }

    public Tracer getTracer(String instrumentationName) {
        return sdkTracerProvider.get(instrumentationName);
    }

    /**
     * Every processor currently attached, including the export pipeline.
     */
    public List<SpanProcessor> processors() {
        return attachable.processors();
    }

    public int references() {
        return references.get();
    }

    public boolean isDegraded() {
        return degraded;
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    public SdkTracerProvider getSdkTracerProvider() {
        return sdkTracerProvider;
    }

    void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        try {
            boolean clean = sdkTracerProvider.shutdown()
                    .join(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                    .isSuccess();
            if (clean) {
                logger.info("Trace provider shut down");
            } else {
                logger.warn("Trace provider did not shut down cleanly within {}s", SHUTDOWN_TIMEOUT_SECONDS);
            }
        } catch (RuntimeException e) {
            logger.warn("Error shutting down trace provider: {}", e.getMessage());
        }
    }
}
