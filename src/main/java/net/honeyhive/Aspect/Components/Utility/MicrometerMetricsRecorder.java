package net.honeyhive.Aspect.Components.Utility;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer-based implementation of MetricsRecorder.
 */
public class MicrometerMetricsRecorder implements MetricsRecorder {

    private static final Logger logger = LoggerFactory.getLogger(MicrometerMetricsRecorder.class);

    static final String SESSION = "honeyhive.tracer.session";
    static final String FLUSH = "honeyhive.tracer.flush";
    static final String ENRICHMENT = "honeyhive.tracer.enrichment";
    static final String TRACED_CALLS = "honeyhive.tracer.traced.calls";

    private final MeterRegistry meterRegistry;

    public MicrometerMetricsRecorder(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void recordSession(boolean success, long startTime) {
        try {
            Timer.builder(SESSION)
                    .tag("status", status(success))
                    .register(meterRegistry)
                    .record(System.currentTimeMillis() - startTime, TimeUnit.MILLISECONDS);
        } catch (Exception e) {
            logger.warn("failed to record session metrics: {}", e.getMessage());
        }
    }

    @Override
    public void recordFlush(boolean success, long startTime) {
        try {
            Timer.builder(FLUSH)
                    .tag("status", status(success))
                    .register(meterRegistry)
                    .record(System.currentTimeMillis() - startTime, TimeUnit.MILLISECONDS);
        } catch (Exception e) {
            logger.warn("failed to record flush metrics: {}", e.getMessage());
        }
    }

    @Override
    public void recordEnrichment(String target, boolean success) {
        try {
            Counter.builder(ENRICHMENT)
                    .tag("target", target)
                    .tag("status", status(success))
                    .register(meterRegistry)
                    .increment();
        } catch (Exception e) {
            logger.warn("failed to record enrichment metrics for {}: {}", target, e.getMessage());
        }
    }

    @Override
    public void recordTracedCall(String mode, boolean success, long startTime) {
        try {
            Timer.builder(TRACED_CALLS)
                    .tag("mode", mode)
                    .tag("status", status(success))
                    .publishPercentiles(0.5, 0.99)
                    .register(meterRegistry)
                    .record(System.currentTimeMillis() - startTime, TimeUnit.MILLISECONDS);
        } catch (Exception e) {
            logger.warn("failed to record traced call metrics for mode {}: {}", mode, e.getMessage());
        }
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    private static String status(boolean success) {
        return success ? "success" : "failure";
    }
}
