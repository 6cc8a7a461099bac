package net.honeyhive.Provider;

import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.SpanProcessor;
import net.honeyhive.Aspect.Components.Utility.MetricsRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.util.concurrent.TimeUnit;

/**
 * Drains every processor on a provider within one shared deadline.
 *
 * Never throws. The result is true only if every processor finished flushing
 * successfully before the deadline. Safe to call repeatedly.
 */
public class FlushCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(FlushCoordinator.class);

    private final MetricsRecorder metricsRecorder;

    public FlushCoordinator(MetricsRecorder metricsRecorder) {
        this.metricsRecorder = metricsRecorder;
    }

    public boolean forceFlush(@Nullable TraceProvider provider, long timeoutMillis) {
        long startTime = System.currentTimeMillis();
        boolean success = flushAll(provider, timeoutMillis);
        metricsRecorder.recordFlush(success, startTime);
        return success;
    }

    private boolean flushAll(@Nullable TraceProvider provider, long timeoutMillis) {
        if (provider == null || provider.isShutdown()) {
            logger.debug("Nothing to flush: provider absent or shut down");
            return true;
        }
        if (timeoutMillis <= 0) {
            logger.warn("Flush skipped: timeout must be positive, got {}ms", timeoutMillis);
            return false;
        }
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
        boolean allSucceeded = true;
        for (SpanProcessor processor : provider.processors()) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                logger.warn("Flush deadline of {}ms expired before {} was flushed", timeoutMillis, processor);
                return false;
            }
            try {
                CompletableResultCode result = processor.forceFlush().join(remaining, TimeUnit.NANOSECONDS);
                if (!result.isSuccess()) {
                    logger.warn("Span processor {} did not flush within the deadline", processor);
                    allSucceeded = false;
                }
            } catch (RuntimeException e) {
                logger.warn("Span processor {} failed to flush: {}", processor, e.getMessage());
                allSucceeded = false;
            }
        }
        return allSucceeded;
    }
}
