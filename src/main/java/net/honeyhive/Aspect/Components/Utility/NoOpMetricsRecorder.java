package net.honeyhive.Aspect.Components.Utility;

/**
 * No-Op implementation of MetricsRecorder.
 * Used when Micrometer is not on the classpath or no registry is configured.
 */
public class NoOpMetricsRecorder implements MetricsRecorder {

    public static final NoOpMetricsRecorder INSTANCE = new NoOpMetricsRecorder();

    @Override
    public void recordSession(boolean success, long startTime) {
        // No-Op
    }

    @Override
    public void recordFlush(boolean success, long startTime) {
        // No-Op
    }

    @Override
    public void recordEnrichment(String target, boolean success) {
        // No-Op
    }

    @Override
    public void recordTracedCall(String mode, boolean success, long startTime) {
        // No-Op
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
