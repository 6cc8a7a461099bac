package net.honeyhive.Aspect.Components.Utility;

/**
 * Interface responsible for recording tracer metrics.
 * Decouples the library from specific metrics implementations like Micrometer.
 */
public interface MetricsRecorder {

    /**
     * Records the outcome of a session start request.
     *
     * @param success whether a session id was obtained
     * @param startTime the start time in milliseconds
     */
    void recordSession(boolean success, long startTime);

    /**
     * Records a flush of the shared provider.
     *
     * @param success whether every processor flushed within the deadline
     * @param startTime the start time in milliseconds
     */
    void recordFlush(boolean success, long startTime);

    /**
     * Records an enrichment call.
     *
     * @param target {@code span} or {@code session}
     * @param success whether the enrichment was applied
     */
    void recordEnrichment(String target, boolean success);

    /**
     * Records a decorated call.
     *
     * @param mode {@code sync} or {@code async}
     * @param success whether the call completed without an error
     * @param startTime the start time in milliseconds
     */
    void recordTracedCall(String mode, boolean success, long startTime);

    /**
     * Checks if metrics recording is available.
     *
     * @return true if metrics recording is enabled and available
     */
    boolean isAvailable();
}
