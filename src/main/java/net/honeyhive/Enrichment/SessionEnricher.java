package net.honeyhive.Enrichment;

import net.honeyhive.Aspect.Components.Utility.MetricsRecorder;
import net.honeyhive.Session.SessionApi;
import net.honeyhive.Session.SessionEnrichment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

/**
 * Sends session enrichments to the backend.
 */
public class SessionEnricher {

    private static final Logger logger = LoggerFactory.getLogger(SessionEnricher.class);

    static final String TARGET = "session";

    private final SessionApi sessionApi;
    private final MetricsRecorder metricsRecorder;

    public SessionEnricher(SessionApi sessionApi, MetricsRecorder metricsRecorder) {
        this.sessionApi = sessionApi;
        this.metricsRecorder = metricsRecorder;
    }

    /**
     * @return whether the backend accepted the update; false without a call when
     *         {@code sessionId} is null
     */
    public boolean enrichSession(@Nullable String sessionId, SessionEnrichment enrichment) {
        if (sessionId == null || sessionId.isBlank()) {
            logger.debug("No session id available, skipping session enrichment");
            metricsRecorder.recordEnrichment(TARGET, false);
            return false;
        }
        boolean accepted;
        try {
            accepted = sessionApi.enrichSession(sessionId, enrichment);
        } catch (RuntimeException e) {
            logger.warn("Failed to enrich session {}: {}", sessionId, e.getMessage());
            accepted = false;
        }
        metricsRecorder.recordEnrichment(TARGET, accepted);
        return accepted;
    }
}
