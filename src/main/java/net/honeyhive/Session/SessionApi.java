package net.honeyhive.Session;

/**
 * The two backend calls the tracer depends on.
 */
public interface SessionApi {

    /**
     * Starts a session and returns its identifier.
     *
     * @throws SessionApiException on any transport, auth or response failure
     */
    String createSession(String project, String source, String sessionName);

    /**
     * Applies an enrichment to an existing session record.
     *
     * @return whether the backend accepted the update
     * @throws SessionApiException on transport failure
     */
    boolean enrichSession(String sessionId, SessionEnrichment enrichment);
}
