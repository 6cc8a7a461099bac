package net.honeyhive.Session;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.lang.Nullable;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * {@link SessionApi} backed by a plain {@link RestTemplate}.
 *
 * The template is private to this client and never passes through application
 * {@code RestTemplateCustomizer}s, so the tracer's own calls are not traced.
 */
public class HttpSessionApi implements SessionApi {

    private static final Logger logger = LoggerFactory.getLogger(HttpSessionApi.class);

    static final String SESSION_START_PATH = "/session/start";
    static final String EVENTS_PATH = "/events";

    private final RestTemplate restTemplate;
    private final String serverUrl;
    private final String apiKey;

    public HttpSessionApi(String serverUrl, String apiKey, long timeoutMillis) {
        this(new RestTemplate(requestFactory(timeoutMillis)), serverUrl, apiKey);
    }

    public HttpSessionApi(RestTemplate restTemplate, String serverUrl, String apiKey) {
        this.restTemplate = restTemplate;
        this.serverUrl = serverUrl.endsWith("/") ? serverUrl.substring(0, serverUrl.length() - 1) : serverUrl;
        this.apiKey = apiKey;
    }

    private static SimpleClientHttpRequestFactory requestFactory(long timeoutMillis) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        int timeout = (int) Math.min(Integer.MAX_VALUE, timeoutMillis);
        factory.setConnectTimeout(timeout);
        factory.setReadTimeout(timeout);
        return factory;
    }

    @Override
    public String createSession(String project, String source, String sessionName) {
        Map<String, Object> body = Map.of("session", Map.of(
                "project", project,
                "session_name", sessionName,
                "source", source));
        ResponseEntity<JsonNode> response;
        try {
            response = restTemplate.exchange(serverUrl + SESSION_START_PATH, HttpMethod.POST,
                    new HttpEntity<>(body, headers()), JsonNode.class);
        } catch (RestClientException e) {
            throw new SessionApiException("session start failed: " + e.getMessage(), e);
        }
        String sessionId = sessionIdFrom(response.getBody());
        if (sessionId == null) {
            throw new SessionApiException("session start response carried no session_id: " + response.getBody());
        }
        logger.debug("Session {} started for project {}", sessionId, project);
        return sessionId;
    }

    @Nullable
    private static String sessionIdFrom(@Nullable JsonNode body) {
        if (body == null) {
            return null;
        }
        JsonNode id = body.path("session_id");
        if (id.isMissingNode() || id.isNull()) {
            id = body.path("session").path("session_id");
        }
        return id.isTextual() && !id.asText().isEmpty() ? id.asText() : null;
    }

    @Override
    public boolean enrichSession(String sessionId, SessionEnrichment enrichment) {
        try {
            ResponseEntity<Void> response = restTemplate.exchange(serverUrl + EVENTS_PATH, HttpMethod.PUT,
                    new HttpEntity<>(enrichment.toEventUpdate(sessionId), headers()), Void.class);
            return response.getStatusCode().is2xxSuccessful();
        } catch (RestClientException e) {
            throw new SessionApiException("session enrichment failed: " + e.getMessage(), e);
        }
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey);
        headers.setContentType(MediaType.APPLICATION_JSON);
        return headers;
    }
}
