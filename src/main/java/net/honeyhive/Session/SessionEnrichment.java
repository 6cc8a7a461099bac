package net.honeyhive.Session;

import lombok.Builder;
import lombok.Data;
import org.springframework.lang.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Payload applied to a remote session record by {@code enrichSession}.
 * Empty sections are left out of the request, except {@code config}, which is always
 * sent and defaults to an empty object.
 */
@Data
@Builder(toBuilder = true)
public class SessionEnrichment {

    @Builder.Default
    private final Map<String, ?> metadata = Map.of();

    @Builder.Default
    private final Map<String, ?> feedback = Map.of();

    @Builder.Default
    private final Map<String, ?> metrics = Map.of();

    @Builder.Default
    private final Map<String, ?> config = Map.of();

    @Builder.Default
    private final Map<String, ?> inputs = Map.of();

    @Builder.Default
    private final Map<String, ?> outputs = Map.of();

    @Builder.Default
    private final Map<String, ?> userProperties = Map.of();

    /*
        Explicit target session; when null the tracer's own session is used.
     */
    @Nullable
    @Builder.Default
    private final String sessionId = null;

    /**
     * Request body for {@code PUT /events}.
     */
    public Map<String, Object> toEventUpdate(String eventId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("event_id", eventId);
        putIfNotEmpty(body, "metadata", metadata);
        putIfNotEmpty(body, "feedback", feedback);
        putIfNotEmpty(body, "metrics", metrics);
        putIfNotEmpty(body, "inputs", inputs);
        putIfNotEmpty(body, "outputs", outputs);
        body.put("config", config != null ? config : Map.of());
        putIfNotEmpty(body, "user_properties", userProperties);
        return body;
    }

    private static void putIfNotEmpty(Map<String, Object> body, String key, @Nullable Map<String, ?> section) {
        if (section != null && !section.isEmpty()) {
            body.put(key, section);
        }
    }
}
