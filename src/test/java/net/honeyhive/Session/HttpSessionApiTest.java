package net.honeyhive.Session;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class HttpSessionApiTest {

    private MockRestServiceServer server;

    private HttpSessionApi sessionApi;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        sessionApi = new HttpSessionApi(restTemplate, "https://api.test/", "key-1");
    }

    @Test
    void testCreateSessionPostsSessionStart() {
        server.expect(requestTo("https://api.test/session/start"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer key-1"))
                .andExpect(jsonPath("$.session.project").value("p1"))
                .andExpect(jsonPath("$.session.source").value("dev"))
                .andExpect(jsonPath("$.session.session_name").value("run-1"))
                .andRespond(withSuccess("{\"session_id\":\"sess-1\"}", MediaType.APPLICATION_JSON));

        assertEquals("sess-1", sessionApi.createSession("p1", "dev", "run-1"));
        server.verify();
    }

    @Test
    void testCreateSessionReadsNestedSessionId() {
        server.expect(requestTo("https://api.test/session/start"))
                .andRespond(withSuccess("{\"session\":{\"session_id\":\"sess-nested\"}}", MediaType.APPLICATION_JSON));

        assertEquals("sess-nested", sessionApi.createSession("p1", "dev", "run-1"));
    }

    @Test
    void testResponseWithoutSessionIdIsAnError() {
        server.expect(requestTo("https://api.test/session/start"))
                .andRespond(withSuccess("{\"status\":\"ok\"}", MediaType.APPLICATION_JSON));

        assertThrows(SessionApiException.class, () -> sessionApi.createSession("p1", "dev", "run-1"));
    }

    @Test
    void testServerErrorIsWrapped() {
        server.expect(requestTo("https://api.test/session/start")).andRespond(withServerError());

        SessionApiException e = assertThrows(SessionApiException.class,
                () -> sessionApi.createSession("p1", "dev", "run-1"));
        assertNotNull(e.getCause());
    }

    @Test
    void testEnrichSessionPutsEventUpdate() {
        server.expect(requestTo("https://api.test/events"))
                .andExpect(method(HttpMethod.PUT))
                .andExpect(jsonPath("$.event_id").value("sess-1"))
                .andExpect(jsonPath("$.metadata.stage").value("eval"))
                .andExpect(jsonPath("$.feedback.rating").value(5))
                .andExpect(jsonPath("$.user_properties.plan").value("pro"))
                .andExpect(jsonPath("$.config").exists())
                .andRespond(withSuccess());

        SessionEnrichment enrichment = SessionEnrichment.builder()
                .metadata(Map.of("stage", "eval"))
                .feedback(Map.of("rating", 5))
                .userProperties(Map.of("plan", "pro"))
                .build();

        assertTrue(sessionApi.enrichSession("sess-1", enrichment));
        server.verify();
    }
}
