package net.honeyhive.Enrichment;

import net.honeyhive.Aspect.Components.Utility.MetricsRecorder;
import net.honeyhive.Session.SessionApi;
import net.honeyhive.Session.SessionApiException;
import net.honeyhive.Session.SessionEnrichment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SessionEnricherTest {

    @Mock
    private SessionApi sessionApi;

    @Mock
    private MetricsRecorder metricsRecorder;

    private SessionEnricher enricher;

    private final SessionEnrichment enrichment = SessionEnrichment.builder()
            .metadata(Map.of("stage", "eval"))
            .build();

    @BeforeEach
    void setUp() {
        enricher = new SessionEnricher(sessionApi, metricsRecorder);
    }

    @Test
    void testMissingSessionIdSkipsBackend() {
        assertFalse(enricher.enrichSession(null, enrichment));
        assertFalse(enricher.enrichSession(" ", enrichment));

        verifyNoInteractions(sessionApi);
        verify(metricsRecorder, times(2)).recordEnrichment("session", false);
    }

    @Test
    void testAcceptedUpdateReturnsTrue() {
        when(sessionApi.enrichSession("sess-1", enrichment)).thenReturn(true);

        assertTrue(enricher.enrichSession("sess-1", enrichment));
        verify(metricsRecorder).recordEnrichment("session", true);
    }

    @Test
    void testBackendFailureReturnsFalse() {
        when(sessionApi.enrichSession(anyString(), any())).thenThrow(new SessionApiException("503"));

        assertFalse(enricher.enrichSession("sess-1", enrichment));
        verify(metricsRecorder).recordEnrichment("session", false);
    }
}
