package net.honeyhive.Aspect.Components.Utility;

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsRecorderTest {

    private SimpleMeterRegistry meterRegistry;
    private MicrometerMetricsRecorder recorder;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        recorder = new MicrometerMetricsRecorder(meterRegistry);
    }

    @Test
    void testSessionOutcomesAreTimedByStatus() {
        recorder.recordSession(true, System.currentTimeMillis() - 30);
        recorder.recordSession(false, System.currentTimeMillis());
        recorder.recordSession(false, System.currentTimeMillis());

        Timer success = meterRegistry.get("honeyhive.tracer.session").tag("status", "success").timer();
        assertEquals(1, success.count());
        assertTrue(success.totalTime(TimeUnit.MILLISECONDS) >= 30);
        assertEquals(2, meterRegistry.get("honeyhive.tracer.session").tag("status", "failure").timer().count());
    }

    @Test
    void testEnrichmentIsTaggedByTarget() {
        recorder.recordEnrichment("span", true);
        recorder.recordEnrichment("session", false);

        assertEquals(1.0, meterRegistry.get("honeyhive.tracer.enrichment")
                .tag("target", "span").tag("status", "success").counter().count());
        assertEquals(1.0, meterRegistry.get("honeyhive.tracer.enrichment")
                .tag("target", "session").tag("status", "failure").counter().count());
    }

    @Test
    void testTimersRecordFlushesAndCalls() {
        recorder.recordFlush(true, System.currentTimeMillis() - 20);
        recorder.recordTracedCall("async", true, System.currentTimeMillis() - 5);

        assertEquals(1, meterRegistry.get("honeyhive.tracer.flush").tag("status", "success").timer().count());
        assertEquals(1, meterRegistry.get("honeyhive.tracer.traced.calls")
                .tag("mode", "async").tag("status", "success").timer().count());
        assertTrue(recorder.isAvailable());
        assertFalse(NoOpMetricsRecorder.INSTANCE.isAvailable());
    }
}
