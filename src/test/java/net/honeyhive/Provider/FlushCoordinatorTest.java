package net.honeyhive.Provider;

import io.opentelemetry.context.Context;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.ReadWriteSpan;
import io.opentelemetry.sdk.trace.ReadableSpan;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.SpanProcessor;
import net.honeyhive.Aspect.Components.Utility.MetricsRecorder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FlushCoordinatorTest {

    @Mock
    private MetricsRecorder metricsRecorder;

    private TraceProvider provider;
    private FlushCoordinator coordinator;

    @BeforeEach
    void setUp() {
        AttachableSpanProcessor attachable = new AttachableSpanProcessor();
        provider = new TraceProvider(SdkTracerProvider.builder().addSpanProcessor(attachable).build(),
                attachable, false);
        coordinator = new FlushCoordinator(metricsRecorder);
    }

    @AfterEach
    void tearDown() {
        provider.shutdown();
    }

    @Test
    void testSuccessfulFlushIsIdempotent() {
        StubProcessor processor = new StubProcessor(CompletableResultCode::ofSuccess);
        provider.attach(processor);

        assertTrue(coordinator.forceFlush(provider, 1_000));
        assertTrue(coordinator.forceFlush(provider, 1_000));
        assertEquals(2, processor.flushes.get());
        verify(metricsRecorder, times(2)).recordFlush(eq(true), anyLong());
    }

    @Test
    void testFailedProcessorMakesResultFalseButOthersStillFlush() {
        StubProcessor failing = new StubProcessor(CompletableResultCode::ofFailure);
        StubProcessor healthy = new StubProcessor(CompletableResultCode::ofSuccess);
        provider.attach(failing);
        provider.attach(healthy);

        assertFalse(coordinator.forceFlush(provider, 1_000));
        assertEquals(1, healthy.flushes.get());
        verify(metricsRecorder).recordFlush(eq(false), anyLong());
    }

    @Test
    void testThrowingProcessorIsContained() {
        provider.attach(new StubProcessor(() -> {
            throw new IllegalStateException("exporter closed");
        }));

        assertFalse(assertDoesNotThrow(() -> coordinator.forceFlush(provider, 1_000)));
    }

    @Test
    void testHangingProcessorIsBoundedByTimeout() {
        provider.attach(new StubProcessor(CompletableResultCode::new));

        long start = System.nanoTime();
        assertFalse(coordinator.forceFlush(provider, 200));
        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 2_000);
    }

    @Test
    void testAbsentOrShutdownProviderHasNothingToFlush() {
        assertTrue(coordinator.forceFlush(null, 1_000));

        provider.shutdown();
        assertTrue(coordinator.forceFlush(provider, 1_000));
    }

    @Test
    void testNonPositiveTimeoutFails() {
        assertFalse(coordinator.forceFlush(provider, 0));
        assertFalse(coordinator.forceFlush(provider, -5));
    }

    private static final class StubProcessor implements SpanProcessor {

        private final Supplier<CompletableResultCode> onFlush;
        private final AtomicInteger flushes = new AtomicInteger();

        StubProcessor(Supplier<CompletableResultCode> onFlush) {
            this.onFlush = onFlush;
        }

        @Override
        public void onStart(Context parentContext, ReadWriteSpan span) {
        }

        @Override
        public boolean isStartRequired() {
            return false;
        }

        @Override
        public void onEnd(ReadableSpan span) {
        }

        @Override
        public boolean isEndRequired() {
            return false;
        }

        @Override
        public CompletableResultCode forceFlush() {
            flushes.incrementAndGet();
            return onFlush.get();
        }
    }
}
