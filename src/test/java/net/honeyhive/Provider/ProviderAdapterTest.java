package net.honeyhive.Provider;

import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SpanProcessor;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import net.honeyhive.Config.HoneyHiveProperties;
import net.honeyhive.Enrichment.EnrichmentSpanProcessor;
import net.honeyhive.TestTracers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ProviderAdapterTest {

    private ProviderRegistry registry;
    private ProviderAdapter adapter;
    private InMemorySpanExporter exporter;

    @BeforeEach
    void setUp() {
        registry = new ProviderRegistry(false);
        adapter = new ProviderAdapter(registry);
        exporter = InMemorySpanExporter.create();
    }

    @Test
    void testFirstTracerOwnsSecondAttaches() {
        HoneyHiveProperties config = TestTracers.properties("p1");
        EnrichmentSpanProcessor first = new EnrichmentSpanProcessor();
        EnrichmentSpanProcessor second = new EnrichmentSpanProcessor();

        ProviderLease owner = adapter.acquireProvider(config, first, exporter);
        ProviderLease joiner = adapter.acquireProvider(TestTracers.properties("p2"), second, null);

        assertTrue(owner.owner());
        assertFalse(joiner.owner());
        assertSame(owner.provider(), joiner.provider());
        assertSame(owner.provider(), registry.current());
        assertEquals(2, owner.provider().references());
        assertTrue(owner.provider().processors().get(0) instanceof BatchSpanProcessor);
        assertTrue(owner.provider().processors().contains(first));
        assertTrue(owner.provider().processors().contains(second));

        adapter.releaseProvider(joiner, second);
        adapter.releaseProvider(owner, first);
    }

    @Test
    void testReleasingOneTracerKeepsTheOtherExporting() {
        EnrichmentSpanProcessor first = new EnrichmentSpanProcessor();
        EnrichmentSpanProcessor second = new EnrichmentSpanProcessor();
        ProviderLease owner = adapter.acquireProvider(TestTracers.properties("p1"), first, exporter);
        ProviderLease joiner = adapter.acquireProvider(TestTracers.properties("p2"), second, null);

        adapter.releaseProvider(owner, first);

        TraceProvider provider = joiner.provider();
        assertFalse(provider.isShutdown());
        assertFalse(provider.processors().contains(first));
        provider.getTracer("test").spanBuilder("after-release").startSpan().end();
        provider.getSdkTracerProvider().forceFlush().join(5, TimeUnit.SECONDS);
        assertEquals(1, exporter.getFinishedSpanItems().size());

        adapter.releaseProvider(joiner, second);
        assertTrue(provider.isShutdown());
        assertNull(registry.current());
    }

    @Test
    void testReleasingTwiceIsHarmless() {
        EnrichmentSpanProcessor processor = new EnrichmentSpanProcessor();
        ProviderLease lease = adapter.acquireProvider(TestTracers.properties("p1"), processor, exporter);
        EnrichmentSpanProcessor other = new EnrichmentSpanProcessor();
        ProviderLease otherLease = adapter.acquireProvider(TestTracers.properties("p1"), other, null);

        adapter.releaseProvider(lease, processor);
        adapter.releaseProvider(lease, processor);

        assertEquals(1, otherLease.provider().references());
        assertFalse(otherLease.provider().isShutdown());
        adapter.releaseProvider(otherLease, other);
    }

    @Test
    void testNextAcquireAfterShutdownCreatesFreshProvider() {
        EnrichmentSpanProcessor processor = new EnrichmentSpanProcessor();
        ProviderLease first = adapter.acquireProvider(TestTracers.properties("p1"), processor, exporter);
        adapter.releaseProvider(first, processor);

        ProviderLease second = adapter.acquireProvider(TestTracers.properties("p1"), processor, exporter);

        assertTrue(second.owner());
        assertNotSame(first.provider(), second.provider());
        adapter.releaseProvider(second, processor);
    }

    @Test
    void testTestModeUsesNoOpExport() {
        HoneyHiveProperties config = TestTracers.properties("p1");
        config.setTestMode(true);
        config.setOtlpEnabled(true);
        EnrichmentSpanProcessor processor = new EnrichmentSpanProcessor();

        ProviderLease lease = adapter.acquireProvider(config, processor, null);

        SpanProcessor export = lease.provider().processors().get(0);
        assertTrue(export instanceof SimpleSpanProcessor);
        assertFalse(lease.degraded());
        adapter.releaseProvider(lease, processor);
    }

    @Test
    void testBrokenExporterConfigurationFallsBackToDegradedProvider() {
        HoneyHiveProperties config = TestTracers.properties("p1");
        config.setOtlpEnabled(true);
        config.setServerUrl("ftp://collector.invalid");
        EnrichmentSpanProcessor processor = new EnrichmentSpanProcessor();

        ProviderLease lease = adapter.acquireProvider(config, processor, null);

        assertTrue(lease.owner());
        assertTrue(lease.degraded());
        assertTrue(lease.provider().isDegraded());
        assertNull(registry.current());
        lease.provider().getTracer("test").spanBuilder("dropped").startSpan().end();
        adapter.releaseProvider(lease, processor);
        assertTrue(lease.provider().isShutdown());
    }
}
