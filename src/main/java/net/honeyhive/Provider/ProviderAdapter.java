package net.honeyhive.Provider;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.exporter.otlp.http.trace.OtlpHttpSpanExporter;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.SpanProcessor;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import net.honeyhive.Config.HoneyHiveProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.time.Duration;

/**
 * Decides whether a tracer joins the process's main provider or creates it.
 *
 * A new provider gets the tracer's enrichment processor plus one export pipeline:
 * the caller's exporter when given, the OTLP/HTTP exporter when export is enabled
 * outside test mode, and a no-op sink otherwise. If building it fails the tracer is
 * handed a degraded local provider that drops its spans.
 */
public class ProviderAdapter {

    private static final Logger logger = LoggerFactory.getLogger(ProviderAdapter.class);

    static final String TRACES_PATH = "/opentelemetry/v1/traces";
    static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    static final AttributeKey<String> DEPLOYMENT_ENVIRONMENT = AttributeKey.stringKey("deployment.environment");
    static final String INSTRUMENTATION_NAME = "honeyhive-tracer";

    private static final Duration EXPORTER_TIMEOUT = Duration.ofSeconds(10);

    private final ProviderRegistry registry;

    public ProviderAdapter(ProviderRegistry registry) {
        this.registry = registry;
    }

    public ProviderLease acquireProvider(HoneyHiveProperties config,
                                         SpanProcessor enrichmentProcessor,
                                         @Nullable SpanExporter customExporter) {
        try {
            return registry.acquire(() -> createProvider(config, customExporter), enrichmentProcessor);
        } catch (RuntimeException e) {
            logger.warn("Failed to create trace provider ({}), falling back to a local provider without export",
                    e.getMessage());
            TraceProvider fallback = buildProvider(config, SimpleSpanProcessor.create(NoOpSpanExporter.INSTANCE), true);
            fallback.attach(enrichmentProcessor);
            return new ProviderLease(fallback, true, true);
        }
    }

    public void releaseProvider(ProviderLease lease, SpanProcessor enrichmentProcessor) {
        registry.release(lease, enrichmentProcessor);
    }

    TraceProvider createProvider(HoneyHiveProperties config, @Nullable SpanExporter customExporter) {
        return buildProvider(config, exportProcessor(config, customExporter), false);
    }

    private SpanProcessor exportProcessor(HoneyHiveProperties config, @Nullable SpanExporter customExporter) {
        if (customExporter != null) {
            logger.info("Exporting spans through custom exporter {}", customExporter);
            return batch(customExporter);
        }
        if (config.isTestMode() || !config.isOtlpEnabled()) {
            logger.info("Remote span export disabled (testMode={}, otlpEnabled={})",
                    config.isTestMode(), config.isOtlpEnabled());
            return SimpleSpanProcessor.create(NoOpSpanExporter.INSTANCE);
        }
        String endpoint = config.getServerUrl() + TRACES_PATH;
        OtlpHttpSpanExporter exporter = OtlpHttpSpanExporter.builder()
                .setEndpoint(endpoint)
                .setTimeout(EXPORTER_TIMEOUT)
                .addHeader("Authorization", "Bearer " + config.resolvedApiKey())
                .addHeader("X-Project", config.getProject())
                .addHeader("X-Source", config.getSource())
                .build();
        logger.info("Exporting spans to {}", endpoint);
        return batch(exporter);
    }

    private static SpanProcessor batch(SpanExporter exporter) {
        return BatchSpanProcessor.builder(exporter)
                .setMaxExportBatchSize(512)
                .setMaxQueueSize(2048)
                .setExporterTimeout(EXPORTER_TIMEOUT)
                .setScheduleDelay(Duration.ofMillis(5000))
                .build();
    }

    private static TraceProvider buildProvider(HoneyHiveProperties config, SpanProcessor exportProcessor,
                                               boolean degraded) {
        Resource resource = Resource.getDefault()
                .merge(Resource.create(Attributes.of(
                        SERVICE_NAME, INSTRUMENTATION_NAME,
                        DEPLOYMENT_ENVIRONMENT, config.getSource())));
        AttachableSpanProcessor attachable = new AttachableSpanProcessor();
        attachable.attach(exportProcessor);
        SdkTracerProvider sdkTracerProvider = SdkTracerProvider.builder()
                .setResource(resource)
                .addSpanProcessor(attachable)
                .build();
        return new TraceProvider(sdkTracerProvider, attachable, degraded);
    }
}
