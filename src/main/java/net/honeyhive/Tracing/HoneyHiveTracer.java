package net.honeyhive.Tracing;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import net.honeyhive.Aspect.Components.Utility.MetricsRecorder;
import net.honeyhive.Aspect.Components.Utility.NoOpMetricsRecorder;
import net.honeyhive.Config.HoneyHiveProperties;
import net.honeyhive.Context.BaggageKeys;
import net.honeyhive.Context.ContextPropagator;
import net.honeyhive.Context.TracingContext;
import net.honeyhive.Enrichment.EnrichmentScope;
import net.honeyhive.Enrichment.EnrichmentSpanProcessor;
import net.honeyhive.Enrichment.SessionEnricher;
import net.honeyhive.Enrichment.SpanAttributeWriter;
import net.honeyhive.Enrichment.SpanEnricher;
import net.honeyhive.Enrichment.SpanEnrichment;
import net.honeyhive.Experiment.ExperimentContext;
import net.honeyhive.Experiment.ExperimentContextDetector;
import net.honeyhive.Provider.FlushCoordinator;
import net.honeyhive.Provider.ProviderAdapter;
import net.honeyhive.Provider.ProviderLease;
import net.honeyhive.Provider.ProviderRegistry;
import net.honeyhive.Provider.TraceProvider;
import net.honeyhive.Registry.TracerRegistry;
import net.honeyhive.Session.HttpSessionApi;
import net.honeyhive.Session.SessionApi;
import net.honeyhive.Session.SessionEnrichment;
import net.honeyhive.Session.SessionLifecycleManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * A tracer instance: one project, source and session, contributing spans to the
 * process's shared trace provider.
 *
 * <pre>{@code
 * HoneyHiveTracer tracer = HoneyHiveTracer.init(properties);
 * TracingSpan span = tracer.startSpan("retrieve");
 * try (TracingScope scope = span.makeCurrent()) {
 *     ...
 * } finally {
 *     span.end();
 * }
 * tracer.forceFlush();
 * }</pre>
 *
 * Every span started through the tracer, or under {@link #activate()}, carries the
 * tracer's session, project, source and experiment baggage, which the shared
 * {@link EnrichmentSpanProcessor} copies onto the span. Configuration is copied at
 * construction; instances never share mutable state.
 */
public class HoneyHiveTracer implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(HoneyHiveTracer.class);

    static final String INSTRUMENTATION_NAME = "honeyhive";

    private final String tracerId;
    private final String project;
    private final String source;
    private final String sessionName;
    private final String serverUrl;
    private final boolean testMode;
    private final boolean httpTracingEnabled;
    private final boolean otlpEnabled;
    private final long flushTimeoutMillis;
    private final ExperimentContext experiment;

    private final ProviderAdapter providerAdapter;
    private final ProviderLease lease;
    private final EnrichmentSpanProcessor enrichmentProcessor;
    private final Tracer tracer;
    private final TracerRegistry tracerRegistry;
    private final SpanAttributeWriter attributeWriter;
    private final SpanEnricher spanEnricher;
    private final SessionEnricher sessionEnricher;
    private final FlushCoordinator flushCoordinator;
    private final MetricsRecorder metricsRecorder;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    @Nullable
    private volatile String sessionId;

    private HoneyHiveTracer(Builder builder, HoneyHiveProperties properties, SessionApi sessionApi) {
        this.tracerId = UUID.randomUUID().toString();
        this.project = properties.getProject();
        this.source = properties.getSource();
        this.sessionName = properties.resolvedSessionName();
        this.serverUrl = properties.getServerUrl();
        this.testMode = properties.isTestMode();
        this.httpTracingEnabled = !properties.isDisableHttpTracing();
        this.otlpEnabled = properties.isOtlpEnabled();
        this.flushTimeoutMillis = properties.getFlushTimeout();
        this.experiment = new ExperimentContextDetector(builder.objectMapper).detect(builder.environment);

        this.metricsRecorder = builder.metricsRecorder;
        this.tracerRegistry = builder.tracerRegistry;
        this.attributeWriter = new SpanAttributeWriter(builder.objectMapper);
        this.spanEnricher = new SpanEnricher(attributeWriter, metricsRecorder);
        this.sessionEnricher = new SessionEnricher(sessionApi, metricsRecorder);
        this.flushCoordinator = new FlushCoordinator(metricsRecorder);

        this.providerAdapter = new ProviderAdapter(builder.providerRegistry);
        this.enrichmentProcessor = new EnrichmentSpanProcessor();
        this.lease = providerAdapter.acquireProvider(properties, enrichmentProcessor, builder.spanExporter);
        this.tracer = lease.provider().getTracer(INSTRUMENTATION_NAME);
    }

    public static Builder builder(HoneyHiveProperties properties) {
        return new Builder(properties);
    }

    /**
     * Builds a tracer with default collaborators, blocking for the session.
     *
     * @throws net.honeyhive.Config.TracerConfigurationException if the API key is missing
     *         outside test mode
     */
    public static HoneyHiveTracer init(HoneyHiveProperties properties) {
        return builder(properties).build();
    }

    /**
     * Builds a tracer configured from {@code HH_*} environment variables.
     */
    public static HoneyHiveTracer fromEnvironment() {
        return init(HoneyHiveProperties.fromEnvironment(System.getenv()));
    }

    public String getTracerId() {
        return tracerId;
    }

    public String getProject() {
        return project;
    }

    public String getSource() {
        return source;
    }

    public String getSessionName() {
        return sessionName;
    }

    @Nullable
    public String getSessionId() {
        return sessionId;
    }

    public String getServerUrl() {
        return serverUrl;
    }

    public boolean isProviderOwner() {
        return lease.owner();
    }

    public boolean isDegraded() {
        return lease.degraded();
    }

    public boolean isTestMode() {
        return testMode;
    }

    public boolean isHttpTracingEnabled() {
        return httpTracingEnabled;
    }

    public boolean isOtlpEnabled() {
        return otlpEnabled;
    }

    public boolean isClosed() {
        return closed.get();
    }

    public ExperimentContext getExperiment() {
        return experiment;
    }

    public TraceProvider getProvider() {
        return lease.provider();
    }

    public Tracer getOpenTelemetryTracer() {
        return tracer;
    }

    /**
     * Writes a value onto a span started by this tracer, flattening maps and lists.
     */
    public void writeAttribute(TracingSpan span, String key, @Nullable Object value) {
        if (span.getUnderlyingSpan() instanceof Span otelSpan) {
            attributeWriter.write(otelSpan, key, value);
        }
    }

    /**
     * Baggage this tracer contributes to every span it starts.
     */
    public Map<String, String> baggage() {
        Map<String, String> entries = new LinkedHashMap<>();
        String current = sessionId;
        if (current != null) {
            entries.put(BaggageKeys.SESSION_ID, current);
        }
        entries.put(BaggageKeys.PROJECT, project);
        entries.put(BaggageKeys.SOURCE, source);
        entries.put(BaggageKeys.TRACER_ID, tracerId);
        entries.putAll(experiment.toBaggage());
        return entries;
    }

    /**
     * The current context with this tracer's baggage laid over it.
     *
     * A {@code session_id} already in the current baggage is kept unless it was put there
     * by another tracer's context.
     */
    public TracingContext context() {
        return context(null, null);
    }

    private TracingContext context(@Nullable String sessionOverride, @Nullable String parentId) {
        TracingContext current = ContextPropagator.current();
        Map<String, String> entries = baggage();
        String callerSession = sessionOverride;
        if (callerSession == null && !ownedByOtherTracer(current)) {
            callerSession = current.getBaggage(BaggageKeys.SESSION_ID);
        }
        if (callerSession != null && !callerSession.isEmpty()) {
            entries.put(BaggageKeys.SESSION_ID, callerSession);
        }
        if (parentId != null && !parentId.isEmpty()) {
            entries.put(BaggageKeys.PARENT_ID, parentId);
        }
        return current.withBaggage(entries);
    }

    private boolean ownedByOtherTracer(TracingContext context) {
        String owner = context.getBaggage(BaggageKeys.TRACER_ID);
        return owner != null && !owner.equals(tracerId);
    }

    /**
     * Makes this tracer's baggage current, so spans created by other instrumentation are
     * enriched and decorators without an explicit tracer discover this one.
     */
    public TracingScope activate() {
        return context().makeCurrent();
    }

    @Nullable
    public String getBaggage(String key) {
        return ContextPropagator.current().getBaggage(key);
    }

    public TracingContext withBaggage(String key, @Nullable String value) {
        return context().withBaggage(key, value);
    }

    public TracingSpan startSpan(String name) {
        return startSpan(name, SpanKind.INTERNAL, Map.of());
    }

    public TracingSpan startSpan(String name, Map<String, ?> attributes) {
        return startSpan(name, SpanKind.INTERNAL, attributes);
    }

    /**
     * Starts a span as a child of the current span. The span is not made current.
     */
    public TracingSpan startSpan(String name, SpanKind kind, Map<String, ?> attributes) {
        return startSpan(name, kind, null, null, attributes);
    }

    /**
     * Starts a span in the given session, under the given parent event. Null values fall
     * back to the current baggage, then to this tracer's own session.
     */
    public TracingSpan startSpan(String name, @Nullable String sessionId, @Nullable String parentId,
                                 Map<String, ?> attributes) {
        return startSpan(name, SpanKind.INTERNAL, sessionId, parentId, attributes);
    }

    private TracingSpan startSpan(String name, SpanKind kind, @Nullable String sessionId,
                                  @Nullable String parentId, Map<String, ?> attributes) {
        if (closed.get()) {
            logger.debug("Tracer {} is closed, span {} will not be recorded", tracerId, name);
            return NoOpTracingSpan.INSTANCE;
        }
        Context parent = (Context) context(sessionId, parentId).getUnderlyingContext();
        Span span = tracer.spanBuilder(name)
                .setParent(parent)
                .setSpanKind(kind)
                .startSpan();
        attributes.forEach((key, value) -> attributeWriter.write(span, key, value));
        return new OpenTelemetryTracingSpan(span, parent);
    }

    /**
     * Runs {@code body} inside a new current span, recording any exception it throws.
     */
    public <T> T inSpan(String name, Supplier<T> body) {
        TracingSpan span = startSpan(name);
        try (TracingScope scope = span.makeCurrent()) {
            T result = body.get();
            span.setSuccess();
            return result;
        } catch (RuntimeException | Error e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    public void inSpan(String name, Runnable body) {
        inSpan(name, () -> {
            body.run();
            return null;
        });
    }

    public boolean enrichSpanDirect(SpanEnrichment enrichment) {
        return spanEnricher.enrichSpanDirect(enrichment);
    }

    public EnrichmentScope enrichSpanScoped(SpanEnrichment enrichment) {
        return spanEnricher.enrichSpanScoped(enrichment);
    }

    /**
     * Updates the session named by the enrichment, or this tracer's own session.
     *
     * @return false without a backend call when neither names a session
     */
    public boolean enrichSession(SessionEnrichment enrichment) {
        String target = enrichment.getSessionId() != null ? enrichment.getSessionId() : sessionId;
        return sessionEnricher.enrichSession(target, enrichment);
    }

    public boolean forceFlush() {
        return forceFlush(flushTimeoutMillis);
    }

    /**
     * Flushes every processor on the shared provider, not only this tracer's.
     *
     * @return true if everything was flushed within the deadline
     */
    public boolean forceFlush(long timeoutMillis) {
        return flushCoordinator.forceFlush(lease.provider(), timeoutMillis);
    }

    /**
     * Unregisters the tracer and detaches it from the provider. The provider is shut down
     * once no tracer uses it any more.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        tracerRegistry.unregister(tracerId);
        providerAdapter.releaseProvider(lease, enrichmentProcessor);
        logger.info("HoneyHive tracer {} closed (project {}, session {})", tracerId, project, sessionId);
    }

    @Override
    public String toString() {
        return "HoneyHiveTracer{" +
                "tracerId='" + tracerId + '\'' +
                ", project='" + project + '\'' +
                ", source='" + source + '\'' +
                ", sessionId='" + sessionId + '\'' +
                ", providerOwner=" + lease.owner() +
                ", testMode=" + testMode +
                '}';
    }

    public static final class Builder {

        private final HoneyHiveProperties properties;
        private Map<String, String> environment = System.getenv();
        @Nullable
        private SessionApi sessionApi;
        private ProviderRegistry providerRegistry = ProviderRegistry.processWide();
        private TracerRegistry tracerRegistry = TracerRegistry.processWide();
        private MetricsRecorder metricsRecorder = NoOpMetricsRecorder.INSTANCE;
        @Nullable
        private SpanExporter spanExporter;
        private ObjectMapper objectMapper = new ObjectMapper();
        private Executor executor = ForkJoinPool.commonPool();

        private Builder(HoneyHiveProperties properties) {
            this.properties = properties;
        }

        /**
         * Variables read for experiment detection. Defaults to the process environment.
         */
        public Builder environment(Map<String, String> environment) {
            this.environment = environment;
            return this;
        }

        /**
         * Session backend. Not called in test mode.
         */
        public Builder sessionApi(SessionApi sessionApi) {
            this.sessionApi = sessionApi;
            return this;
        }

        public Builder providerRegistry(ProviderRegistry providerRegistry) {
            this.providerRegistry = providerRegistry;
            return this;
        }

        public Builder tracerRegistry(TracerRegistry tracerRegistry) {
            this.tracerRegistry = tracerRegistry;
            return this;
        }

        public Builder metricsRecorder(MetricsRecorder metricsRecorder) {
            this.metricsRecorder = metricsRecorder;
            return this;
        }

        /**
         * Replaces the remote exporter when this tracer creates the provider.
         */
        public Builder spanExporter(SpanExporter spanExporter) {
            this.spanExporter = spanExporter;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        /**
         * Executor running the session call.
         */
        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        /**
         * Builds the tracer, blocking up to the session timeout for a session id.
         */
        public HoneyHiveTracer build() {
            properties.validate();
            SessionApi api = sessionApi != null
                    ? sessionApi
                    : new HttpSessionApi(properties.getServerUrl(), properties.resolvedApiKey(),
                            properties.getSessionTimeout());
            HoneyHiveTracer tracer = new HoneyHiveTracer(this, properties, api);
            if (properties.isTestMode()) {
                logger.info("Test mode: skipping session creation for project {}", tracer.project);
            } else {
                SessionLifecycleManager sessions = new SessionLifecycleManager(
                        api, metricsRecorder, executor, properties.getSessionTimeout());
                tracer.sessionId = sessions.createSession(tracer.project, tracer.source, tracer.sessionName);
            }
            tracerRegistry.register(tracer);
            logger.info("HoneyHive tracer {} initialised (project {}, source {}, session {}, providerOwner {})",
                    tracer.tracerId, tracer.project, tracer.source, tracer.sessionId, tracer.isProviderOwner());
            return tracer;
        }

        /**
         * Builds the tracer on the builder's executor.
         */
        public CompletableFuture<HoneyHiveTracer> buildAsync() {
            return buildAsync(executor);
        }

        public CompletableFuture<HoneyHiveTracer> buildAsync(Executor buildExecutor) {
            return CompletableFuture.supplyAsync(this::build, buildExecutor);
        }
    }
}
