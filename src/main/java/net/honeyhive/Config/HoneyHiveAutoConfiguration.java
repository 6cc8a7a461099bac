package net.honeyhive.Config;

import io.micrometer.core.instrument.MeterRegistry;
import net.honeyhive.Aspect.Components.TraceDecorator;
import net.honeyhive.Aspect.Components.Utility.MetricsRecorder;
import net.honeyhive.Aspect.Components.Utility.MicrometerMetricsRecorder;
import net.honeyhive.Aspect.Components.Utility.NoOpMetricsRecorder;
import net.honeyhive.Aspect.TraceAspect;
import net.honeyhive.Registry.TracerRegistry;
import net.honeyhive.Session.HttpSessionApi;
import net.honeyhive.Session.SessionApi;
import net.honeyhive.Tracing.HoneyHiveTracer;
import net.honeyhive.Tracing.HttpTracingInterceptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.lang.Nullable;

/**
 * Auto-configuration for the HoneyHive tracer.
 * Provides default beans that users can override if needed.
 *
 * Can be disabled by setting: honeyhive.auto-config.enabled=false
 */
@AutoConfiguration
@EnableAspectJAutoProxy
@EnableConfigurationProperties(HoneyHiveProperties.class)
@ConditionalOnProperty(
        prefix = "honeyhive.auto-config",
        name = "enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class HoneyHiveAutoConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(HoneyHiveAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public MetricsRecorder honeyHiveMetricsRecorder(@Nullable MeterRegistry meterRegistry) {
        if (meterRegistry == null) {
            logger.debug("No MeterRegistry found, HoneyHive tracer metrics disabled");
            return NoOpMetricsRecorder.INSTANCE;
        }
        return new MicrometerMetricsRecorder(meterRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    public SessionApi honeyHiveSessionApi(HoneyHiveProperties properties) {
        return new HttpSessionApi(properties.getServerUrl(), properties.resolvedApiKey(),
                properties.getSessionTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public TracerRegistry tracerRegistry() {
        return TracerRegistry.processWide();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public HoneyHiveTracer honeyHiveTracer(HoneyHiveProperties properties,
                                           SessionApi sessionApi,
                                           TracerRegistry tracerRegistry,
                                           MetricsRecorder metricsRecorder) {
        logger.info("Configuring HoneyHive tracer: {}", properties);
        return HoneyHiveTracer.builder(properties)
                .sessionApi(sessionApi)
                .tracerRegistry(tracerRegistry)
                .metricsRecorder(metricsRecorder)
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public TraceDecorator traceDecorator(HoneyHiveTracer honeyHiveTracer,
                                         TracerRegistry tracerRegistry,
                                         MetricsRecorder metricsRecorder) {
        return TraceDecorator.withFallback(honeyHiveTracer, tracerRegistry, metricsRecorder);
    }

    @Bean
    @ConditionalOnMissingBean
    public TraceAspect traceAspect(TraceDecorator traceDecorator) {
        return new TraceAspect(traceDecorator);
    }

    @Bean
    @ConditionalOnProperty(prefix = "honeyhive", name = "disable-http-tracing", havingValue = "false")
    public RestTemplateCustomizer honeyHiveHttpTracingCustomizer(HoneyHiveTracer honeyHiveTracer) {
        logger.info("HTTP tracing enabled for RestTemplate clients");
        return restTemplate -> restTemplate.getInterceptors().add(new HttpTracingInterceptor(honeyHiveTracer));
    }
}
