package net.honeyhive.Config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the HoneyHive tracer.
 * These properties can be configured in application.properties with the prefix "honeyhive",
 * or read from {@code HH_*} environment variables with {@link #fromEnvironment(Map)}.
 */
@ConfigurationProperties(prefix = "honeyhive")
public class HoneyHiveProperties {

    public static final String DEFAULT_SERVER_URL = "https://api.honeyhive.ai";
    public static final String TEST_MODE_API_KEY = "test-api-key";

    /**
     * API key sent as a bearer token. Required unless test mode is on.
     */
    @Nullable
    private String apiKey;

    /**
     * Project every span and session is attributed to.
     * Default: default
     */
    private String project = "default";

    /**
     * Deployment source, e.g. dev or production.
     * Default: dev
     */
    private String source = "dev";

    /**
     * Session name. Defaults to tracer_session_&lt;epochSeconds&gt; when unset.
     */
    @Nullable
    private String sessionName;

    /**
     * Base URL of the HoneyHive API.
     */
    private String serverUrl = DEFAULT_SERVER_URL;

    /**
     * Skips the remote session call and suppresses remote export.
     * Default: false
     */
    private boolean testMode = false;

    /**
     * Leaves outgoing RestTemplate calls uninstrumented.
     * Default: true
     */
    private boolean disableHttpTracing = true;

    /**
     * Export spans over OTLP/HTTP.
     * Default: true
     */
    private boolean otlpEnabled = true;

    /**
     * Upper bound for the blocking session start call, in milliseconds.
     * Default: 10000
     */
    private long sessionTimeout = 10_000;

    /**
     * Default deadline for flushing buffered spans, in milliseconds.
     * Default: 30000
     */
    private long flushTimeout = 30_000;

    private final AutoConfig autoConfig = new AutoConfig();

    /**
     * Builds properties from environment variables. Unset variables keep the defaults.
     */
    public static HoneyHiveProperties fromEnvironment(Map<String, String> env) {
        HoneyHiveProperties properties = new HoneyHiveProperties();
        String apiKey = first(env, List.of("HH_API_KEY"));
        if (apiKey != null) {
            properties.setApiKey(apiKey);
        }
        String project = first(env, List.of("HH_PROJECT"));
        if (project != null) {
            properties.setProject(project);
        }
        String source = first(env, List.of("HH_SOURCE", "SOURCE", "ENVIRONMENT"));
        if (source != null) {
            properties.setSource(source);
        }
        String sessionName = first(env, List.of("HH_SESSION_NAME"));
        if (sessionName != null) {
            properties.setSessionName(sessionName);
        }
        String serverUrl = first(env, List.of("HH_API_URL", "API_URL"));
        if (serverUrl != null) {
            properties.setServerUrl(serverUrl);
        }
        String testMode = first(env, List.of("HH_TEST_MODE"));
        if (testMode != null) {
            properties.setTestMode(Boolean.parseBoolean(testMode));
        }
        String disableHttpTracing = first(env, List.of("HH_DISABLE_HTTP_TRACING"));
        if (disableHttpTracing != null) {
            properties.setDisableHttpTracing(Boolean.parseBoolean(disableHttpTracing));
        }
        String otlpEnabled = first(env, List.of("HH_OTLP_ENABLED"));
        if (otlpEnabled != null) {
            properties.setOtlpEnabled(Boolean.parseBoolean(otlpEnabled));
        }
        String sessionTimeout = first(env, List.of("HH_SESSION_TIMEOUT_MS"));
        if (sessionTimeout != null) {
            properties.setSessionTimeout(parseMillis("HH_SESSION_TIMEOUT_MS", sessionTimeout));
        }
        String flushTimeout = first(env, List.of("HH_FLUSH_TIMEOUT_MS"));
        if (flushTimeout != null) {
            properties.setFlushTimeout(parseMillis("HH_FLUSH_TIMEOUT_MS", flushTimeout));
        }
        return properties;
    }

    @Nullable
    private static String first(Map<String, String> env, List<String> names) {
        for (String name : names) {
            String value = env.get(name);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    private static long parseMillis(String name, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new TracerConfigurationException(name + " must be a number of milliseconds, got '" + value + "'");
        }
    }

    /**
     * Checks the settings needed to build a tracer.
     *
     * @throws TracerConfigurationException when the API key is missing outside test mode
     */
    public void validate() {
        if (!testMode && (apiKey == null || apiKey.isBlank())) {
            throw new TracerConfigurationException(
                    "HoneyHive API key is required: set honeyhive.api-key or HH_API_KEY, or enable test mode");
        }
        if (project == null || project.isBlank()) {
            throw new TracerConfigurationException("project must not be blank");
        }
    }

    /**
     * The API key to send, substituting a placeholder in test mode.
     */
    public String resolvedApiKey() {
        if (apiKey == null || apiKey.isBlank()) {
            return TEST_MODE_API_KEY;
        }
        return apiKey;
    }

    public String resolvedSessionName() {
        if (sessionName == null || sessionName.isBlank()) {
            return "tracer_session_" + (System.currentTimeMillis() / 1000);
        }
        return sessionName;
    }

    // Getters and Setters

    @Nullable
    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(@Nullable String apiKey) {
        this.apiKey = apiKey;
    }

    public String getProject() {
        return project;
    }

    public void setProject(String project) {
        this.project = project;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    @Nullable
    public String getSessionName() {
        return sessionName;
    }

    public void setSessionName(@Nullable String sessionName) {
        this.sessionName = sessionName;
    }

    public String getServerUrl() {
        return serverUrl;
    }

    public void setServerUrl(String serverUrl) {
        this.serverUrl = serverUrl.endsWith("/") ? serverUrl.substring(0, serverUrl.length() - 1) : serverUrl;
    }

    public boolean isTestMode() {
        return testMode;
    }

    public void setTestMode(boolean testMode) {
        this.testMode = testMode;
    }

    public boolean isDisableHttpTracing() {
        return disableHttpTracing;
    }

    public void setDisableHttpTracing(boolean disableHttpTracing) {
        this.disableHttpTracing = disableHttpTracing;
    }

    public boolean isOtlpEnabled() {
        return otlpEnabled;
    }

    public void setOtlpEnabled(boolean otlpEnabled) {
        this.otlpEnabled = otlpEnabled;
    }

    public long getSessionTimeout() {
        return sessionTimeout;
    }

    public void setSessionTimeout(long sessionTimeout) {
        if (sessionTimeout <= 0) {
            throw new IllegalArgumentException("sessionTimeout must be positive");
        }
        this.sessionTimeout = sessionTimeout;
    }

    public long getFlushTimeout() {
        return flushTimeout;
    }

    public void setFlushTimeout(long flushTimeout) {
        if (flushTimeout <= 0) {
            throw new IllegalArgumentException("flushTimeout must be positive");
        }
        this.flushTimeout = flushTimeout;
    }

    public AutoConfig getAutoConfig() {
        return autoConfig;
    }

    public static class AutoConfig {

        /**
         * Enable or disable the Spring Boot auto-configuration.
         * Default: true
         */
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    @Override
    public String toString() {
        return "HoneyHiveProperties{" +
                "project='" + project + '\'' +
                ", source='" + source + '\'' +
                ", sessionName='" + sessionName + '\'' +
                ", serverUrl='" + serverUrl + '\'' +
                ", testMode=" + testMode +
                ", disableHttpTracing=" + disableHttpTracing +
                ", otlpEnabled=" + otlpEnabled +
                ", sessionTimeout=" + sessionTimeout +
                ", flushTimeout=" + flushTimeout +
                '}';
    }
}
