package net.honeyhive.Enrichment;

import net.honeyhive.Tracing.HoneyHiveTracer;
import org.springframework.lang.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fields to attach to a span through the enrichment API.
 */
public final class SpanEnrichment {

    private final Map<String, Object> metadata;
    private final Map<String, Object> metrics;
    private final Map<String, Object> attributes;
    private final Map<String, Object> config;
    private final Map<String, Object> feedback;
    private final Map<String, Object> inputs;
    private final Map<String, Object> outputs;
    private final Map<String, Object> extras;
    @Nullable
    private final String eventType;
    @Nullable
    private final String eventName;
    @Nullable
    private final String eventId;
    @Nullable
    private final Throwable error;
    @Nullable
    private final String errorMessage;
    @Nullable
    private final HoneyHiveTracer tracer;

    private SpanEnrichment(Builder builder) {
        this.metadata = Map.copyOf(builder.metadata);
        this.metrics = Map.copyOf(builder.metrics);
        this.attributes = Map.copyOf(builder.attributes);
        this.config = Map.copyOf(builder.config);
        this.feedback = Map.copyOf(builder.feedback);
        this.inputs = Map.copyOf(builder.inputs);
        this.outputs = Map.copyOf(builder.outputs);
        this.extras = Map.copyOf(builder.extras);
        this.eventType = builder.eventType;
        this.eventName = builder.eventName;
        this.eventId = builder.eventId;
        this.error = builder.error;
        this.errorMessage = builder.errorMessage;
        this.tracer = builder.tracer;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SpanEnrichment empty() {
        return new Builder().build();
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Map<String, Object> getMetrics() {
        return metrics;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    public Map<String, Object> getFeedback() {
        return feedback;
    }

    public Map<String, Object> getInputs() {
        return inputs;
    }

    public Map<String, Object> getOutputs() {
        return outputs;
    }

    public Map<String, Object> getExtras() {
        return extras;
    }

    @Nullable
    public String getEventType() {
        return eventType;
    }

    @Nullable
    public String getEventName() {
        return eventName;
    }

    @Nullable
    public String getEventId() {
        return eventId;
    }

    @Nullable
    public Throwable getError() {
        return error;
    }

    @Nullable
    public String getErrorMessage() {
        return errorMessage;
    }

    @Nullable
    public HoneyHiveTracer getTracer() {
        return tracer;
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .metadata(metadata)
                .metrics(metrics)
                .attributes(attributes)
                .config(config)
                .feedback(feedback)
                .inputs(inputs)
                .outputs(outputs)
                .eventType(eventType)
                .eventName(eventName)
                .eventId(eventId)
                .error(error)
                .errorMessage(errorMessage)
                .tracer(tracer);
        extras.forEach(builder::extra);
        return builder;
    }

    public static final class Builder {

        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private final Map<String, Object> metrics = new LinkedHashMap<>();
        private final Map<String, Object> attributes = new LinkedHashMap<>();
        private final Map<String, Object> config = new LinkedHashMap<>();
        private final Map<String, Object> feedback = new LinkedHashMap<>();
        private final Map<String, Object> inputs = new LinkedHashMap<>();
        private final Map<String, Object> outputs = new LinkedHashMap<>();
        private final Map<String, Object> extras = new LinkedHashMap<>();
        private String eventType;
        private String eventName;
        private String eventId;
        private Throwable error;
        private String errorMessage;
        private HoneyHiveTracer tracer;

        private Builder() {
        }

        public Builder metadata(@Nullable Map<String, ?> values) {
            putAll(metadata, values);
            return this;
        }

        public Builder metadata(String key, Object value) {
            put(metadata, key, value);
            return this;
        }

        public Builder metrics(@Nullable Map<String, ?> values) {
            putAll(metrics, values);
            return this;
        }

        public Builder metric(String key, Object value) {
            put(metrics, key, value);
            return this;
        }

        /**
         * Raw attributes, written to the span under their own keys.
         */
        public Builder attributes(@Nullable Map<String, ?> values) {
            putAll(attributes, values);
            return this;
        }

        public Builder attribute(String key, Object value) {
            put(attributes, key, value);
            return this;
        }

        /**
         * Configuration of the traced operation. {@code experiment_*} entries also set the
         * span's experiment attributes.
         */
        public Builder config(@Nullable Map<String, ?> values) {
            putAll(config, values);
            return this;
        }

        public Builder feedback(@Nullable Map<String, ?> values) {
            putAll(feedback, values);
            return this;
        }

        public Builder inputs(@Nullable Map<String, ?> values) {
            putAll(inputs, values);
            return this;
        }

        public Builder input(String key, Object value) {
            put(inputs, key, value);
            return this;
        }

        public Builder outputs(@Nullable Map<String, ?> values) {
            putAll(outputs, values);
            return this;
        }

        public Builder output(String key, Object value) {
            put(outputs, key, value);
            return this;
        }

        /**
         * Free-form entry, written as {@code honeyhive_<key>}.
         */
        public Builder extra(String key, Object value) {
            put(extras, key, value);
            return this;
        }

        public Builder eventType(@Nullable String eventType) {
            this.eventType = eventType;
            return this;
        }

        public Builder eventName(@Nullable String eventName) {
            this.eventName = eventName;
            return this;
        }

        public Builder eventId(@Nullable String eventId) {
            this.eventId = eventId;
            return this;
        }

        public Builder error(@Nullable Throwable error) {
            this.error = error;
            return this;
        }

        public Builder errorMessage(@Nullable String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder tracer(@Nullable HoneyHiveTracer tracer) {
            this.tracer = tracer;
            return this;
        }

        private static void put(Map<String, Object> target, @Nullable String key, @Nullable Object value) {
            if (key != null && value != null) {
                target.put(key, value);
            }
        }

        private static void putAll(Map<String, Object> target, @Nullable Map<String, ?> values) {
            if (values == null) {
                return;
            }
            values.forEach((key, value) -> {
                if (key != null && value != null) {
                    target.put(key, value);
                }
            });
        }

        public SpanEnrichment build() {
            return new SpanEnrichment(this);
        }
    }
}
