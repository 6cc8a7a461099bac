package net.honeyhive.Experiment;

import net.honeyhive.Context.BaggageKeys;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Identifiers describing the experiment or A/B run the process belongs to.
 *
 * Detected once from the environment when a tracer is built and read-only afterwards.
 * The same shape is also parsed out of per-call {@code config} maps handed to span
 * enrichment.
 */
public final class ExperimentContext {

    public static final ExperimentContext EMPTY = new ExperimentContext(null, null, null, null, Map.of());

    @Nullable
    private final String id;
    @Nullable
    private final String name;
    @Nullable
    private final String variant;
    @Nullable
    private final String group;
    private final Map<String, String> metadata;

    public ExperimentContext(@Nullable String id,
                             @Nullable String name,
                             @Nullable String variant,
                             @Nullable String group,
                             Map<String, String> metadata) {
        this.id = id;
        this.name = name;
        this.variant = variant;
        this.group = group;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Reads experiment fields from an enrichment {@code config} map. Recognised keys are
     * {@code experiment_id}, {@code experiment_name}, {@code experiment_variant},
     * {@code experiment_group} and a nested {@code experiment_metadata} map.
     */
    public static ExperimentContext fromConfig(@Nullable Map<String, ?> config) {
        if (config == null || config.isEmpty()) {
            return EMPTY;
        }
        Map<String, String> metadata = new LinkedHashMap<>();
        Object rawMetadata = config.get("experiment_metadata");
        if (rawMetadata instanceof Map<?, ?> map) {
            map.forEach((k, v) -> {
                if (k != null && v != null) {
                    metadata.put(String.valueOf(k), String.valueOf(v));
                }
            });
        }
        return new ExperimentContext(
                stringOrNull(config.get(BaggageKeys.EXPERIMENT_ID)),
                stringOrNull(config.get(BaggageKeys.EXPERIMENT_NAME)),
                stringOrNull(config.get(BaggageKeys.EXPERIMENT_VARIANT)),
                stringOrNull(config.get(BaggageKeys.EXPERIMENT_GROUP)),
                metadata);
    }

    @Nullable
    private static String stringOrNull(@Nullable Object value) {
        return value != null ? String.valueOf(value) : null;
    }

    @Nullable
    public String getId() {
        return id;
    }

    @Nullable
    public String getName() {
        return name;
    }

    @Nullable
    public String getVariant() {
        return variant;
    }

    @Nullable
    public String getGroup() {
        return group;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public boolean isEmpty() {
        return id == null && name == null && variant == null && group == null && metadata.isEmpty();
    }

    /**
     * Flattens the context into baggage entries keyed by {@link BaggageKeys}.
     * Metadata entries become {@code experiment_metadata.<key>}.
     */
    public Map<String, String> toBaggage() {
        Map<String, String> entries = new LinkedHashMap<>();
        putIfPresent(entries, BaggageKeys.EXPERIMENT_ID, id);
        putIfPresent(entries, BaggageKeys.EXPERIMENT_NAME, name);
        putIfPresent(entries, BaggageKeys.EXPERIMENT_VARIANT, variant);
        putIfPresent(entries, BaggageKeys.EXPERIMENT_GROUP, group);
        metadata.forEach((key, value) -> entries.put(BaggageKeys.EXPERIMENT_METADATA_PREFIX + key, value));
        return entries;
    }

    private static void putIfPresent(Map<String, String> entries, String key, @Nullable String value) {
        if (value != null && !value.isEmpty()) {
            entries.put(key, value);
        }
    }

    @Override
    public String toString() {
        return "ExperimentContext{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", variant='" + variant + '\'' +
                ", group='" + group + '\'' +
                ", metadata=" + metadata +
                '}';
    }
}
