package net.honeyhive.Tracing;

/**
 * Span attribute keys understood by the HoneyHive ingestion pipeline.
 *
 * Context attributes are written twice: once under the {@code honeyhive.} namespace and
 * once under the {@code traceloop.association.properties.} namespace still read by older
 * consumers of the export stream.
 */
public final class AttributeNames {

    public static final String NAMESPACE = "honeyhive.";
    public static final String LEGACY_NAMESPACE = "traceloop.association.properties.";

    public static final String SESSION_ID = NAMESPACE + "session_id";
    public static final String PROJECT = NAMESPACE + "project";
    public static final String SOURCE = NAMESPACE + "source";
    public static final String PARENT_ID = NAMESPACE + "parent_id";
    public static final String EXPERIMENT_ID = NAMESPACE + "experiment_id";
    public static final String EXPERIMENT_NAME = NAMESPACE + "experiment_name";
    public static final String EXPERIMENT_VARIANT = NAMESPACE + "experiment_variant";
    public static final String EXPERIMENT_GROUP = NAMESPACE + "experiment_group";
    public static final String EXPERIMENT_METADATA_PREFIX = NAMESPACE + "experiment_metadata.";

    public static final String EVENT_TYPE = "honeyhive_event_type";
    public static final String EVENT_NAME = "honeyhive_event_name";
    public static final String EVENT_ID = "honeyhive_event_id";
    public static final String INPUTS = "honeyhive_inputs";
    public static final String OUTPUTS = "honeyhive_outputs";
    public static final String METADATA = "honeyhive_metadata";
    public static final String METRICS = "honeyhive_metrics";
    public static final String CONFIG = "honeyhive_config";
    public static final String FEEDBACK = "honeyhive_feedback";
    public static final String ERROR = "honeyhive_error";
    public static final String ERROR_TYPE = "honeyhive_error_type";
    public static final String EXTRA_PREFIX = "honeyhive_";

    /** Decorated method arguments land under {@code honeyhive_inputs._params_.<name>}. */
    public static final String PARAMS = INPUTS + "._params_";

    /** Decorated method return values land under {@code honeyhive_outputs.result}. */
    public static final String RESULT = OUTPUTS + ".result";

    private AttributeNames() {
    }

    /**
     * Primary attribute key for a baggage key, e.g. {@code session_id -> honeyhive.session_id}.
     */
    public static String primary(String baggageKey) {
        return NAMESPACE + baggageKey;
    }

    /**
     * Legacy alias for a baggage key, e.g.
     * {@code session_id -> traceloop.association.properties.session_id}.
     */
    public static String legacy(String baggageKey) {
        return LEGACY_NAMESPACE + baggageKey;
    }
}
