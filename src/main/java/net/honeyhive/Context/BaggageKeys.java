package net.honeyhive.Context;

import java.util.List;

/**
 * Baggage keys written by the tracer and read back by the enrichment processor.
 */
public final class BaggageKeys {

    public static final String SESSION_ID = "session_id";
    public static final String PROJECT = "project";
    public static final String SOURCE = "source";
    public static final String PARENT_ID = "parent_id";
    public static final String EXPERIMENT_ID = "experiment_id";
    public static final String EXPERIMENT_NAME = "experiment_name";
    public static final String EXPERIMENT_VARIANT = "experiment_variant";
    public static final String EXPERIMENT_GROUP = "experiment_group";
    public static final String EXPERIMENT_METADATA_PREFIX = "experiment_metadata.";

    /** Identifies the tracer that owns the context; used for tracer discovery. */
    public static final String TRACER_ID = "honeyhive_tracer_id";

    /** Keys copied verbatim onto every span, in this order. */
    public static final List<String> ENRICHED_KEYS = List.of(
            SESSION_ID,
            PROJECT,
            SOURCE,
            PARENT_ID,
            EXPERIMENT_ID,
            EXPERIMENT_NAME,
            EXPERIMENT_VARIANT,
            EXPERIMENT_GROUP);

    private BaggageKeys() {
    }
}
