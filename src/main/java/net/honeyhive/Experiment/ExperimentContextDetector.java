package net.honeyhive.Experiment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Detects experiment identifiers from environment variables.
 *
 * Several experiment harnesses are understood (HoneyHive's own {@code HH_*} names, a
 * generic set, MLflow, Weights &amp; Biases, Comet and common A/B-test names). For each
 * field the first variable set in the declared order wins.
 */
public class ExperimentContextDetector {

    private static final Logger logger = LoggerFactory.getLogger(ExperimentContextDetector.class);

    static final List<String> ID_VARIABLES = List.of(
            "HH_EXPERIMENT_ID", "EXPERIMENT_ID", "MLFLOW_EXPERIMENT_ID", "WANDB_RUN_ID", "COMET_EXPERIMENT_KEY");
    static final List<String> NAME_VARIABLES = List.of(
            "HH_EXPERIMENT_NAME", "EXPERIMENT_NAME", "MLFLOW_EXPERIMENT_NAME", "WANDB_PROJECT", "COMET_PROJECT_NAME");
    static final List<String> VARIANT_VARIABLES = List.of(
            "HH_EXPERIMENT_VARIANT", "EXPERIMENT_VARIANT", "VARIANT", "AB_TEST_VARIANT", "TREATMENT");
    static final List<String> GROUP_VARIABLES = List.of(
            "HH_EXPERIMENT_GROUP", "EXPERIMENT_GROUP", "GROUP", "AB_TEST_GROUP", "COHORT");
    static final List<String> METADATA_VARIABLES = List.of(
            "HH_EXPERIMENT_METADATA", "EXPERIMENT_METADATA", "MLFLOW_TAGS", "WANDB_TAGS", "COMET_TAGS");

    private final ObjectMapper objectMapper;

    public ExperimentContextDetector(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ExperimentContext detect(Map<String, String> environment) {
        ExperimentContext detected = new ExperimentContext(
                firstMatch(environment, ID_VARIABLES),
                firstMatch(environment, NAME_VARIABLES),
                firstMatch(environment, VARIANT_VARIABLES),
                firstMatch(environment, GROUP_VARIABLES),
                detectMetadata(environment));
        if (!detected.isEmpty()) {
            logger.info("Experiment context detected: {}", detected);
        }
        return detected;
    }

    @Nullable
    private String firstMatch(Map<String, String> environment, List<String> variables) {
        String winner = null;
        String winnerVariable = null;
        List<String> ignored = new ArrayList<>();
        for (String variable : variables) {
            String value = environment.get(variable);
            if (value == null || value.isBlank()) {
                continue;
            }
            if (winner == null) {
                winner = value;
                winnerVariable = variable;
            } else if (!winner.equals(value)) {
                ignored.add(variable);
            }
        }
        if (!ignored.isEmpty()) {
            // TODO: replace declaration-order precedence once product settles the harness tie-break
            logger.warn("Conflicting experiment variables: using {}={}, ignoring {}",
                    winnerVariable, winner, ignored);
        }
        return winner;
    }

    private Map<String, String> detectMetadata(Map<String, String> environment) {
        for (String variable : METADATA_VARIABLES) {
            String raw = environment.get(variable);
            if (raw == null || raw.isBlank()) {
                continue;
            }
            try {
                Map<String, Object> parsed = objectMapper.readValue(raw, new TypeReference<Map<String, Object>>() {});
                Map<String, String> metadata = new LinkedHashMap<>();
                parsed.forEach((key, value) -> {
                    if (value != null) {
                        metadata.put(key, String.valueOf(value));
                    }
                });
                return metadata;
            } catch (JsonProcessingException e) {
                logger.warn("Ignoring {}: not a JSON object ({})", variable, e.getOriginalMessage());
            }
        }
        return Map.of();
    }
}
