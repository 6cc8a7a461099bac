package net.honeyhive.Experiment;

import com.fasterxml.jackson.databind.ObjectMapper;
import net.honeyhive.Context.BaggageKeys;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExperimentContextDetectorTest {

    private final ExperimentContextDetector detector = new ExperimentContextDetector(new ObjectMapper());

    @Test
    void testEmptyEnvironmentYieldsEmptyContext() {
        ExperimentContext context = detector.detect(Map.of("PATH", "/usr/bin"));

        assertTrue(context.isEmpty());
        assertTrue(context.toBaggage().isEmpty());
    }

    @Test
    void testHoneyHiveVariablesWinOverVendorAliases() {
        Map<String, String> env = new HashMap<>();
        env.put("MLFLOW_EXPERIMENT_ID", "mlflow-7");
        env.put("HH_EXPERIMENT_ID", "hh-1");
        env.put("WANDB_PROJECT", "wandb-proj");
        env.put("AB_TEST_VARIANT", "B");
        env.put("COHORT", "beta");

        ExperimentContext context = detector.detect(env);

        assertEquals("hh-1", context.getId());
        assertEquals("wandb-proj", context.getName());
        assertEquals("B", context.getVariant());
        assertEquals("beta", context.getGroup());
    }

    @Test
    void testFirstDeclaredAliasWinsWhenVendorsConflict() {
        Map<String, String> env = Map.of(
                "WANDB_RUN_ID", "wandb-run",
                "COMET_EXPERIMENT_KEY", "comet-key",
                "EXPERIMENT_VARIANT", "control",
                "TREATMENT", "treatment-a");

        ExperimentContext context = detector.detect(env);

        assertEquals("wandb-run", context.getId());
        assertEquals("control", context.getVariant());
    }

    @Test
    void testMetadataParsedFromJson() {
        Map<String, String> env = Map.of(
                "HH_EXPERIMENT_METADATA", "{\"model\":\"gpt-4\",\"temperature\":0.2}",
                "MLFLOW_TAGS", "{\"ignored\":true}");

        ExperimentContext context = detector.detect(env);

        assertEquals(Map.of("model", "gpt-4", "temperature", "0.2"), context.getMetadata());
        assertEquals("gpt-4", context.toBaggage().get(BaggageKeys.EXPERIMENT_METADATA_PREFIX + "model"));
    }

    @Test
    void testInvalidMetadataFallsThroughToNextVariable() {
        Map<String, String> env = Map.of(
                "HH_EXPERIMENT_METADATA", "not-json",
                "WANDB_TAGS", "{\"run\":\"nightly\"}");

        ExperimentContext context = detector.detect(env);

        assertEquals(Map.of("run", "nightly"), context.getMetadata());
    }

    @Test
    void testFromConfigReadsExperimentFields() {
        ExperimentContext context = ExperimentContext.fromConfig(Map.of(
                "experiment_id", "exp-9",
                "experiment_group", "holdout",
                "model", "ignored",
                "experiment_metadata", Map.of("dataset", "v2")));

        Map<String, String> baggage = context.toBaggage();

        assertEquals("exp-9", baggage.get(BaggageKeys.EXPERIMENT_ID));
        assertEquals("holdout", baggage.get(BaggageKeys.EXPERIMENT_GROUP));
        assertEquals("v2", baggage.get("experiment_metadata.dataset"));
        assertFalse(baggage.containsKey("model"));
    }
}
