package com.kotsin.forecast.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConfigurationValidator - Fail fast on unusable settings")
class ConfigurationValidatorTest {

    private ForecastConfig config;
    private ConfigurationValidator validator;

    @BeforeEach
    void setUp() {
        config = new ForecastConfig();
        validator = new ConfigurationValidator(config);
    }

    @Test
    @DisplayName("Defaults pass")
    void testDefaults_Valid() {
        assertTrue(validator.collectErrors().isEmpty(), () -> "Unexpected errors: " + validator.collectErrors());
        assertDoesNotThrow(validator::validateConfiguration);
    }

    @Test
    @DisplayName("Zero batch size is rejected before training could loop")
    void testSequence_ZeroBatchSize() {
        config.getSequence().setBatchSize(0);

        IllegalStateException e = assertThrows(IllegalStateException.class, validator::validateConfiguration);
        assertTrue(e.getMessage().contains("forecast.sequence.batch-size"));
    }

    @Test
    @DisplayName("Non-positive counts are each reported")
    void testNonPositiveCounts() {
        config.getSequence().setEpochs(0);
        config.getSequence().setWindowLength(-1);
        config.getBoosting().setTrees(0);
        config.getAnomaly().setTrees(0);
        config.getAnomaly().setMaxSamples(0);

        List<String> errors = validator.collectErrors();

        assertEquals(5, errors.size(), () -> "Errors: " + errors);
        assertTrue(errors.stream().anyMatch(error -> error.startsWith("forecast.sequence.epochs")));
        assertTrue(errors.stream().anyMatch(error -> error.startsWith("forecast.sequence.window-length")));
        assertTrue(errors.stream().anyMatch(error -> error.startsWith("forecast.boosting.trees")));
        assertTrue(errors.stream().anyMatch(error -> error.startsWith("forecast.anomaly.trees")));
        assertTrue(errors.stream().anyMatch(error -> error.startsWith("forecast.anomaly.max-samples")));
    }

    @Test
    @DisplayName("Contamination must be in (0, 0.5]")
    void testAnomaly_Contamination() {
        config.getAnomaly().setContamination(0.5);
        assertTrue(validator.collectErrors().isEmpty());

        config.getAnomaly().setContamination(0.0);
        assertEquals(1, validator.collectErrors().size());

        config.getAnomaly().setContamination(0.6);
        assertEquals(1, validator.collectErrors().size());
    }

    @Test
    @DisplayName("Sample fraction must be in (0, 1]")
    void testSampleFraction() {
        config.setSampleFraction(1.0);
        assertTrue(validator.collectErrors().isEmpty());

        config.setSampleFraction(0.0);
        assertThrows(IllegalStateException.class, validator::validateConfiguration);

        config.setSampleFraction(-0.2);
        assertThrows(IllegalStateException.class, validator::validateConfiguration);

        config.setSampleFraction(1.5);
        assertThrows(IllegalStateException.class, validator::validateConfiguration);

        config.setSampleFraction(Double.NaN);
        assertThrows(IllegalStateException.class, validator::validateConfiguration);
    }

    @Test
    @DisplayName("Split windows, zone and executor are checked")
    void testSplitZoneExecutor() {
        config.getSequence().setSplit(ForecastConfig.SplitConfig.trailingFraction(1.0));
        config.getDecomposition().setSplit(ForecastConfig.SplitConfig.trailingDuration(Duration.ZERO));
        config.setZone("Mars/Olympus");
        config.getExecutor().setPoolSize(0);

        List<String> errors = validator.collectErrors();

        assertEquals(4, errors.size(), () -> "Errors: " + errors);
        assertTrue(errors.stream().anyMatch(error -> error.startsWith("forecast.sequence.split.fraction")));
        assertTrue(errors.stream().anyMatch(error -> error.startsWith("forecast.decomposition.split.duration")));
        assertTrue(errors.stream().anyMatch(error -> error.startsWith("forecast.zone")));
        assertTrue(errors.stream().anyMatch(error -> error.startsWith("forecast.executor.pool-size")));
    }
}
