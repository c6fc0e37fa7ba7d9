package com.kotsin.forecast.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationStartedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Fails startup on forecast settings no run could use.
 *
 * Runs on {@link ApplicationStartedEvent}, before the batch runner is called.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConfigurationValidator {

    private final ForecastConfig config;

    @EventListener(ApplicationStartedEvent.class)
    public void validateConfiguration() {
        log.info("[CONFIG] Validating forecast configuration...");

        List<String> errors = collectErrors();

        if (!errors.isEmpty()) {
            log.error("[CONFIG] Configuration validation failed with {} errors:", errors.size());
            errors.forEach(error -> log.error("  - {}", error));
            throw new IllegalStateException("Configuration validation failed: " + String.join("; ", errors));
        }

        log.info("[CONFIG] Configuration validation passed");
        logConfigurationSummary();
    }

    /**
     * Every violated setting, one message each; empty when the configuration is usable.
     */
    public List<String> collectErrors() {
        List<String> errors = new ArrayList<>();

        // ===== RUN =====
        if (!(config.getSampleFraction() > 0.0 && config.getSampleFraction() <= 1.0)) {
            errors.add("forecast.sample-fraction must be in (0, 1], was " + config.getSampleFraction());
        }
        try {
            config.zoneId();
        } catch (DateTimeException e) {
            errors.add("forecast.zone is not a valid zone id: " + e.getMessage());
        }

        // ===== FEATURES =====
        ForecastConfig.FeatureConfig features = config.getFeatures();
        for (int lag : features.getLagHours()) {
            positive(errors, "forecast.features.lag-hours", lag);
        }
        for (int window : features.getRollingWindowHours()) {
            positive(errors, "forecast.features.rolling-window-hours", window);
        }
        positive(errors, "forecast.features.resolution", features.getResolution());
        if (features.getMaxMissingFraction() < 0.0 || features.getMaxMissingFraction() > 1.0) {
            errors.add("forecast.features.max-missing-fraction must be in [0, 1], was "
                    + features.getMaxMissingFraction());
        }

        // ===== DECOMPOSITION =====
        ForecastConfig.DecompositionConfig decomposition = config.getDecomposition();
        split(errors, "forecast.decomposition.split", decomposition.getSplit());
        if (decomposition.getChangepoints() < 0) {
            errors.add("forecast.decomposition.changepoints must not be negative, was "
                    + decomposition.getChangepoints());
        }
        unitInterval(errors, "forecast.decomposition.changepoint-range", decomposition.getChangepointRange());
        positive(errors, "forecast.decomposition.changepoint-prior-scale", decomposition.getChangepointPriorScale());
        positive(errors, "forecast.decomposition.seasonality-prior-scale", decomposition.getSeasonalityPriorScale());
        positive(errors, "forecast.decomposition.regressor-prior-scale", decomposition.getRegressorPriorScale());
        if (!(decomposition.getIntervalWidth() > 0.0 && decomposition.getIntervalWidth() < 1.0)) {
            errors.add("forecast.decomposition.interval-width must be in (0, 1), was "
                    + decomposition.getIntervalWidth());
        }

        // ===== SEQUENCE =====
        ForecastConfig.SequenceConfig sequence = config.getSequence();
        split(errors, "forecast.sequence.split", sequence.getSplit());
        positive(errors, "forecast.sequence.window-length", sequence.getWindowLength());
        positive(errors, "forecast.sequence.hidden-size", sequence.getHiddenSize());
        positive(errors, "forecast.sequence.layers", sequence.getLayers());
        positive(errors, "forecast.sequence.head-size", sequence.getHeadSize());
        positive(errors, "forecast.sequence.batch-size", sequence.getBatchSize());
        positive(errors, "forecast.sequence.epochs", sequence.getEpochs());
        positive(errors, "forecast.sequence.patience", sequence.getPatience());
        positive(errors, "forecast.sequence.learning-rate", sequence.getLearningRate());
        if (!(sequence.getDropout() >= 0.0 && sequence.getDropout() < 1.0)) {
            errors.add("forecast.sequence.dropout must be in [0, 1), was " + sequence.getDropout());
        }

        // ===== BOOSTING =====
        ForecastConfig.BoostingConfig boosting = config.getBoosting();
        split(errors, "forecast.boosting.split", boosting.getSplit());
        positive(errors, "forecast.boosting.trees", boosting.getTrees());
        positive(errors, "forecast.boosting.max-depth", boosting.getMaxDepth());
        positive(errors, "forecast.boosting.learning-rate", boosting.getLearningRate());
        unitInterval(errors, "forecast.boosting.subsample", boosting.getSubsample());
        unitInterval(errors, "forecast.boosting.colsample-by-tree", boosting.getColsampleByTree());
        if (boosting.getLambda() < 0.0) {
            errors.add("forecast.boosting.lambda must not be negative, was " + boosting.getLambda());
        }
        if (boosting.getMaxBins() < 2) {
            errors.add("forecast.boosting.max-bins must be at least 2, was " + boosting.getMaxBins());
        }

        // ===== ANOMALY =====
        ForecastConfig.AnomalyConfig anomaly = config.getAnomaly();
        positive(errors, "forecast.anomaly.trees", anomaly.getTrees());
        positive(errors, "forecast.anomaly.max-samples", anomaly.getMaxSamples());
        if (!(anomaly.getContamination() > 0.0 && anomaly.getContamination() <= 0.5)) {
            errors.add("forecast.anomaly.contamination must be in (0, 0.5], was " + anomaly.getContamination());
        }

        // ===== REPORT / EXECUTOR =====
        positive(errors, "forecast.report.top-features", config.getReport().getTopFeatures());
        positive(errors, "forecast.report.cache-max-size", config.getReport().getCacheMaxSize());
        positive(errors, "forecast.report.cache-ttl", config.getReport().getCacheTtl());
        positive(errors, "forecast.executor.pool-size", config.getExecutor().getPoolSize());
        if (config.getExecutor().getQueueCapacity() < 0) {
            errors.add("forecast.executor.queue-capacity must not be negative, was "
                    + config.getExecutor().getQueueCapacity());
        }

        return errors;
    }

    private static void split(List<String> errors, String key, ForecastConfig.SplitConfig split) {
        if (split == null || split.getType() == null) {
            errors.add(key + ".type is not configured");
            return;
        }
        switch (split.getType()) {
            case TRAILING_DURATION -> positive(errors, key + ".duration", split.getDuration());
            case TRAILING_FRACTION -> {
                if (!(split.getFraction() > 0.0 && split.getFraction() < 1.0)) {
                    errors.add(key + ".fraction must be in (0, 1), was " + split.getFraction());
                }
            }
        }
    }

    private static void positive(List<String> errors, String key, int value) {
        if (value <= 0) {
            errors.add(key + " must be positive, was " + value);
        }
    }

    private static void positive(List<String> errors, String key, double value) {
        if (!(value > 0.0) || Double.isInfinite(value)) {
            errors.add(key + " must be positive, was " + value);
        }
    }

    private static void positive(List<String> errors, String key, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            errors.add(key + " must be a positive duration, was " + value);
        }
    }

    private static void unitInterval(List<String> errors, String key, double value) {
        if (!(value > 0.0 && value <= 1.0)) {
            errors.add(key + " must be in (0, 1], was " + value);
        }
    }

    private void logConfigurationSummary() {
        log.info("[CONFIG] Configuration Summary:");
        log.info("  Utility: {} (seed={}, sampleFraction={}, zone={})",
                config.getUtility(), config.getSeed(), config.getSampleFraction(), config.getZone());
        log.info("  Sequence: window={} hidden={}x{} batch={} epochs={}",
                config.getSequence().getWindowLength(), config.getSequence().getLayers(),
                config.getSequence().getHiddenSize(), config.getSequence().getBatchSize(),
                config.getSequence().getEpochs());
        log.info("  Boosting: trees={} depth={} lr={}", config.getBoosting().getTrees(),
                config.getBoosting().getMaxDepth(), config.getBoosting().getLearningRate());
        log.info("  Anomaly: enabled={} trees={} maxSamples={} contamination={}",
                config.getAnomaly().isEnabled(), config.getAnomaly().getTrees(),
                config.getAnomaly().getMaxSamples(), config.getAnomaly().getContamination());
    }
}
