package com.kotsin.forecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * PipelineReport - Everything one run produced for one utility.
 *
 * {@code comparison} is already ranked best-first by the configured primary metric.
 */
@Value
@Builder
public class PipelineReport {

    Utility utility;

    @JsonProperty("run_config")
    RunConfig runConfig;

    @Singular("comparisonRow")
    List<AccuracyMetrics> comparison;

    @Singular("forecastsFor")
    Map<String, List<ForecastResult>> forecasts;

    @JsonProperty("feature_importance")
    @Singular("importancesFor")
    Map<String, List<FeatureImportance>> featureImportances;

    @JsonProperty("failed_models")
    @Singular
    List<ModelOutcome> failedModels;

    AnomalyReport anomalies;

    @JsonProperty("generated_at")
    Instant generatedAt;

    public String bestModel() {
        return comparison.isEmpty() ? null : comparison.get(0).getModelName();
    }
}
