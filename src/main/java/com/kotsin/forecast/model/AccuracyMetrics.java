package com.kotsin.forecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * AccuracyMetrics - Test-partition accuracy of one model.
 */
@Value
@Builder
public class AccuracyMetrics {

    @JsonProperty("model_name")
    String modelName;

    double mae;

    double mape;         // percent; zero actuals use a denominator of 1

    double rmse;

    @JsonProperty("sample_count")
    int sampleCount;
}
