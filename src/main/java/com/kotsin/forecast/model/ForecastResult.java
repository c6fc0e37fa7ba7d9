package com.kotsin.forecast.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * ForecastResult - One model's prediction for one timestamp.
 *
 * Interval bounds and decomposition components are only set by models that produce them.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ForecastResult implements Timestamped {

    @JsonProperty("model_name")
    String modelName;

    Utility utility;

    Instant timestamp;

    @JsonProperty("predicted")
    double pointEstimate;

    Double actual;

    @JsonProperty("lower_bound")
    Double lowerBound;

    @JsonProperty("upper_bound")
    Double upperBound;

    Double trend;

    @JsonProperty("weekly_pattern")
    Double weekly;

    @JsonProperty("yearly_pattern")
    Double yearly;

    @JsonProperty("daily_pattern")
    Double daily;
}
