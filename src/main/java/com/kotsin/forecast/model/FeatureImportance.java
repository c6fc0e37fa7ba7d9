package com.kotsin.forecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * FeatureImportance - Relative contribution of one feature to a tree ensemble.
 */
@Value
public class FeatureImportance {

    @JsonProperty("feature_name")
    String featureName;

    double importance;
}
