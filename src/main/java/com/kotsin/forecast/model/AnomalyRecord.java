package com.kotsin.forecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * AnomalyRecord - Isolation verdict for one entity-day.
 *
 * {@code anomalyScore} is the decision value: negative means outlier, lower means more anomalous.
 */
@Value
@Builder
public class AnomalyRecord {

    @JsonProperty("entity")
    String entityId;

    @JsonProperty("entity_name")
    String entityName;

    LocalDate date;

    @JsonProperty("value")
    double observedValue;

    @JsonProperty("anomaly_score")
    double anomalyScore;

    @JsonProperty("is_anomaly")
    boolean anomaly;
}
