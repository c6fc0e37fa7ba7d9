package com.kotsin.forecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * AnomalySummary - Per-entity anomaly count, the first thing a reviewer triages.
 */
@Value
@Builder
public class AnomalySummary {

    @JsonProperty("entity")
    String entityId;

    @JsonProperty("entity_name")
    String entityName;

    @JsonProperty("anomaly_count")
    int anomalyCount;

    @JsonProperty("avg_anomaly_energy")
    double meanAnomalousValue;
}
