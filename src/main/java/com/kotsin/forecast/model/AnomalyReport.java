package com.kotsin.forecast.model;

import lombok.Value;

import java.util.List;

/**
 * AnomalyReport - Scored rows and the ranked per-entity summary of one detector run.
 */
@Value
public class AnomalyReport {

    List<AnomalyRecord> records;
    List<AnomalySummary> summary;

    public AnomalyReport(List<AnomalyRecord> records, List<AnomalySummary> summary) {
        this.records = List.copyOf(records);
        this.summary = List.copyOf(summary);
    }

    public static AnomalyReport empty() {
        return new AnomalyReport(List.of(), List.of());
    }

    public long anomalyCount() {
        return records.stream().filter(AnomalyRecord::isAnomaly).count();
    }
}
