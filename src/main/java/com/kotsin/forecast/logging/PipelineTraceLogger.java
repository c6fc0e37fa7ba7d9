package com.kotsin.forecast.logging;

import com.kotsin.forecast.model.AccuracyMetrics;
import com.kotsin.forecast.model.SplitPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * PipelineTraceLogger - Unified logging for one batch run
 *
 * Shows the complete flow:
 * FEATURES → SPLIT → MODEL → METRICS → REPORT, with ANOMALY beside it
 *
 * Format: [STAGE] subject | key figures | status
 */
@Slf4j
@Component
public class PipelineTraceLogger {

    public void logFeatures(String model, String series, int readings, int rows, int featureCount) {
        log.info("┌─[FEATURES] {} | {} | readings={} rows={} features={} dropped={}",
                model, series, readings, rows, featureCount, readings - rows);
    }

    public void logSplit(String model, SplitPolicy policy, int trainSize, int testSize) {
        log.info("├─[SPLIT] {} | {} | train={} test={}", model, policy, trainSize, testSize);
    }

    public void logModelTrained(String model, int trainSize, long elapsedMs, String details) {
        log.info("├─[MODEL] {} | trained on {} rows in {}ms | {}", model, trainSize, elapsedMs, details);
    }

    public void logModelFailed(String model, String errorType, String message) {
        log.warn("├─[MODEL] {} | FAILED ({}) | {} | excluded from comparison", model, errorType, message);
    }

    public void logMetrics(AccuracyMetrics metrics) {
        log.info("├─[METRICS] {} | MAE={} MAPE={}% RMSE={} | n={}",
                metrics.getModelName(),
                String.format("%,.2f", metrics.getMae()),
                String.format("%.2f", metrics.getMape()),
                String.format("%,.2f", metrics.getRmse()),
                metrics.getSampleCount());
    }

    public void logAnomalies(int rows, long flagged, int entities) {
        log.info("├─[ANOMALY] rows={} anomalies={} ({}) entities={}",
                rows, flagged, String.format("%.1f%%", rows == 0 ? 0.0 : flagged * 100.0 / rows), entities);
    }

    public void logAnomalySkipped(String message) {
        log.warn("├─[ANOMALY] skipped | {}", message);
    }

    public void logReport(String utility, List<AccuracyMetrics> ranking, List<String> failedModels) {
        StringBuilder order = new StringBuilder();
        for (int i = 0; i < ranking.size(); i++) {
            if (i > 0) {
                order.append(" > ");
            }
            order.append(ranking.get(i).getModelName());
        }
        log.info("└─[REPORT] {} | ranking: {} | failed={}", utility, order, failedModels);
    }
}
