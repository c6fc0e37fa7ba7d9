package com.kotsin.forecast.report;

import com.kotsin.forecast.adapter.ModelRun;
import com.kotsin.forecast.config.ForecastConfig;
import com.kotsin.forecast.exception.ReportingException;
import com.kotsin.forecast.logging.PipelineTraceLogger;
import com.kotsin.forecast.model.AccuracyMetrics;
import com.kotsin.forecast.model.AnomalyReport;
import com.kotsin.forecast.model.FeatureImportance;
import com.kotsin.forecast.model.ModelOutcome;
import com.kotsin.forecast.model.PipelineReport;
import com.kotsin.forecast.model.RunConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * ComparisonReporter - Ranks successful models and assembles the run report.
 *
 * Ranking is ascending on the primary metric with ties broken by model name, so the
 * order is total and repeatable.
 */
@Component
@RequiredArgsConstructor
public class ComparisonReporter {

    private final ForecastConfig config;
    private final PipelineTraceLogger trace;

    /**
     * @param outcomes every adapter attempt, successful or not
     * @param metrics  accuracy of each successful model, keyed by model name
     * @throws ReportingException when no model succeeded
     */
    public PipelineReport build(RunConfig runConfig, List<ModelOutcome> outcomes,
                                Map<String, AccuracyMetrics> metrics, AnomalyReport anomalies) {
        List<ModelOutcome> failed = new ArrayList<>();
        List<ModelRun> succeeded = new ArrayList<>();
        for (ModelOutcome outcome : outcomes) {
            if (outcome.isSucceeded() && metrics.containsKey(outcome.getModelName())) {
                succeeded.add(outcome.getRun());
            } else {
                failed.add(outcome);
            }
        }
        if (succeeded.isEmpty()) {
            throw new ReportingException("No model succeeded for " + runConfig.getUtility()
                    + " (" + failed.size() + " failed)");
        }

        List<AccuracyMetrics> ranking = new ArrayList<>();
        for (ModelRun run : succeeded) {
            ranking.add(metrics.get(run.getModelName()));
        }
        ranking = rank(ranking, config.getReport().getPrimaryMetric());

        PipelineReport.PipelineReportBuilder report = PipelineReport.builder()
                .utility(runConfig.getUtility())
                .runConfig(runConfig)
                .comparison(ranking)
                .failedModels(failed)
                .anomalies(anomalies != null ? anomalies : AnomalyReport.empty())
                .generatedAt(Instant.now());
        for (ModelRun run : succeeded) {
            report.forecastsFor(run.getModelName(), run.getForecasts());
            if (run.getFamily().exposesFeatureImportance()) {
                report.importancesFor(run.getModelName(), topFeatures(run.getImportances()));
            }
        }

        List<String> failedNames = new ArrayList<>();
        for (ModelOutcome outcome : failed) {
            failedNames.add(outcome.getModelName());
        }
        trace.logReport(String.valueOf(runConfig.getUtility()), ranking, failedNames);
        return report.build();
    }

    /**
     * Best first on the given metric, ties by model name.
     */
    public static List<AccuracyMetrics> rank(List<AccuracyMetrics> metrics, ForecastConfig.PrimaryMetric primary) {
        List<AccuracyMetrics> sorted = new ArrayList<>(metrics);
        sorted.sort(Comparator.comparingDouble(metricOf(primary))
                .thenComparing(AccuracyMetrics::getModelName));
        return sorted;
    }

    private static ToDoubleFunction<AccuracyMetrics> metricOf(ForecastConfig.PrimaryMetric primary) {
        switch (primary) {
            case MAE:
                return AccuracyMetrics::getMae;
            case RMSE:
                return AccuracyMetrics::getRmse;
            case MAPE:
            default:
                return AccuracyMetrics::getMape;
        }
    }

    private List<FeatureImportance> topFeatures(List<FeatureImportance> importances) {
        int limit = Math.min(config.getReport().getTopFeatures(), importances.size());
        return List.copyOf(importances.subList(0, limit));
    }
}
