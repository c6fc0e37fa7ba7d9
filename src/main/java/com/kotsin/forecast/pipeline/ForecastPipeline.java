package com.kotsin.forecast.pipeline;

import com.kotsin.forecast.adapter.ModelAdapter;
import com.kotsin.forecast.adapter.ModelRun;
import com.kotsin.forecast.anomaly.AnomalyDetector;
import com.kotsin.forecast.config.ForecastConfig;
import com.kotsin.forecast.exception.DataException;
import com.kotsin.forecast.logging.PipelineTraceLogger;
import com.kotsin.forecast.metrics.MetricsCalculator;
import com.kotsin.forecast.model.AccuracyMetrics;
import com.kotsin.forecast.model.AnomalyReport;
import com.kotsin.forecast.model.DailyRecord;
import com.kotsin.forecast.model.ModelOutcome;
import com.kotsin.forecast.model.PipelineReport;
import com.kotsin.forecast.model.RunConfig;
import com.kotsin.forecast.model.UtilitySeries;
import com.kotsin.forecast.report.ComparisonReporter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * ForecastPipeline - One batch evaluation of every enabled model family.
 *
 * Flow:
 * 1. Optional history sampling (most recent fraction)
 * 2. Each enabled adapter evaluated on the model executor
 * 3. Failures isolated per adapter and recorded, never propagated
 * 4. Successful runs scored on their held-out window
 * 5. Anomaly detection over the daily table
 * 6. Ranked report
 */
@Slf4j
@Component
public class ForecastPipeline {

    private final List<ModelAdapter> adapters;
    private final MetricsCalculator metricsCalculator;
    private final AnomalyDetector anomalyDetector;
    private final ComparisonReporter reporter;
    private final PipelineTraceLogger trace;
    private final ForecastConfig config;
    private final Executor modelExecutor;

    public ForecastPipeline(List<ModelAdapter> adapters,
                            MetricsCalculator metricsCalculator,
                            AnomalyDetector anomalyDetector,
                            ComparisonReporter reporter,
                            PipelineTraceLogger trace,
                            ForecastConfig config,
                            @Qualifier("modelExecutor") Executor modelExecutor) {
        this.adapters = adapters;
        this.metricsCalculator = metricsCalculator;
        this.anomalyDetector = anomalyDetector;
        this.reporter = reporter;
        this.trace = trace;
        this.config = config;
        this.modelExecutor = modelExecutor;
    }

    /**
     * @throws com.kotsin.forecast.exception.ReportingException when no model succeeded
     */
    public PipelineReport run(UtilitySeries hourly, List<DailyRecord> daily, RunConfig runConfig) {
        UtilitySeries series = runConfig.getSampleFraction() < 1.0
                ? hourly.tail(runConfig.getSampleFraction())
                : hourly;
        log.info("[PIPELINE] {} | readings={} (of {}) seed={} adapters={}",
                series.describe(), series.size(), hourly.size(), runConfig.getSeed(), adapters.size());

        List<CompletableFuture<ModelOutcome>> futures = new ArrayList<>();
        for (ModelAdapter adapter : adapters) {
            if (!adapter.isEnabled()) {
                log.info("[PIPELINE] {} disabled, skipping", adapter.modelName());
                continue;
            }
            futures.add(CompletableFuture.supplyAsync(() -> attempt(adapter, series, runConfig), modelExecutor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<ModelOutcome> outcomes = new ArrayList<>();
        Map<String, AccuracyMetrics> metrics = new LinkedHashMap<>();
        for (CompletableFuture<ModelOutcome> future : futures) {
            ModelOutcome outcome = future.join();
            if (outcome.isSucceeded()) {
                outcome = score(outcome, metrics);
            }
            outcomes.add(outcome);
        }

        AnomalyReport anomalies = detectAnomalies(daily, runConfig);
        return reporter.build(runConfig, outcomes, metrics, anomalies);
    }

    private ModelOutcome attempt(ModelAdapter adapter, UtilitySeries series, RunConfig runConfig) {
        try {
            return ModelOutcome.success(adapter.evaluate(series, runConfig));
        } catch (RuntimeException e) {
            trace.logModelFailed(adapter.modelName(), e.getClass().getSimpleName(), e.getMessage());
            log.debug("[MODEL] {} failure detail", adapter.modelName(), e);
            return ModelOutcome.failure(adapter.modelName(), adapter.family(), e);
        }
    }

    private ModelOutcome score(ModelOutcome outcome, Map<String, AccuracyMetrics> metrics) {
        ModelRun run = outcome.getRun();
        try {
            AccuracyMetrics scored = metricsCalculator.score(run.getModelName(), run.getForecasts());
            trace.logMetrics(scored);
            metrics.put(run.getModelName(), scored);
            return outcome;
        } catch (DataException e) {
            trace.logModelFailed(run.getModelName(), e.getClass().getSimpleName(), e.getMessage());
            return ModelOutcome.failure(run.getModelName(), run.getFamily(), e);
        }
    }

    private AnomalyReport detectAnomalies(List<DailyRecord> daily, RunConfig runConfig) {
        if (!config.getAnomaly().isEnabled()) {
            return AnomalyReport.empty();
        }
        if (daily == null || daily.isEmpty()) {
            trace.logAnomalySkipped("no daily rows for " + runConfig.getUtility());
            return AnomalyReport.empty();
        }
        try {
            return anomalyDetector.detect(daily, runConfig);
        } catch (DataException e) {
            trace.logAnomalySkipped(e.getMessage());
            return AnomalyReport.empty();
        }
    }
}
