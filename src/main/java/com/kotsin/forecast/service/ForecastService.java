package com.kotsin.forecast.service;

import com.kotsin.forecast.config.ForecastConfig;
import com.kotsin.forecast.data.DatasetSource;
import com.kotsin.forecast.model.DailyRecord;
import com.kotsin.forecast.model.PipelineReport;
import com.kotsin.forecast.model.RunConfig;
import com.kotsin.forecast.model.Utility;
import com.kotsin.forecast.model.UtilitySeries;
import com.kotsin.forecast.pipeline.ForecastPipeline;
import com.kotsin.forecast.report.ReportStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * ForecastService - Loads the input tables, runs the pipeline and keeps the latest report.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ForecastService {

    private final DatasetSource datasetSource;
    private final ForecastPipeline pipeline;
    private final ReportStore reportStore;
    private final ForecastConfig config;

    public PipelineReport run(Utility utility) {
        return run(config.toRunConfig(utility));
    }

    /**
     * @throws com.kotsin.forecast.exception.DatasetLoadException if an input table cannot be read
     * @throws com.kotsin.forecast.exception.ReportingException  if no model succeeded
     */
    public PipelineReport run(RunConfig runConfig) {
        long started = System.currentTimeMillis();
        UtilitySeries hourly = datasetSource.hourly(runConfig.getUtility());
        List<DailyRecord> daily = datasetSource.daily(runConfig.getUtility());

        PipelineReport report = pipeline.run(hourly, daily, runConfig);
        reportStore.put(report);
        log.info("[PIPELINE] {} complete in {}ms | best={} failed={}", runConfig.getUtility(),
                System.currentTimeMillis() - started, report.bestModel(), report.getFailedModels().size());
        return report;
    }

    public Optional<PipelineReport> latest(Utility utility) {
        return reportStore.latest(utility);
    }
}
