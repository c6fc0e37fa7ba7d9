package com.kotsin.forecast.controller;

import com.kotsin.forecast.config.ForecastConfig;
import com.kotsin.forecast.exception.DataException;
import com.kotsin.forecast.exception.DatasetLoadException;
import com.kotsin.forecast.exception.ReportingException;
import com.kotsin.forecast.model.AccuracyMetrics;
import com.kotsin.forecast.model.AnomalyRecord;
import com.kotsin.forecast.model.AnomalySummary;
import com.kotsin.forecast.model.FeatureImportance;
import com.kotsin.forecast.model.ForecastResult;
import com.kotsin.forecast.model.PipelineReport;
import com.kotsin.forecast.model.RunConfig;
import com.kotsin.forecast.model.Utility;
import com.kotsin.forecast.service.ForecastService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * ForecastController - REST API over the latest pipeline report of each utility.
 *
 * Endpoints:
 * - POST /api/forecast/{utility}/run?seed=42&sampleFraction=1.0
 * - GET  /api/forecast/{utility}/comparison
 * - GET  /api/forecast/{utility}/forecasts/{model}
 * - GET  /api/forecast/{utility}/feature-importance
 * - GET  /api/forecast/{utility}/anomalies?onlyFlagged=false
 * - GET  /api/forecast/{utility}/anomalies/summary
 *
 * Read endpoints answer 404 until a run for that utility has completed.
 */
@RestController
@RequestMapping("/api/forecast")
@Slf4j
public class ForecastController {

    @Autowired
    private ForecastService forecastService;

    @Autowired
    private ForecastConfig config;

    /**
     * Run the pipeline synchronously and return a summary of the report.
     */
    @PostMapping("/{utility}/run")
    public ResponseEntity<Map<String, Object>> run(
            @PathVariable String utility,
            @RequestParam(required = false) Long seed,
            @RequestParam(required = false) Double sampleFraction) {

        Map<String, Object> response = new HashMap<>();
        Utility target;
        try {
            target = Utility.fromCode(utility);
        } catch (IllegalArgumentException e) {
            log.warn("[FORECAST-API] Invalid utility: {}", utility);
            response.put("error", "Unknown utility: " + utility);
            return ResponseEntity.badRequest().body(response);
        }
        if (sampleFraction != null && (sampleFraction <= 0.0 || sampleFraction > 1.0)) {
            response.put("error", "sampleFraction must be in (0, 1]");
            return ResponseEntity.badRequest().body(response);
        }

        RunConfig.RunConfigBuilder runConfig = config.toRunConfig(target).toBuilder();
        if (seed != null) {
            runConfig.seed(seed);
        }
        if (sampleFraction != null) {
            runConfig.sampleFraction(sampleFraction);
        }

        log.info("[FORECAST-API] Run requested for {} (seed={}, sampleFraction={})", target, seed, sampleFraction);
        try {
            PipelineReport report = forecastService.run(runConfig.build());
            response.put("utility", report.getUtility());
            response.put("best_model", report.bestModel());
            response.put("comparison", report.getComparison());
            response.put("failed_models", report.getFailedModels());
            response.put("anomaly_count", report.getAnomalies().anomalyCount());
            response.put("generated_at", report.getGeneratedAt());
            return ResponseEntity.ok(response);
        } catch (ReportingException e) {
            log.warn("[FORECAST-API] Run for {} produced no model: {}", target, e.getMessage());
            response.put("error", e.getMessage());
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(response);
        } catch (DataException e) {
            log.warn("[FORECAST-API] Data for {} rejected: {}", target, e.getMessage());
            response.put("error", e.getMessage());
            response.put("reason", e.getReason());
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(response);
        } catch (DatasetLoadException e) {
            log.error("[FORECAST-API] Input for {} could not be loaded: {}", target, e.getMessage());
            response.put("error", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }

    @GetMapping("/{utility}/comparison")
    public ResponseEntity<List<AccuracyMetrics>> getComparison(@PathVariable String utility) {
        return fromLatest(utility, PipelineReport::getComparison);
    }

    @GetMapping("/{utility}/forecasts/{model}")
    public ResponseEntity<List<ForecastResult>> getForecasts(@PathVariable String utility,
                                                             @PathVariable String model) {
        return fromLatest(utility, report -> report.getForecasts().get(model));
    }

    /**
     * Top features per model, for every model that ranks them.
     */
    @GetMapping("/{utility}/feature-importance")
    public ResponseEntity<Map<String, List<FeatureImportance>>> getFeatureImportance(@PathVariable String utility) {
        return fromLatest(utility, PipelineReport::getFeatureImportances);
    }

    @GetMapping("/{utility}/anomalies")
    public ResponseEntity<List<AnomalyRecord>> getAnomalies(
            @PathVariable String utility,
            @RequestParam(defaultValue = "false") boolean onlyFlagged) {
        return fromLatest(utility, report -> {
            List<AnomalyRecord> records = report.getAnomalies().getRecords();
            if (!onlyFlagged) {
                return records;
            }
            return records.stream().filter(AnomalyRecord::isAnomaly).toList();
        });
    }

    @GetMapping("/{utility}/anomalies/summary")
    public ResponseEntity<List<AnomalySummary>> getAnomalySummary(@PathVariable String utility) {
        return fromLatest(utility, report -> report.getAnomalies().getSummary());
    }

    private <T> ResponseEntity<T> fromLatest(String utility, Function<PipelineReport, T> extractor) {
        Utility target;
        try {
            target = Utility.fromCode(utility);
        } catch (IllegalArgumentException e) {
            log.warn("[FORECAST-API] Invalid utility: {}", utility);
            return ResponseEntity.badRequest().build();
        }
        Optional<PipelineReport> report = forecastService.latest(target);
        if (report.isEmpty()) {
            log.debug("[FORECAST-API] No report for {}", target);
            return ResponseEntity.notFound().build();
        }
        T body = extractor.apply(report.get());
        if (body == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(body);
    }
}
