package com.kotsin.forecast.report;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.kotsin.forecast.config.ForecastConfig;
import com.kotsin.forecast.model.PipelineReport;
import com.kotsin.forecast.model.Utility;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * ReportStore - Latest report per utility, kept in memory for the read endpoints.
 *
 * A newer run for the same utility replaces the older report. Entries expire after the
 * configured TTL.
 */
@Slf4j
@Component
public class ReportStore {

    private final Cache<Utility, PipelineReport> reports;

    public ReportStore(ForecastConfig config) {
        ForecastConfig.ReportConfig settings = config.getReport();
        this.reports = Caffeine.newBuilder()
                .expireAfterWrite(settings.getCacheTtl())
                .maximumSize(settings.getCacheMaxSize())
                .recordStats()
                .build();
    }

    public void put(PipelineReport report) {
        reports.put(report.getUtility(), report);
        log.debug("[REPORT] stored {} | best={}", report.getUtility(), report.bestModel());
    }

    public Optional<PipelineReport> latest(Utility utility) {
        return Optional.ofNullable(reports.getIfPresent(utility));
    }

    public CacheStats stats() {
        return reports.stats();
    }
}
