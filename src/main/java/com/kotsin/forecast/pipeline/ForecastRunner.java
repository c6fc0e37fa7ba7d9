package com.kotsin.forecast.pipeline;

import com.kotsin.forecast.config.ForecastConfig;
import com.kotsin.forecast.service.ForecastService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * ForecastRunner - One batch run of the configured utility on startup.
 *
 * Enable with {@code forecast.runner.enabled=true}.
 */
@Component
@ConditionalOnProperty(value = "forecast.runner.enabled", havingValue = "true", matchIfMissing = false)
@RequiredArgsConstructor
@Slf4j
public class ForecastRunner implements CommandLineRunner {

    private final ForecastService forecastService;
    private final ForecastConfig config;

    @Override
    public void run(String... args) {
        log.info("[RUNNER] Batch run enabled for {} (hourly={}, daily={})", config.getUtility(),
                config.getRunner().getHourlyPath(), config.getRunner().getDailyPath());
        forecastService.run(config.getUtility());
    }
}
