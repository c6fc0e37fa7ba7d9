package com.kotsin.forecast.feature;

import com.kotsin.forecast.config.ForecastConfig;
import com.kotsin.forecast.config.ProcessingConstants;
import com.kotsin.forecast.model.TimeSeriesPoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * RegressorImputer - Builds dense exogenous columns from sparse readings.
 *
 * Sporadic gaps are filled (mean or forward fill). A column that is absent, or
 * missing in more than {@code max-missing-fraction} of the rows, is left out of the run.
 * Heating/cooling degree measures are derived from temperature when not supplied.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RegressorImputer {

    private final ForecastConfig config;

    public RegressorFrame impute(List<TimeSeriesPoint> points, List<String> requested) {
        ForecastConfig.FeatureConfig features = config.getFeatures();
        Map<String, double[]> columns = new LinkedHashMap<>();

        for (String name : requested) {
            Double[] raw = rawColumn(points, name);
            if (countPresent(raw) == 0 && isDegreeDay(name) && features.isDeriveDegreeDays()) {
                raw = deriveDegreeDays(points, name);
            }
            int present = countPresent(raw);
            if (present == 0) {
                log.debug("[FEATURES] regressor '{}' absent, omitted", name);
                continue;
            }
            double missingFraction = 1.0 - (double) present / raw.length;
            if (missingFraction > features.getMaxMissingFraction()) {
                log.info("[FEATURES] regressor '{}' missing in {}% of rows, omitted",
                        name, String.format("%.1f", missingFraction * 100));
                continue;
            }
            columns.put(name, fill(raw, features.getImputation()));
        }
        return new RegressorFrame(columns);
    }

    private static Double[] rawColumn(List<TimeSeriesPoint> points, String name) {
        Double[] raw = new Double[points.size()];
        for (int i = 0; i < points.size(); i++) {
            Double value = points.get(i).regressor(name);
            raw[i] = value == null || value.isNaN() || value.isInfinite() ? null : value;
        }
        return raw;
    }

    private Double[] deriveDegreeDays(List<TimeSeriesPoint> points, String name) {
        ForecastConfig.FeatureConfig features = config.getFeatures();
        Double[] temperature = rawColumn(points, features.getTemperatureColumn());
        double base = features.getDegreeDayBase();
        boolean heating = ProcessingConstants.HDD_COLUMN.equals(name);
        Double[] derived = new Double[temperature.length];
        for (int i = 0; i < temperature.length; i++) {
            if (temperature[i] != null) {
                derived[i] = heating
                        ? Math.max(0.0, base - temperature[i])
                        : Math.max(0.0, temperature[i] - base);
            }
        }
        return derived;
    }

    private static boolean isDegreeDay(String name) {
        return ProcessingConstants.HDD_COLUMN.equals(name) || ProcessingConstants.CDD_COLUMN.equals(name);
    }

    private static int countPresent(Double[] raw) {
        int present = 0;
        for (Double v : raw) {
            if (v != null) {
                present++;
            }
        }
        return present;
    }

    private static double[] fill(Double[] raw, ForecastConfig.Imputation imputation) {
        double sum = 0.0;
        int count = 0;
        for (Double v : raw) {
            if (v != null) {
                sum += v;
                count++;
            }
        }
        double mean = sum / count;

        double[] filled = new double[raw.length];
        Double last = null;
        for (int i = 0; i < raw.length; i++) {
            if (raw[i] != null) {
                filled[i] = raw[i];
                last = raw[i];
            } else if (imputation == ForecastConfig.Imputation.FORWARD_FILL && last != null) {
                filled[i] = last;
            } else {
                // leading gaps of a forward fill fall back to the mean
                filled[i] = mean;
            }
        }
        return filled;
    }
}
