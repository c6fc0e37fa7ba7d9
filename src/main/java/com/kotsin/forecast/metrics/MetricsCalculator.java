package com.kotsin.forecast.metrics;

import com.kotsin.forecast.config.ProcessingConstants;
import com.kotsin.forecast.exception.DataException;
import com.kotsin.forecast.model.AccuracyMetrics;
import com.kotsin.forecast.model.ForecastResult;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * MetricsCalculator - MAE, MAPE and RMSE over timestamp-aligned (actual, predicted) pairs.
 *
 * MAPE uses a denominator of 1 where the actual value is zero. This keeps the metric finite on
 * zero-load hours; it is not a true percentage error there.
 */
@Component
public class MetricsCalculator {

    /**
     * Score forecasts against actual values keyed by timestamp.
     *
     * @throws DataException NO_OVERLAP when no forecast timestamp has an actual value
     */
    public AccuracyMetrics score(String modelName, List<ForecastResult> forecasts, Map<Instant, Double> actuals) {
        double absSum = 0.0;
        double pctSum = 0.0;
        double sqSum = 0.0;
        int n = 0;

        for (ForecastResult forecast : forecasts) {
            Double actual = actuals.get(forecast.getTimestamp());
            if (actual == null) {
                continue;
            }
            double error = actual - forecast.getPointEstimate();
            double denominator = actual == 0.0 ? ProcessingConstants.ZERO_ACTUAL_DENOMINATOR : actual;
            absSum += Math.abs(error);
            pctSum += Math.abs(error / denominator);
            sqSum += error * error;
            n++;
        }

        if (n == 0) {
            throw new DataException(DataException.Reason.NO_OVERLAP,
                    modelName + ": " + forecasts.size() + " forecasts share no timestamp with " + actuals.size() + " actuals");
        }

        return AccuracyMetrics.builder()
                .modelName(modelName)
                .mae(absSum / n)
                .mape(pctSum / n * 100.0)
                .rmse(Math.sqrt(sqSum / n))
                .sampleCount(n)
                .build();
    }

    /**
     * Score forecasts that carry their own actual values.
     */
    public AccuracyMetrics score(String modelName, List<ForecastResult> forecasts) {
        Map<Instant, Double> actuals = new HashMap<>();
        for (ForecastResult forecast : forecasts) {
            if (forecast.getActual() != null) {
                actuals.put(forecast.getTimestamp(), forecast.getActual());
            }
        }
        return score(modelName, forecasts, actuals);
    }
}
