package com.kotsin.forecast.metrics;

import com.kotsin.forecast.ForecastFixtures;
import com.kotsin.forecast.exception.DataException;
import com.kotsin.forecast.model.AccuracyMetrics;
import com.kotsin.forecast.model.ForecastResult;
import com.kotsin.forecast.model.Utility;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsCalculator - MAE, MAPE, RMSE")
class MetricsCalculatorTest {

    private final MetricsCalculator calculator = new MetricsCalculator();

    private static ForecastResult forecast(int hour, double predicted, Double actual) {
        return ForecastResult.builder()
                .modelName("m")
                .utility(Utility.ELECTRICITY)
                .timestamp(ForecastFixtures.hour(hour))
                .pointEstimate(predicted)
                .actual(actual)
                .build();
    }

    @Test
    @DisplayName("Known errors give known metrics")
    void testScore_KnownValues() {
        AccuracyMetrics metrics = calculator.score("m", List.of(
                forecast(0, 110.0, 100.0),
                forecast(1, 190.0, 200.0)));

        assertEquals(10.0, metrics.getMae(), 1e-9);
        assertEquals(7.5, metrics.getMape(), 1e-9, "(10% + 5%) / 2");
        assertEquals(10.0, metrics.getRmse(), 1e-9);
        assertEquals(2, metrics.getSampleCount());
    }

    @Test
    @DisplayName("Zero actual uses denominator 1")
    void testScore_ZeroActual() {
        AccuracyMetrics metrics = calculator.score("m", List.of(forecast(0, 2.0, 0.0)));

        assertEquals(200.0, metrics.getMape(), 1e-9);
    }

    @Test
    @DisplayName("All-zero actuals still give a finite MAPE")
    void testScore_AllZeroActuals() {
        AccuracyMetrics metrics = calculator.score("m", List.of(
                forecast(0, 0.5, 0.0),
                forecast(1, -0.5, 0.0),
                forecast(2, 0.0, 0.0)));

        assertTrue(Double.isFinite(metrics.getMape()));
        assertEquals(100.0 / 3.0, metrics.getMape(), 1e-9);
    }

    @Test
    @DisplayName("Only timestamps present on both sides are scored")
    void testScore_AlignedByTimestamp() {
        Map<Instant, Double> actuals = new HashMap<>();
        actuals.put(ForecastFixtures.hour(1), 10.0);
        actuals.put(ForecastFixtures.hour(5), 99.0);

        AccuracyMetrics metrics = calculator.score("m",
                List.of(forecast(0, 1.0, null), forecast(1, 12.0, null)), actuals);

        assertEquals(1, metrics.getSampleCount());
        assertEquals(2.0, metrics.getMae(), 1e-9);
    }

    @Test
    @DisplayName("No shared timestamp fails with NO_OVERLAP")
    void testScore_NoOverlap() {
        Map<Instant, Double> actuals = Map.of(ForecastFixtures.hour(10), 1.0);

        DataException e = assertThrows(DataException.class,
                () -> calculator.score("m", List.of(forecast(0, 1.0, null)), actuals));
        assertEquals(DataException.Reason.NO_OVERLAP, e.getReason());
    }
}
