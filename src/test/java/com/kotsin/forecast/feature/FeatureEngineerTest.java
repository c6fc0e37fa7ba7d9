package com.kotsin.forecast.feature;

import com.kotsin.forecast.ForecastFixtures;
import com.kotsin.forecast.config.ForecastConfig;
import com.kotsin.forecast.exception.DataException;
import com.kotsin.forecast.model.FeatureTable;
import com.kotsin.forecast.model.FeatureVector;
import com.kotsin.forecast.model.TimeSeriesPoint;
import com.kotsin.forecast.model.Utility;
import com.kotsin.forecast.model.UtilitySeries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FeatureEngineer - Tabular and sequence views")
class FeatureEngineerTest {

    private ForecastConfig config;
    private FeatureEngineer engineer;

    @BeforeEach
    void setUp() {
        config = new ForecastConfig();
        engineer = ForecastFixtures.featureEngineer(config);
    }

    // ========== TABULAR VIEW ==========

    @Test
    @DisplayName("Contiguous series drops exactly the first max-lag readings")
    void testBuildTabular_DropsWarmup() {
        UtilitySeries series = ForecastFixtures.hourly(400, h -> h);

        FeatureTable table = engineer.buildTabular(series, List.of());

        assertEquals(400 - 168, table.size(), "Rows before the weekly lag is populated are dropped");
        assertEquals(ForecastFixtures.hour(168), table.getRows().get(0).getTimestamp());
    }

    @Test
    @DisplayName("Feature names: calendar, lags, rolling means, in that order")
    void testBuildTabular_FeatureNames() {
        FeatureTable table = engineer.buildTabular(ForecastFixtures.hourly(200, h -> h), List.of());

        List<String> expected = new ArrayList<>(CalendarFeatures.NAMES);
        expected.addAll(List.of("lag_1h", "lag_24h", "lag_168h", "rolling_24h_mean", "rolling_168h_mean"));
        assertEquals(expected, table.getFeatureNames());
    }

    @Test
    @DisplayName("Lags look back by exact timestamp, rolling means cover strictly past readings")
    void testBuildTabular_LagAndRollingValues() {
        // value = hour index, so lags and means are easy to check
        FeatureTable table = engineer.buildTabular(ForecastFixtures.hourly(300, h -> h), List.of());
        FeatureVector row = table.getRows().get(0);   // h = 168

        assertEquals(168.0, row.getTarget());
        assertEquals(167.0, row.get(table.indexOf("lag_1h")));
        assertEquals(144.0, row.get(table.indexOf("lag_24h")));
        assertEquals(0.0, row.get(table.indexOf("lag_168h")));
        // mean of 144..167
        assertEquals(155.5, row.get(table.indexOf("rolling_24h_mean")), 1e-9);
        // mean of 0..167
        assertEquals(83.5, row.get(table.indexOf("rolling_168h_mean")), 1e-9);
    }

    @Test
    @DisplayName("A gap excludes every row whose windows reach into it")
    void testBuildTabular_GapExcludesRows() {
        List<TimeSeriesPoint> points = new ArrayList<>();
        for (int h = 0; h < 400; h++) {
            if (h == 250) {
                continue;
            }
            points.add(TimeSeriesPoint.builder().entityScope("campus").utility(Utility.ELECTRICITY)
                    .timestamp(ForecastFixtures.hour(h)).value(1.0).build());
        }
        UtilitySeries series = UtilitySeries.of("campus", Utility.ELECTRICITY, points);

        FeatureTable table = engineer.buildTabular(series, List.of());

        for (FeatureVector row : table.getRows()) {
            Instant ts = row.getTimestamp();
            boolean reachesGap = !ts.isBefore(ForecastFixtures.hour(250))
                    && ts.isBefore(ForecastFixtures.hour(250 + 169));
            assertFalse(reachesGap, "Row at " + ts + " references the missing reading");
        }
        // 168..249 before the gap, 419+ after it (none, series ends at 399)
        assertEquals(250 - 168, table.size());
    }

    @Test
    @DisplayName("Missing readings are skipped, never read as zero")
    void testBuildTabular_NullValuesNotZero() {
        List<TimeSeriesPoint> points = new ArrayList<>();
        for (int h = 0; h < 300; h++) {
            points.add(TimeSeriesPoint.builder().entityScope("campus").utility(Utility.ELECTRICITY)
                    .timestamp(ForecastFixtures.hour(h)).value(h == 200 ? null : 10.0).build());
        }
        FeatureTable table = engineer.buildTabular(UtilitySeries.of("campus", Utility.ELECTRICITY, points), List.of());

        for (FeatureVector row : table.getRows()) {
            for (double v : row.toArray()) {
                assertTrue(Double.isFinite(v));
            }
            assertEquals(10.0, row.get(table.indexOf("rolling_24h_mean")), 1e-9);
        }
    }

    @Test
    @DisplayName("Regressors are appended and degree days derived from temperature")
    void testBuildTabular_Regressors() {
        List<TimeSeriesPoint> points = new ArrayList<>();
        for (int h = 0; h < 200; h++) {
            points.add(TimeSeriesPoint.builder().entityScope("campus").utility(Utility.ELECTRICITY)
                    .timestamp(ForecastFixtures.hour(h)).value(5.0)
                    .regressor("temperature_2m", 50.0).build());
        }
        FeatureTable table = engineer.buildTabular(UtilitySeries.of("campus", Utility.ELECTRICITY, points),
                List.of("temperature_2m", "hdd", "cdd", "shortwave_radiation"));

        assertTrue(table.getFeatureNames().containsAll(List.of("temperature_2m", "hdd", "cdd")));
        assertFalse(table.getFeatureNames().contains("shortwave_radiation"), "Absent regressor is omitted");
        FeatureVector row = table.getRows().get(0);
        assertEquals(15.0, row.get(table.indexOf("hdd")), 1e-9);
        assertEquals(0.0, row.get(table.indexOf("cdd")), 1e-9);
    }

    // ========== ERRORS ==========

    @Test
    @DisplayName("Series shorter than the longest window fails with INSUFFICIENT_HISTORY")
    void testBuildTabular_InsufficientHistory() {
        DataException e = assertThrows(DataException.class,
                () -> engineer.buildTabular(ForecastFixtures.hourly(168, h -> 1.0), List.of()));
        assertEquals(DataException.Reason.INSUFFICIENT_HISTORY, e.getReason());
    }

    @Test
    @DisplayName("Series without any value fails with MISSING_TARGET_COLUMN")
    void testBuildTabular_MissingTarget() {
        List<TimeSeriesPoint> points = new ArrayList<>();
        for (int h = 0; h < 10; h++) {
            points.add(TimeSeriesPoint.builder().entityScope("campus").utility(Utility.ELECTRICITY)
                    .timestamp(ForecastFixtures.hour(h)).build());
        }
        DataException e = assertThrows(DataException.class,
                () -> engineer.buildTabular(UtilitySeries.of("campus", Utility.ELECTRICITY, points), List.of()));
        assertEquals(DataException.Reason.MISSING_TARGET_COLUMN, e.getReason());
    }

    // ========== SEQUENCE VIEW ==========

    @Test
    @DisplayName("Sequence buffer holds energy and calendar columns per reading")
    void testBuildSequence_Columns() {
        SequenceBuffer buffer = engineer.buildSequence(ForecastFixtures.hourly(48, h -> h * 2.0), List.of());

        assertEquals(List.of("energy_kwh", "hour", "day_of_week", "is_weekend"), buffer.getColumnNames());
        assertEquals(48, buffer.rows());
        assertEquals(10.0, buffer.get(5, SequenceBuffer.TARGET_COLUMN));
        assertEquals(5.0, buffer.get(5, 1));
        assertEquals(0.0, buffer.get(5, 2), "2023-01-02 is a Monday");
        assertEquals(1.0, buffer.get(25, 2));
    }

    @Test
    @DisplayName("Sliding windows are views whose target is the next reading")
    void testSlidingWindows() {
        SequenceBuffer buffer = engineer.buildSequence(ForecastFixtures.hourly(30, h -> h), List.of());
        SlidingWindows windows = buffer.windows(24);

        assertEquals(6, windows.count());
        assertEquals(3.0, windows.value(3, 0, SequenceBuffer.TARGET_COLUMN));
        assertEquals(27.0, windows.target(3));
        assertEquals(ForecastFixtures.hour(27), windows.targetTimestamp(3));
        assertEquals(27, windows.lastRowOf(3));
    }
}
