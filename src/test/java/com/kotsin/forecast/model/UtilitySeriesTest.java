package com.kotsin.forecast.model;

import com.kotsin.forecast.ForecastFixtures;
import com.kotsin.forecast.exception.DataException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("UtilitySeries - Ordered, unique readings")
class UtilitySeriesTest {

    private static TimeSeriesPoint point(int hour, double value) {
        return TimeSeriesPoint.builder()
                .entityScope("campus")
                .utility(Utility.ELECTRICITY)
                .timestamp(ForecastFixtures.hour(hour))
                .value(value)
                .build();
    }

    @Test
    @DisplayName("Readings are sorted by timestamp")
    void testOf_Sorts() {
        UtilitySeries series = UtilitySeries.of("campus", Utility.ELECTRICITY,
                List.of(point(2, 2.0), point(0, 0.0), point(1, 1.0)));

        assertEquals(ForecastFixtures.hour(0), series.getPoints().get(0).getTimestamp());
        assertEquals(ForecastFixtures.hour(2), series.getPoints().get(2).getTimestamp());
    }

    @Test
    @DisplayName("Duplicate timestamps are rejected")
    void testOf_Duplicate() {
        DataException e = assertThrows(DataException.class, () -> UtilitySeries.of("campus", Utility.ELECTRICITY,
                List.of(point(0, 1.0), point(0, 2.0))));
        assertEquals(DataException.Reason.DUPLICATE_TIMESTAMP, e.getReason());
    }

    @Test
    @DisplayName("Tail keeps the most recent share of readings")
    void testTail() {
        UtilitySeries series = ForecastFixtures.hourly(100, h -> h);

        UtilitySeries tail = series.tail(0.25);

        assertEquals(25, tail.size());
        assertEquals(ForecastFixtures.hour(75), tail.getPoints().get(0).getTimestamp());
        assertSame(series, series.tail(1.0));
    }

    @Test
    @DisplayName("Regressor names are collected across readings")
    void testRegressorNames() {
        List<TimeSeriesPoint> points = new ArrayList<>();
        points.add(point(0, 1.0).toBuilder().regressor("temperature_2m", 40.0).build());
        points.add(point(1, 1.0).toBuilder().regressor("relative_humidity_2m", 60.0).build());

        UtilitySeries series = UtilitySeries.of("campus", Utility.ELECTRICITY, points);

        assertEquals(List.of("temperature_2m", "relative_humidity_2m"), new ArrayList<>(series.regressorNames()));
    }

    @Test
    @DisplayName("Utility codes parse case-insensitively")
    void testUtilityFromCode() {
        assertEquals(Utility.CHILLED_WATER, Utility.fromCode("Chilled Water"));
        assertEquals(Utility.ELECTRICITY, Utility.fromCode("electricity"));
        assertThrows(IllegalArgumentException.class, () -> Utility.fromCode("plasma"));
    }

    @Test
    @DisplayName("EUI is derived from energy and a positive area")
    void testDailyRecordEui() {
        DailyRecord record = ForecastFixtures.daily("A", 0, 500.0, 1000.0, 50.0);
        assertEquals(0.5, record.resolvedEui(), 1e-12);
        assertNull(record.toBuilder().grossArea(0.0).build().resolvedEui());
        assertEquals(2.0, record.toBuilder().eui(2.0).build().resolvedEui(), 1e-12);
    }
}
