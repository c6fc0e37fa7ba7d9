package com.kotsin.forecast.feature;

import com.kotsin.forecast.config.ProcessingConstants;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * CalendarFeatures - Raw and cyclical calendar encodings of a timestamp.
 *
 * Cyclical pairs keep hour 23 next to hour 0, Sunday next to Monday and December next to January.
 */
public final class CalendarFeatures {

    private CalendarFeatures() {}

    public static final List<String> NAMES = List.of(
            "hour", "day_of_week", "month", "is_weekend",
            "hour_sin", "hour_cos", "dow_sin", "dow_cos", "month_sin", "month_cos");

    public static int hour(Instant timestamp, ZoneId zone) {
        return timestamp.atZone(zone).getHour();
    }

    /**
     * Day of week with Monday = 0 ... Sunday = 6
     */
    public static int dayOfWeek(Instant timestamp, ZoneId zone) {
        return timestamp.atZone(zone).getDayOfWeek().getValue() - 1;
    }

    public static boolean isWeekend(Instant timestamp, ZoneId zone) {
        DayOfWeek day = timestamp.atZone(zone).getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    public static double sin(double value, double period) {
        return Math.sin(2 * Math.PI * value / period);
    }

    public static double cos(double value, double period) {
        return Math.cos(2 * Math.PI * value / period);
    }

    /**
     * Values in {@link #NAMES} order
     */
    public static double[] encode(Instant timestamp, ZoneId zone) {
        ZonedDateTime local = timestamp.atZone(zone);
        int hour = local.getHour();
        int dow = local.getDayOfWeek().getValue() - 1;
        int month = local.getMonthValue();
        double weekend = dow >= 5 ? 1.0 : 0.0;
        return new double[]{
                hour, dow, month, weekend,
                sin(hour, ProcessingConstants.HOURS_PER_DAY), cos(hour, ProcessingConstants.HOURS_PER_DAY),
                sin(dow, ProcessingConstants.DAYS_PER_WEEK), cos(dow, ProcessingConstants.DAYS_PER_WEEK),
                sin(month, ProcessingConstants.MONTHS_PER_YEAR), cos(month, ProcessingConstants.MONTHS_PER_YEAR)
        };
    }
}
