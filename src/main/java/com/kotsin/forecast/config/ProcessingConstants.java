package com.kotsin.forecast.config;

/**
 * Fixed constants of the forecasting pipeline (calendar periods, numeric guards).
 */
public final class ProcessingConstants {

    private ProcessingConstants() {
        throw new UnsupportedOperationException("Constants class");
    }

    // ========== CALENDAR PERIODS ==========

    public static final int HOURS_PER_DAY = 24;
    public static final int DAYS_PER_WEEK = 7;
    public static final int MONTHS_PER_YEAR = 12;

    public static final double SECONDS_PER_DAY = 86_400.0;
    public static final double YEAR_PERIOD_DAYS = 365.25;
    public static final double WEEK_PERIOD_DAYS = 7.0;
    public static final double DAY_PERIOD_DAYS = 1.0;

    // ========== COLUMN NAMES ==========

    public static final String TARGET_COLUMN = "energy_kwh";
    public static final String HDD_COLUMN = "hdd";
    public static final String CDD_COLUMN = "cdd";

    // ========== NUMERIC GUARDS ==========

    public static final double EPSILON = 1e-10;

    /**
     * Ridge added to the diagonal so normal equations stay solvable
     */
    public static final double MIN_RIDGE = 1e-8;

    /**
     * MAPE denominator used where the actual value is zero
     */
    public static final double ZERO_ACTUAL_DENOMINATOR = 1.0;
}
