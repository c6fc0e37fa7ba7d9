package com.kotsin.forecast.exception;

import lombok.Getter;

/**
 * DataException - Input data cannot support the requested stage.
 *
 * Always local to the stage that raised it: one adapter's DataException never
 * reaches another adapter.
 */
@Getter
public class DataException extends ForecastException {

    public enum Reason {
        INSUFFICIENT_HISTORY,
        MISSING_TARGET_COLUMN,
        EMPTY_SPLIT,
        NO_OVERLAP,
        INSUFFICIENT_FEATURES,
        DUPLICATE_TIMESTAMP,
        UNORDERED_SERIES
    }

    private final Reason reason;

    public DataException(Reason reason, String message) {
        super(reason + ": " + message);
        this.reason = reason;
    }

    public static DataException insufficientHistory(int required, int available) {
        return new DataException(Reason.INSUFFICIENT_HISTORY,
                String.format("need at least %d readings, series has %d", required, available));
    }

    public static DataException missingTargetColumn(String series) {
        return new DataException(Reason.MISSING_TARGET_COLUMN, "no energy values in " + series);
    }

    public static DataException emptySplit(int trainSize, int testSize) {
        return new DataException(Reason.EMPTY_SPLIT,
                String.format("train=%d test=%d", trainSize, testSize));
    }
}
