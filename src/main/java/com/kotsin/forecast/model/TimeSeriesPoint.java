package com.kotsin.forecast.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * TimeSeriesPoint - One reading of the hourly contract table.
 *
 * A null {@code value} means the reading is missing. Missing readings are dropped,
 * never treated as zero. Regressor values may be null as well (sporadic gaps).
 */
@Value
@Builder(toBuilder = true)
public class TimeSeriesPoint implements Timestamped {

    String entityScope;
    Utility utility;
    Instant timestamp;
    Double value;

    @Singular
    Map<String, Double> regressors;

    public boolean hasValue() {
        return value != null && !value.isNaN();
    }

    public Double regressor(String name) {
        return regressors.get(name);
    }
}
