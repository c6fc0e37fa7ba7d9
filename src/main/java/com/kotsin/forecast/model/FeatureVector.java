package com.kotsin.forecast.model;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * FeatureVector - Fixed-width engineered features for one timestamp, plus its target.
 *
 * Only materialized once all lag and rolling windows behind it are populated.
 */
public final class FeatureVector implements Timestamped {

    private final Instant timestamp;
    private final double[] values;
    private final double target;

    public FeatureVector(Instant timestamp, double[] values, double target) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.values = values.clone();
        this.target = target;
    }

    @Override
    public Instant getTimestamp() {
        return timestamp;
    }

    public double getTarget() {
        return target;
    }

    public int width() {
        return values.length;
    }

    public double get(int index) {
        return values[index];
    }

    public double[] toArray() {
        return values.clone();
    }

    @Override
    public String toString() {
        return "FeatureVector{" + timestamp + ", target=" + target + ", values=" + Arrays.toString(values) + "}";
    }
}
