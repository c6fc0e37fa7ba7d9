package com.kotsin.forecast.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Duration;

/**
 * SplitPolicy - How the test suffix of an ordered series is chosen.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SplitPolicy {

    public enum Type {
        TRAILING_DURATION,
        TRAILING_FRACTION
    }

    Type type;
    Duration duration;
    double fraction;

    /**
     * Test set = rows strictly after {@code max(timestamp) - duration}.
     */
    public static SplitPolicy trailingDuration(Duration duration) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("Trailing duration must be positive: " + duration);
        }
        return new SplitPolicy(Type.TRAILING_DURATION, duration, 0.0);
    }

    /**
     * Test set = last {@code fraction} of the rows.
     */
    public static SplitPolicy trailingFraction(double fraction) {
        if (!(fraction > 0.0 && fraction < 1.0)) {
            throw new IllegalArgumentException("Trailing fraction must be in (0, 1): " + fraction);
        }
        return new SplitPolicy(Type.TRAILING_FRACTION, null, fraction);
    }

    @Override
    public String toString() {
        return type == Type.TRAILING_DURATION ? "last " + duration : "last " + (fraction * 100) + "%";
    }
}
