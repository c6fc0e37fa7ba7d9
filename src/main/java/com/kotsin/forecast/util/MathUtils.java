package com.kotsin.forecast.util;

/**
 * MathUtils - Numeric helpers shared by the feature, model and anomaly stages.
 *
 * Non-finite values are treated as missing throughout.
 */
public final class MathUtils {

    private MathUtils() {} // Prevent instantiation

    // ======================== NUMBER VALIDATION ========================

    public static boolean isValidNumber(double value) {
        return !Double.isNaN(value) && !Double.isInfinite(value);
    }

    /**
     * Check if a Double wrapper is valid (not null, not NaN, not Infinite)
     */
    public static boolean isValidNumber(Double value) {
        return value != null && !Double.isNaN(value) && !Double.isInfinite(value);
    }

    /**
     * True when no element is NaN or infinite. Used to detect diverged optimizers.
     */
    public static boolean allFinite(double[] values) {
        for (double v : values) {
            if (!isValidNumber(v)) {
                return false;
            }
        }
        return true;
    }

    // ======================== STATISTICAL ========================

    /**
     * Mean of the valid entries, or defaultValue when there are none
     */
    public static double mean(double[] values, double defaultValue) {
        if (values == null || values.length == 0) {
            return defaultValue;
        }
        double sum = 0.0;
        int count = 0;
        for (double v : values) {
            if (isValidNumber(v)) {
                sum += v;
                count++;
            }
        }
        return count == 0 ? defaultValue : sum / count;
    }

    /**
     * Population standard deviation (divides by n)
     */
    public static double populationStdDev(double[] values) {
        if (values == null || values.length == 0) {
            return 0.0;
        }
        double mean = mean(values, 0.0);
        double sumSquaredDiff = 0.0;
        int count = 0;
        for (double v : values) {
            if (isValidNumber(v)) {
                sumSquaredDiff += (v - mean) * (v - mean);
                count++;
            }
        }
        return count == 0 ? 0.0 : Math.sqrt(sumSquaredDiff / count);
    }

    /**
     * Calculate percentile from sorted array (0-100), linear interpolation between ranks
     */
    public static double percentile(double[] sortedValues, double percentile) {
        if (sortedValues == null || sortedValues.length == 0) {
            return 0.0;
        }
        if (percentile <= 0) return sortedValues[0];
        if (percentile >= 100) return sortedValues[sortedValues.length - 1];

        double idx = percentile / 100.0 * (sortedValues.length - 1);
        int lower = (int) Math.floor(idx);
        int upper = (int) Math.ceil(idx);

        if (lower == upper) {
            return sortedValues[lower];
        }

        double weight = idx - lower;
        return sortedValues[lower] * (1 - weight) + sortedValues[upper] * weight;
    }

    // ======================== DISTRIBUTIONS ========================

    /**
     * Inverse of the standard normal CDF (Acklam's rational approximation, |error| < 1.2e-9).
     *
     * @param p probability in (0, 1)
     */
    public static double normalQuantile(double p) {
        if (p <= 0.0 || p >= 1.0) {
            throw new IllegalArgumentException("Probability must be in (0, 1): " + p);
        }
        final double[] a = {-3.969683028665376e+01, 2.209460984245205e+02, -2.759285104469687e+02,
                1.383577518672690e+02, -3.066479806614716e+01, 2.506628277459239e+00};
        final double[] b = {-5.447609879822406e+01, 1.615858368580409e+02, -1.556989798598866e+02,
                6.680131188771972e+01, -1.328068155288572e+01};
        final double[] c = {-7.784894002430293e-03, -3.223964580411365e-01, -2.400758277161838e+00,
                -2.549732539343734e+00, 4.374664141464968e+00, 2.938163982698783e+00};
        final double[] d = {7.784695709041462e-03, 3.224671290700398e-01, 2.445134137142996e+00,
                3.754408661907416e+00};
        final double low = 0.02425;

        if (p < low) {
            double q = Math.sqrt(-2 * Math.log(p));
            return (((((c[0] * q + c[1]) * q + c[2]) * q + c[3]) * q + c[4]) * q + c[5])
                    / ((((d[0] * q + d[1]) * q + d[2]) * q + d[3]) * q + 1);
        }
        if (p > 1 - low) {
            double q = Math.sqrt(-2 * Math.log(1 - p));
            return -(((((c[0] * q + c[1]) * q + c[2]) * q + c[3]) * q + c[4]) * q + c[5])
                    / ((((d[0] * q + d[1]) * q + d[2]) * q + d[3]) * q + 1);
        }
        double q = p - 0.5;
        double r = q * q;
        return (((((a[0] * r + a[1]) * r + a[2]) * r + a[3]) * r + a[4]) * r + a[5]) * q
                / (((((b[0] * r + b[1]) * r + b[2]) * r + b[3]) * r + b[4]) * r + 1);
    }
}
