package com.kotsin.forecast.feature;

/**
 * MinMaxScaler - Per-column scaling to [0, 1] with statistics fit on a row prefix.
 *
 * Fit on training rows only; rows after the prefix may fall outside [0, 1].
 */
public final class MinMaxScaler {

    private final double[] min;
    private final double[] range;

    private MinMaxScaler(double[] min, double[] range) {
        this.min = min;
        this.range = range;
    }

    /**
     * Fit on rows {@code [0, rowEndExclusive)} of the buffer
     */
    public static MinMaxScaler fit(SequenceBuffer buffer, int rowEndExclusive) {
        if (rowEndExclusive < 1 || rowEndExclusive > buffer.rows()) {
            throw new IllegalArgumentException("Cannot fit scaler on " + rowEndExclusive + " of " + buffer.rows() + " rows");
        }
        int columns = buffer.columns();
        double[] min = new double[columns];
        double[] max = new double[columns];
        for (int col = 0; col < columns; col++) {
            min[col] = Double.POSITIVE_INFINITY;
            max[col] = Double.NEGATIVE_INFINITY;
        }
        for (int row = 0; row < rowEndExclusive; row++) {
            for (int col = 0; col < columns; col++) {
                double v = buffer.get(row, col);
                min[col] = Math.min(min[col], v);
                max[col] = Math.max(max[col], v);
            }
        }
        double[] range = new double[columns];
        for (int col = 0; col < columns; col++) {
            double span = max[col] - min[col];
            // constant column: scale of 1, like scikit-learn
            range[col] = span == 0.0 ? 1.0 : span;
        }
        return new MinMaxScaler(min, range);
    }

    public double transform(int column, double value) {
        return (value - min[column]) / range[column];
    }

    public double inverse(int column, double scaled) {
        return scaled * range[column] + min[column];
    }
}
