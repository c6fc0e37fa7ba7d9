package com.kotsin.forecast.feature;

import java.time.Instant;
import java.util.List;

/**
 * SequenceBuffer - Row-major matrix of per-reading features for sequence models.
 *
 * Column 0 is always the target. Windows over it are index views, see {@link SlidingWindows}.
 */
public final class SequenceBuffer {

    public static final int TARGET_COLUMN = 0;

    private final List<String> columnNames;
    private final List<Instant> timestamps;
    private final double[] data;
    private final int columns;

    SequenceBuffer(List<String> columnNames, List<Instant> timestamps, double[] data) {
        this.columnNames = List.copyOf(columnNames);
        this.timestamps = List.copyOf(timestamps);
        this.columns = columnNames.size();
        if (data.length != this.timestamps.size() * columns) {
            throw new IllegalArgumentException("Buffer size " + data.length + " does not match "
                    + this.timestamps.size() + " x " + columns);
        }
        this.data = data;
    }

    public List<String> getColumnNames() {
        return columnNames;
    }

    public int rows() {
        return timestamps.size();
    }

    public int columns() {
        return columns;
    }

    public Instant timestamp(int row) {
        return timestamps.get(row);
    }

    public double get(int row, int column) {
        return data[row * columns + column];
    }

    /**
     * New buffer with every value passed through the scaler. The one copy made per run.
     */
    public SequenceBuffer scaled(MinMaxScaler scaler) {
        double[] scaled = new double[data.length];
        for (int row = 0; row < rows(); row++) {
            for (int col = 0; col < columns; col++) {
                scaled[row * columns + col] = scaler.transform(col, get(row, col));
            }
        }
        return new SequenceBuffer(columnNames, timestamps, scaled);
    }

    public SlidingWindows windows(int length) {
        return new SlidingWindows(this, length);
    }
}
