package com.kotsin.forecast.feature;

import java.time.Instant;

/**
 * SlidingWindows - Fixed-length windows over a {@link SequenceBuffer}, each paired with the
 * next-step target.
 *
 * Window {@code i} covers rows {@code [i, i + length)} and predicts row {@code i + length}.
 * Nothing is copied; memory stays linear in series length.
 */
public final class SlidingWindows {

    private final SequenceBuffer buffer;
    private final int length;

    SlidingWindows(SequenceBuffer buffer, int length) {
        if (length < 1) {
            throw new IllegalArgumentException("Window length must be positive: " + length);
        }
        this.buffer = buffer;
        this.length = length;
    }

    public int count() {
        return Math.max(0, buffer.rows() - length);
    }

    public int length() {
        return length;
    }

    public int features() {
        return buffer.columns();
    }

    public double value(int window, int step, int feature) {
        return buffer.get(window + step, feature);
    }

    public double target(int window) {
        return buffer.get(window + length, SequenceBuffer.TARGET_COLUMN);
    }

    public Instant targetTimestamp(int window) {
        return buffer.timestamp(window + length);
    }

    /**
     * Index of the last buffer row a window reads, its target included
     */
    public int lastRowOf(int window) {
        return window + length;
    }
}
