package com.kotsin.forecast.feature;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * RegressorFrame - Imputed regressor columns aligned with a list of readings.
 *
 * Only columns that survived the sparsity check are present.
 */
public final class RegressorFrame {

    private final Map<String, double[]> columns;

    RegressorFrame(Map<String, double[]> columns) {
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    public static RegressorFrame empty() {
        return new RegressorFrame(Map.of());
    }

    public List<String> names() {
        return List.copyOf(columns.keySet());
    }

    public boolean has(String name) {
        return columns.containsKey(name);
    }

    public double value(String name, int row) {
        return columns.get(name)[row];
    }

    public double[] column(String name) {
        return columns.get(name).clone();
    }

    public int width() {
        return columns.size();
    }
}
