package com.kotsin.forecast.adapter;

/**
 * Tag of the three model families. Each family consumes a different input shape:
 * a time axis plus regressors, fixed-length windows, or flat feature vectors.
 */
public enum ModelFamily {
    DECOMPOSITION,
    SEQUENCE,
    GRADIENT_BOOSTED;

    public boolean exposesFeatureImportance() {
        return this == GRADIENT_BOOSTED;
    }
}
