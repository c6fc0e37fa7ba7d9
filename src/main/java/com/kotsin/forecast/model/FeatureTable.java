package com.kotsin.forecast.model;

import lombok.Value;

import java.util.List;

/**
 * FeatureTable - Ordered feature names and the rows built from one series.
 */
@Value
public class FeatureTable {

    List<String> featureNames;
    List<FeatureVector> rows;

    public FeatureTable(List<String> featureNames, List<FeatureVector> rows) {
        this.featureNames = List.copyOf(featureNames);
        this.rows = List.copyOf(rows);
    }

    public int indexOf(String featureName) {
        return featureNames.indexOf(featureName);
    }

    public int size() {
        return rows.size();
    }
}
