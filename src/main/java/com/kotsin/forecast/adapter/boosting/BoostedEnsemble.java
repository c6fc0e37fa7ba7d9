package com.kotsin.forecast.adapter.boosting;

import com.kotsin.forecast.model.FeatureImportance;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * BoostedEnsemble - Fitted additive tree ensemble: base score plus the sum of tree outputs.
 */
public final class BoostedEnsemble {

    private final List<String> featureNames;
    private final double baseScore;
    private final List<RegressionTree> trees;
    private final double[] gains;

    BoostedEnsemble(List<String> featureNames, double baseScore, List<RegressionTree> trees, double[] gains) {
        this.featureNames = List.copyOf(featureNames);
        this.baseScore = baseScore;
        this.trees = List.copyOf(trees);
        this.gains = gains.clone();
    }

    public double predict(double[] row) {
        double sum = baseScore;
        for (RegressionTree tree : trees) {
            sum += tree.predict(row);
        }
        return sum;
    }

    public int treeCount() {
        return trees.size();
    }

    public double getBaseScore() {
        return baseScore;
    }

    public List<String> getFeatureNames() {
        return featureNames;
    }

    /**
     * Total split gain per feature normalized to sum 1, highest first, ties by name.
     * An ensemble without a single split has no meaningful ranking and yields all zeros.
     */
    public List<FeatureImportance> importances() {
        double total = 0.0;
        for (double g : gains) {
            total += g;
        }
        List<FeatureImportance> result = new ArrayList<>(featureNames.size());
        for (int f = 0; f < featureNames.size(); f++) {
            result.add(new FeatureImportance(featureNames.get(f), total > 0.0 ? gains[f] / total : 0.0));
        }
        result.sort(Comparator.comparingDouble(FeatureImportance::getImportance).reversed()
                .thenComparing(FeatureImportance::getFeatureName));
        return result;
    }
}
