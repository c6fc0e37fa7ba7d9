package com.kotsin.forecast.adapter.boosting;

import java.util.ArrayList;
import java.util.List;

/**
 * RegressionTree - One second-order boosting tree grown depth-wise on binned features.
 *
 * Split gain for a node with gradient sum G and hessian sum H:
 * {@code 0.5 * (GL^2/(HL+λ) + GR^2/(HR+λ) - G^2/(H+λ))}; leaf weight {@code -G/(H+λ)}.
 * Leaf values are stored already multiplied by the learning rate.
 */
final class RegressionTree {

    private static final int LEAF = -1;

    private final int[] feature;
    private final double[] threshold;
    private final int[] left;
    private final int[] right;
    private final double[] value;

    private RegressionTree(int[] feature, double[] threshold, int[] left, int[] right, double[] value) {
        this.feature = feature;
        this.threshold = threshold;
        this.left = left;
        this.right = right;
        this.value = value;
    }

    double predict(double[] row) {
        int node = 0;
        while (feature[node] != LEAF) {
            node = row[feature[node]] <= threshold[node] ? left[node] : right[node];
        }
        return value[node];
    }

    /**
     * Settings shared by every tree of one ensemble.
     */
    static final class GrowthParams {
        final int maxDepth;
        final double lambda;
        final double minChildWeight;
        final double learningRate;

        GrowthParams(int maxDepth, double lambda, double minChildWeight, double learningRate) {
            this.maxDepth = maxDepth;
            this.lambda = lambda;
            this.minChildWeight = minChildWeight;
            this.learningRate = learningRate;
        }
    }

    // ======================== GROWTH ========================

    /**
     * Grow a tree over the sampled rows and columns.
     *
     * @param binned    feature-major bin indices
     * @param binner    bin edges, used to turn a split bin back into a raw threshold
     * @param gradients per-row gradient of the squared error
     * @param hessians  per-row hessian
     * @param rows      sampled row indices
     * @param columns   sampled feature indices
     * @param gains     accumulates split gain per feature
     */
    static RegressionTree grow(int[][] binned, FeatureBinner binner, double[] gradients, double[] hessians,
                               int[] rows, int[] columns, GrowthParams params, double[] gains) {
        Builder builder = new Builder(binned, binner, gradients, hessians, columns, params, gains);
        builder.split(rows, 0);
        return builder.build();
    }

    private static final class Builder {
        private final int[][] binned;
        private final FeatureBinner binner;
        private final double[] gradients;
        private final double[] hessians;
        private final int[] columns;
        private final GrowthParams params;
        private final double[] gains;

        private final List<Integer> feature = new ArrayList<>();
        private final List<Double> threshold = new ArrayList<>();
        private final List<Integer> left = new ArrayList<>();
        private final List<Integer> right = new ArrayList<>();
        private final List<Double> value = new ArrayList<>();

        Builder(int[][] binned, FeatureBinner binner, double[] gradients, double[] hessians,
                int[] columns, GrowthParams params, double[] gains) {
            this.binned = binned;
            this.binner = binner;
            this.gradients = gradients;
            this.hessians = hessians;
            this.columns = columns;
            this.params = params;
            this.gains = gains;
        }

        private int newNode() {
            feature.add(LEAF);
            threshold.add(0.0);
            left.add(LEAF);
            right.add(LEAF);
            value.add(0.0);
            return feature.size() - 1;
        }

        int split(int[] rows, int depth) {
            int node = newNode();
            double g = 0.0;
            double h = 0.0;
            for (int r : rows) {
                g += gradients[r];
                h += hessians[r];
            }
            value.set(node, -g / (h + params.lambda) * params.learningRate);
            if (depth >= params.maxDepth || rows.length < 2) {
                return node;
            }

            double parentScore = g * g / (h + params.lambda);
            double bestGain = 0.0;
            int bestFeature = LEAF;
            int bestBin = -1;
            for (int f : columns) {
                int bins = binner.bins(f);
                if (bins < 2) {
                    continue;
                }
                double[] histG = new double[bins];
                double[] histH = new double[bins];
                int[] column = binned[f];
                for (int r : rows) {
                    histG[column[r]] += gradients[r];
                    histH[column[r]] += hessians[r];
                }
                double gl = 0.0;
                double hl = 0.0;
                for (int b = 0; b < bins - 1; b++) {
                    gl += histG[b];
                    hl += histH[b];
                    double hr = h - hl;
                    if (hl < params.minChildWeight || hr < params.minChildWeight) {
                        continue;
                    }
                    double gr = g - gl;
                    double gain = 0.5 * (gl * gl / (hl + params.lambda)
                            + gr * gr / (hr + params.lambda) - parentScore);
                    if (gain > bestGain) {
                        bestGain = gain;
                        bestFeature = f;
                        bestBin = b;
                    }
                }
            }
            if (bestFeature == LEAF) {
                return node;
            }

            int[] column = binned[bestFeature];
            int leftCount = 0;
            for (int r : rows) {
                if (column[r] <= bestBin) {
                    leftCount++;
                }
            }
            int[] leftRows = new int[leftCount];
            int[] rightRows = new int[rows.length - leftCount];
            int li = 0;
            int ri = 0;
            for (int r : rows) {
                if (column[r] <= bestBin) {
                    leftRows[li++] = r;
                } else {
                    rightRows[ri++] = r;
                }
            }

            gains[bestFeature] += bestGain;
            feature.set(node, bestFeature);
            threshold.set(node, binner.edge(bestFeature, bestBin));
            int leftChild = split(leftRows, depth + 1);
            int rightChild = split(rightRows, depth + 1);
            left.set(node, leftChild);
            right.set(node, rightChild);
            return node;
        }

        RegressionTree build() {
            int n = feature.size();
            int[] f = new int[n];
            double[] t = new double[n];
            int[] l = new int[n];
            int[] r = new int[n];
            double[] v = new double[n];
            for (int i = 0; i < n; i++) {
                f[i] = feature.get(i);
                t[i] = threshold.get(i);
                l[i] = left.get(i);
                r[i] = right.get(i);
                v[i] = value.get(i);
            }
            return new RegressionTree(f, t, l, r, v);
        }
    }
}
