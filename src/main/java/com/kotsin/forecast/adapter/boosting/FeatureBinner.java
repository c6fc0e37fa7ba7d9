package com.kotsin.forecast.adapter.boosting;

import java.util.Arrays;

/**
 * FeatureBinner - Quantile bin edges per feature for histogram split search.
 *
 * Edges are computed from training rows only. A value falls in the first bin whose upper
 * edge it does not exceed, so {@code bin(v) <= b} holds exactly when {@code v <= edge(b)}.
 */
final class FeatureBinner {

    private final double[][] edges;

    private FeatureBinner(double[][] edges) {
        this.edges = edges;
    }

    /**
     * @param columns feature-major training values, {@code columns[feature][row]}
     * @param maxBins upper bound on bins per feature
     */
    static FeatureBinner fit(double[][] columns, int maxBins) {
        double[][] edges = new double[columns.length][];
        for (int f = 0; f < columns.length; f++) {
            edges[f] = edgesFor(columns[f], maxBins);
        }
        return new FeatureBinner(edges);
    }

    private static double[] edgesFor(double[] values, int maxBins) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int n = sorted.length;
        if (n == 0) {
            return new double[0];
        }

        // distinct values; when few enough, every value is its own bin
        double[] distinct = new double[n];
        int d = 0;
        for (double v : sorted) {
            if (d == 0 || v != distinct[d - 1]) {
                distinct[d++] = v;
            }
        }
        if (d <= maxBins) {
            return Arrays.copyOf(distinct, Math.max(0, d - 1));
        }

        double[] cuts = new double[maxBins - 1];
        int count = 0;
        for (int b = 1; b < maxBins; b++) {
            double edge = sorted[(int) Math.min(n - 1, Math.floor((double) b * n / maxBins))];
            if (count == 0 || edge > cuts[count - 1]) {
                cuts[count++] = edge;
            }
        }
        // the top edge would leave an empty right bin
        if (count > 0 && cuts[count - 1] >= sorted[n - 1]) {
            count--;
        }
        return Arrays.copyOf(cuts, count);
    }

    int bins(int feature) {
        return edges[feature].length + 1;
    }

    double edge(int feature, int bin) {
        return edges[feature][bin];
    }

    int bin(int feature, double value) {
        double[] e = edges[feature];
        int lo = 0;
        int hi = e.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (value <= e[mid]) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        return lo;
    }

    /**
     * Bin every value of a feature-major matrix.
     */
    int[][] transform(double[][] columns) {
        int[][] binned = new int[columns.length][];
        for (int f = 0; f < columns.length; f++) {
            binned[f] = new int[columns[f].length];
            for (int r = 0; r < columns[f].length; r++) {
                binned[f][r] = bin(f, columns[f][r]);
            }
        }
        return binned;
    }
}
