package com.kotsin.forecast.anomaly;

import java.util.Arrays;
import java.util.Random;

/**
 * IsolationForest - Random axis-aligned partitioning; outliers isolate in fewer splits.
 *
 * Each tree is grown on a sub-sample of {@code psi} rows without replacement, up to
 * {@code ceil(log2(psi))} levels. The path length of a row ending in a leaf that still
 * holds {@code m} rows is {@code depth + c(m)}, where {@code c} is the average path length
 * of an unsuccessful binary-search-tree lookup.
 */
public final class IsolationForest {

    private static final double EULER_GAMMA = 0.5772156649015329;

    private final Node[] trees;
    private final int sampleSize;

    private IsolationForest(Node[] trees, int sampleSize) {
        this.trees = trees;
        this.sampleSize = sampleSize;
    }

    /**
     * @param rows       complete feature rows
     * @param treeCount  number of trees
     * @param maxSamples sub-sample cap; the effective size is {@code min(maxSamples, rows)}
     */
    public static IsolationForest fit(double[][] rows, int treeCount, int maxSamples, Random random) {
        int n = rows.length;
        int psi = Math.min(maxSamples, n);
        int heightLimit = (int) Math.ceil(Math.log(Math.max(psi, 2)) / Math.log(2));
        Node[] trees = new Node[treeCount];
        int[] indices = new int[n];
        for (int t = 0; t < treeCount; t++) {
            for (int i = 0; i < n; i++) {
                indices[i] = i;
            }
            // partial Fisher-Yates: the first psi slots are the sample
            for (int i = 0; i < psi; i++) {
                int j = i + random.nextInt(n - i);
                int tmp = indices[i];
                indices[i] = indices[j];
                indices[j] = tmp;
            }
            trees[t] = grow(rows, Arrays.copyOf(indices, psi), 0, heightLimit, random);
        }
        return new IsolationForest(trees, psi);
    }

    /**
     * {@code -2^(-E[h(x)] / c(psi))}; values near -1 are anomalous, near -0.5 ordinary.
     */
    public double score(double[] row) {
        double total = 0.0;
        for (Node tree : trees) {
            total += pathLength(tree, row);
        }
        double meanPath = total / trees.length;
        double normalizer = averagePathLength(sampleSize);
        if (normalizer <= 0.0) {
            return -1.0;
        }
        return -Math.pow(2.0, -meanPath / normalizer);
    }

    int sampleSize() {
        return sampleSize;
    }

    // ======================== TREE ========================

    private static final class Node {
        final int feature;
        final double split;
        final Node left;
        final Node right;
        final int size;

        Node(int feature, double split, Node left, Node right, int size) {
            this.feature = feature;
            this.split = split;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        boolean isLeaf() {
            return left == null;
        }
    }

    private static Node grow(double[][] rows, int[] members, int depth, int heightLimit, Random random) {
        if (depth >= heightLimit || members.length <= 1) {
            return new Node(-1, 0.0, null, null, members.length);
        }

        int width = rows[members[0]].length;
        double[] min = new double[width];
        double[] max = new double[width];
        Arrays.fill(min, Double.POSITIVE_INFINITY);
        Arrays.fill(max, Double.NEGATIVE_INFINITY);
        for (int m : members) {
            for (int f = 0; f < width; f++) {
                min[f] = Math.min(min[f], rows[m][f]);
                max[f] = Math.max(max[f], rows[m][f]);
            }
        }
        int[] candidates = new int[width];
        int count = 0;
        for (int f = 0; f < width; f++) {
            if (max[f] > min[f]) {
                candidates[count++] = f;
            }
        }
        // identical rows cannot be separated
        if (count == 0) {
            return new Node(-1, 0.0, null, null, members.length);
        }

        int feature = candidates[random.nextInt(count)];
        double split = min[feature] + random.nextDouble() * (max[feature] - min[feature]);

        int leftCount = 0;
        for (int m : members) {
            if (rows[m][feature] < split) {
                leftCount++;
            }
        }
        int[] left = new int[leftCount];
        int[] right = new int[members.length - leftCount];
        int li = 0;
        int ri = 0;
        for (int m : members) {
            if (rows[m][feature] < split) {
                left[li++] = m;
            } else {
                right[ri++] = m;
            }
        }
        return new Node(feature, split,
                grow(rows, left, depth + 1, heightLimit, random),
                grow(rows, right, depth + 1, heightLimit, random),
                members.length);
    }

    private static double pathLength(Node node, double[] row) {
        int depth = 0;
        while (!node.isLeaf()) {
            node = row[node.feature] < node.split ? node.left : node.right;
            depth++;
        }
        return depth + averagePathLength(node.size);
    }

    /**
     * c(n) = 2H(n-1) - 2(n-1)/n, with c(2) = 1 and c(n) = 0 for n <= 1.
     */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        double harmonic = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonic - 2.0 * (n - 1.0) / n;
    }
}
