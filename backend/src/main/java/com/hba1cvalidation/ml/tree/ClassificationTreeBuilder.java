package com.hba1cvalidation.ml.tree;

import java.util.Random;

/**
 * Grows a CART classification tree using Gini impurity, considering a random
 * subset of features at each split. Leaves hold normalized class distributions.
 */
public final class ClassificationTreeBuilder {

    private static final double MIN_GAIN = 1e-12;

    private final int numClasses;
    private final int maxDepth;
    private final int minSamplesLeaf;
    private final int featuresPerSplit;
    private final Random random;

    public ClassificationTreeBuilder(int numClasses, int maxDepth, int minSamplesLeaf,
                                     int featuresPerSplit, Random random) {
        this.numClasses = numClasses;
        this.maxDepth = maxDepth;
        this.minSamplesLeaf = Math.max(1, minSamplesLeaf);
        this.featuresPerSplit = featuresPerSplit;
        this.random = random;
    }

    /**
     * @param x       feature rows
     * @param y       class index per row
     * @param samples row indices to grow on; may contain repeats (bootstrap)
     */
    public TreeNode build(double[][] x, int[] y, int[] samples) {
        if (samples.length == 0) {
            throw new IllegalArgumentException("Cannot grow a tree on zero samples");
        }
        return grow(x, y, samples, 0);
    }

    private TreeNode grow(double[][] x, int[] y, int[] samples, int depth) {
        double[] counts = classCounts(y, samples);
        double parentImpurity = gini(counts, samples.length);
        if (depth >= maxDepth || samples.length < 2 * minSamplesLeaf || parentImpurity <= 0.0) {
            return TreeNode.leaf(distribution(counts, samples.length));
        }

        int bestFeature = -1;
        double bestThreshold = Double.NaN;
        double bestImpurity = parentImpurity - MIN_GAIN;
        int n = samples.length;

        for (int feature : sampleFeatures(x[0].length)) {
            int[] sorted = SampleSorter.byFeature(samples, x, feature);
            double[] left = new double[numClasses];
            double[] right = counts.clone();
            for (int i = 0; i < n - 1; i++) {
                int cls = y[sorted[i]];
                left[cls]++;
                right[cls]--;
                int nLeft = i + 1;
                int nRight = n - nLeft;
                double current = x[sorted[i]][feature];
                double next = x[sorted[i + 1]][feature];
                if (current == next || nLeft < minSamplesLeaf || nRight < minSamplesLeaf) {
                    continue;
                }
                double impurity = (nLeft * gini(left, nLeft) + nRight * gini(right, nRight)) / n;
                if (impurity < bestImpurity) {
                    bestImpurity = impurity;
                    bestFeature = feature;
                    bestThreshold = midpoint(current, next);
                }
            }
        }

        if (bestFeature < 0) {
            return TreeNode.leaf(distribution(counts, samples.length));
        }
        int[][] parts = SampleSorter.partition(samples, x, bestFeature, bestThreshold);
        return TreeNode.split(bestFeature, bestThreshold,
            grow(x, y, parts[0], depth + 1),
            grow(x, y, parts[1], depth + 1));
    }

    private int[] sampleFeatures(int width) {
        int[] features = new int[width];
        for (int i = 0; i < width; i++) {
            features[i] = i;
        }
        int k = Math.min(width, Math.max(1, featuresPerSplit));
        // partial Fisher-Yates
        for (int i = 0; i < k; i++) {
            int j = i + random.nextInt(width - i);
            int tmp = features[i];
            features[i] = features[j];
            features[j] = tmp;
        }
        int[] chosen = new int[k];
        System.arraycopy(features, 0, chosen, 0, k);
        return chosen;
    }

    private double[] classCounts(int[] y, int[] samples) {
        double[] counts = new double[numClasses];
        for (int s : samples) {
            counts[y[s]]++;
        }
        return counts;
    }

    private static double gini(double[] counts, int n) {
        double sumSquares = 0.0;
        for (double c : counts) {
            double p = c / n;
            sumSquares += p * p;
        }
        return 1.0 - sumSquares;
    }

    private static double[] distribution(double[] counts, int n) {
        double[] dist = new double[counts.length];
        for (int i = 0; i < counts.length; i++) {
            dist[i] = counts[i] / n;
        }
        return dist;
    }

    private static double midpoint(double current, double next) {
        double mid = current + (next - current) / 2.0;
        // rounding may land on next, which would empty the right child
        return mid < next ? mid : current;
    }
}
