package com.hba1cvalidation.ml.tree;

/**
 * Grows a CART regression tree minimizing squared error over all features.
 */
public final class RegressionTreeBuilder {

    private static final double MIN_GAIN = 1e-12;

    private final int maxDepth;
    private final int minSamplesLeaf;

    public RegressionTreeBuilder(int maxDepth, int minSamplesLeaf) {
        this.maxDepth = maxDepth;
        this.minSamplesLeaf = Math.max(1, minSamplesLeaf);
    }

    public TreeNode build(double[][] x, double[] target, int[] samples) {
        if (samples.length == 0) {
            throw new IllegalArgumentException("Cannot grow a tree on zero samples");
        }
        return grow(x, target, samples, 0);
    }

    private TreeNode grow(double[][] x, double[] target, int[] samples, int depth) {
        int n = samples.length;
        double sum = 0.0;
        double sumSquares = 0.0;
        for (int s : samples) {
            sum += target[s];
            sumSquares += target[s] * target[s];
        }
        double mean = sum / n;
        double parentSse = sumSquares - sum * sum / n;
        if (depth >= maxDepth || n < 2 * minSamplesLeaf || parentSse <= MIN_GAIN) {
            return TreeNode.leaf(new double[] {mean});
        }

        int bestFeature = -1;
        double bestThreshold = Double.NaN;
        // maximizing sumL^2/nL + sumR^2/nR is minimizing the children's SSE
        double bestScore = sum * sum / n + MIN_GAIN;

        for (int feature = 0; feature < x[0].length; feature++) {
            int[] sorted = SampleSorter.byFeature(samples, x, feature);
            double leftSum = 0.0;
            for (int i = 0; i < n - 1; i++) {
                leftSum += target[sorted[i]];
                int nLeft = i + 1;
                int nRight = n - nLeft;
                double current = x[sorted[i]][feature];
                double next = x[sorted[i + 1]][feature];
                if (current == next || nLeft < minSamplesLeaf || nRight < minSamplesLeaf) {
                    continue;
                }
                double rightSum = sum - leftSum;
                double score = leftSum * leftSum / nLeft + rightSum * rightSum / nRight;
                if (score > bestScore) {
                    bestScore = score;
                    bestFeature = feature;
                    bestThreshold = midpoint(current, next);
                }
            }
        }

        if (bestFeature < 0) {
            return TreeNode.leaf(new double[] {mean});
        }
        int[][] parts = SampleSorter.partition(samples, x, bestFeature, bestThreshold);
        return TreeNode.split(bestFeature, bestThreshold,
            grow(x, target, parts[0], depth + 1),
            grow(x, target, parts[1], depth + 1));
    }

    private static double midpoint(double current, double next) {
        double mid = current + (next - current) / 2.0;
        // rounding may land on next, which would empty the right child
        return mid < next ? mid : current;
    }
}
