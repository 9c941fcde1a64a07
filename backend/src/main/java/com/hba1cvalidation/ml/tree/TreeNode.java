package com.hba1cvalidation.ml.tree;

/**
 * Immutable binary decision tree node. Samples with {@code x[feature] <= threshold}
 * go left. Leaves carry either a class distribution or a single regression value.
 */
public final class TreeNode {

    private final int feature;
    private final double threshold;
    private final TreeNode left;
    private final TreeNode right;
    private final double[] value;

    private TreeNode(int feature, double threshold, TreeNode left, TreeNode right, double[] value) {
        this.feature = feature;
        this.threshold = threshold;
        this.left = left;
        this.right = right;
        this.value = value;
    }

    static TreeNode leaf(double[] value) {
        return new TreeNode(-1, Double.NaN, null, null, value.clone());
    }

    static TreeNode split(int feature, double threshold, TreeNode left, TreeNode right) {
        return new TreeNode(feature, threshold, left, right, null);
    }

    public boolean isLeaf() {
        return left == null;
    }

    /**
     * Adds the leaf value reached by {@code x} into {@code sums}.
     */
    public void accumulate(double[] x, double[] sums) {
        double[] leafValue = findLeaf(x).value;
        for (int i = 0; i < leafValue.length; i++) {
            sums[i] += leafValue[i];
        }
    }

    /**
     * Scalar prediction for regression trees.
     */
    public double predict(double[] x) {
        return findLeaf(x).value[0];
    }

    public int depth() {
        return isLeaf() ? 0 : 1 + Math.max(left.depth(), right.depth());
    }

    public int leafCount() {
        return isLeaf() ? 1 : left.leafCount() + right.leafCount();
    }

    private TreeNode findLeaf(double[] x) {
        TreeNode node = this;
        while (!node.isLeaf()) {
            node = x[node.feature] <= node.threshold ? node.left : node.right;
        }
        return node;
    }
}
