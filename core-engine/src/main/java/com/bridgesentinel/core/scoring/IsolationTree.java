package com.bridgesentinel.core.scoring;

import org.apache.commons.math3.random.RandomGenerator;

/**
 * One isolation tree grown on a row subsample.
 *
 * <p>
 * Each internal node splits a randomly chosen non-constant feature at a
 * uniformly drawn value between that feature's minimum and maximum within the
 * node. Growth stops at the height limit, at a single row, or when every
 * feature in the node is constant.
 * </p>
 */
final class IsolationTree {

    private static final double EULER_GAMMA = 0.5772156649015329;

    private final Node root;

    private IsolationTree(Node root) {
        this.root = root;
    }

    /**
     * @param data        standardized training matrix
     * @param sample      row indices of this tree's subsample; reordered in place
     * @param heightLimit maximum depth
     * @param rng         random source shared across the forest
     */
    static IsolationTree grow(double[][] data, int[] sample, int heightLimit, RandomGenerator rng) {
        return new IsolationTree(grow(data, sample, 0, sample.length, 0, heightLimit, rng));
    }

    /**
     * Path length of {@code x}: the depth of the leaf it lands in plus the
     * expected remaining depth for the rows left in that leaf.
     */
    double pathLength(double[] x) {
        Node node = root;
        int depth = 0;
        while (node instanceof Split split) {
            node = x[split.feature] < split.value ? split.left : split.right;
            depth++;
        }
        return depth + averagePathLength(((Leaf) node).size);
    }

    /**
     * Average path length of an unsuccessful search in a binary search tree of
     * {@code n} nodes; normalises path lengths across sample sizes.
     */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        return 2.0 * (Math.log(n - 1.0) + EULER_GAMMA) - 2.0 * (n - 1.0) / n;
    }

    // ---------------------------------------------------------------
    // Growth
    // ---------------------------------------------------------------

    private static Node grow(double[][] data, int[] idx, int from, int to,
            int depth, int heightLimit, RandomGenerator rng) {
        int size = to - from;
        if (depth >= heightLimit || size <= 1) {
            return new Leaf(size);
        }

        int width = data[idx[from]].length;
        double[] min = new double[width];
        double[] max = new double[width];
        for (int j = 0; j < width; j++) {
            min[j] = Double.POSITIVE_INFINITY;
            max[j] = Double.NEGATIVE_INFINITY;
        }
        for (int i = from; i < to; i++) {
            double[] row = data[idx[i]];
            for (int j = 0; j < width; j++) {
                min[j] = Math.min(min[j], row[j]);
                max[j] = Math.max(max[j], row[j]);
            }
        }

        int[] candidates = new int[width];
        int count = 0;
        for (int j = 0; j < width; j++) {
            if (max[j] > min[j]) {
                candidates[count++] = j;
            }
        }
        if (count == 0) {
            return new Leaf(size);
        }

        int feature = candidates[rng.nextInt(count)];
        double value = min[feature] + rng.nextDouble() * (max[feature] - min[feature]);

        int mid = from;
        for (int i = from; i < to; i++) {
            if (data[idx[i]][feature] < value) {
                int tmp = idx[i];
                idx[i] = idx[mid];
                idx[mid] = tmp;
                mid++;
            }
        }
        if (mid == from || mid == to) {
            return new Leaf(size);
        }

        return new Split(feature, value,
                grow(data, idx, from, mid, depth + 1, heightLimit, rng),
                grow(data, idx, mid, to, depth + 1, heightLimit, rng));
    }

    // ---------------------------------------------------------------
    // Nodes
    // ---------------------------------------------------------------

    private abstract static class Node {
    }

    private static final class Leaf extends Node {
        private final int size;

        private Leaf(int size) {
            this.size = size;
        }
    }

    private static final class Split extends Node {
        private final int feature;
        private final double value;
        private final Node left;
        private final Node right;

        private Split(int feature, double value, Node left, Node right) {
            this.feature = feature;
            this.value = value;
            this.left = left;
            this.right = right;
        }
    }
}
