package com.bizpulse.anomaly.engine.isolationforest;

import java.util.Arrays;
import java.util.Random;

/**
 * One isolation tree stored as parallel arrays indexed by node id. Node 0 is the root; a node
 * with {@code feature[i] == -1} is a leaf and {@code leafSize[i]} holds how many training rows
 * reached it.
 */
public final class IsolationTree {

    private static final double EULER_GAMMA = 0.5772156649;
    private static final int LEAF = -1;

    private final int[] feature;
    private final double[] threshold;
    private final int[] left;
    private final int[] right;
    private final int[] leafSize;

    private IsolationTree(Builder builder) {
        this.feature = Arrays.copyOf(builder.feature, builder.count);
        this.threshold = Arrays.copyOf(builder.threshold, builder.count);
        this.left = Arrays.copyOf(builder.left, builder.count);
        this.right = Arrays.copyOf(builder.right, builder.count);
        this.leafSize = Arrays.copyOf(builder.leafSize, builder.count);
    }

    public static IsolationTree build(double[][] data, int maxDepth, Random random) {
        int[] rows = new int[data.length];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = i;
        }
        Builder builder = new Builder(Math.max(1, 2 * data.length - 1));
        builder.grow(data, rows, 0, rows.length, 0, maxDepth, random);
        return new IsolationTree(builder);
    }

    /**
     * Depth at which {@code point} lands in a leaf, plus the expected remaining depth for the
     * rows that shared that leaf during training.
     */
    public double pathLength(double[] point) {
        int node = 0;
        int depth = 0;
        while (feature[node] != LEAF) {
            node = point[feature[node]] < threshold[node] ? left[node] : right[node];
            depth++;
        }
        return depth + averagePathLength(leafSize[node]);
    }

    public int nodeCount() {
        return feature.length;
    }

    /**
     * Average path length of an unsuccessful BST search over {@code n} points:
     * c(n) = 2H(n-1) - 2(n-1)/n, with H(i) approximated by ln(i) + Euler's constant.
     */
    public static double averagePathLength(int n) {
        if (n <= 1) return 0;
        if (n == 2) return 1;
        double harmonicNumber = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonicNumber - (2.0 * (n - 1.0) / n);
    }

    private static final class Builder {
        private int[] feature;
        private double[] threshold;
        private int[] left;
        private int[] right;
        private int[] leafSize;
        private int count;

        Builder(int capacity) {
            feature = new int[capacity];
            threshold = new double[capacity];
            left = new int[capacity];
            right = new int[capacity];
            leafSize = new int[capacity];
        }

        private int allocate() {
            if (count == feature.length) {
                int capacity = feature.length * 2;
                feature = Arrays.copyOf(feature, capacity);
                threshold = Arrays.copyOf(threshold, capacity);
                left = Arrays.copyOf(left, capacity);
                right = Arrays.copyOf(right, capacity);
                leafSize = Arrays.copyOf(leafSize, capacity);
            }
            return count++;
        }

        private int leaf(int size) {
            int node = allocate();
            feature[node] = LEAF;
            leafSize[node] = size;
            return node;
        }

        /**
         * Grow the subtree over {@code rows[from, to)}, partitioning that slice in place.
         */
        int grow(double[][] data, int[] rows, int from, int to, int depth, int maxDepth, Random random) {
            int n = to - from;
            if (depth >= maxDepth || n <= 1) {
                return leaf(n);
            }

            int f = random.nextInt(data[rows[from]].length);
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (int i = from; i < to; i++) {
                double v = data[rows[i]][f];
                min = Math.min(min, v);
                max = Math.max(max, v);
            }
            // Constant feature on this partition: nothing left to isolate
            if (min >= max) {
                return leaf(n);
            }
            double split = min + random.nextDouble() * (max - min);

            int mid = from;
            for (int i = from; i < to; i++) {
                if (data[rows[i]][f] < split) {
                    int tmp = rows[mid];
                    rows[mid] = rows[i];
                    rows[i] = tmp;
                    mid++;
                }
            }

            int node = allocate();
            feature[node] = f;
            threshold[node] = split;
            int l = grow(data, rows, from, mid, depth + 1, maxDepth, random);
            int r = grow(data, rows, mid, to, depth + 1, maxDepth, random);
            left[node] = l;
            right[node] = r;
            return node;
        }
    }
}
