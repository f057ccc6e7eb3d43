package com.bizpulse.anomaly.engine.isolationforest;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Isolation forest over dense feature vectors. Built once by {@link #train} and read-only after.
 */
public final class IsolationForest {

    private final List<IsolationTree> trees;
    private final int sampleSize;

    private IsolationForest(List<IsolationTree> trees, int sampleSize) {
        this.trees = trees;
        this.sampleSize = sampleSize;
    }

    /**
     * Train an isolation forest.
     *
     * @param data       training samples, each row is a feature vector
     * @param numTrees   number of trees in the forest
     * @param sampleSize sub-sampling size per tree
     * @param seed       random seed for reproducibility
     */
    public static IsolationForest train(double[][] data, int numTrees, int sampleSize, long seed) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot train an isolation forest on no data");
        }
        if (numTrees <= 0 || sampleSize <= 0) {
            throw new IllegalArgumentException("numTrees and sampleSize must be > 0");
        }
        int effectiveSample = Math.min(sampleSize, data.length);
        int maxDepth = (int) Math.ceil(Math.log(Math.max(effectiveSample, 2)) / Math.log(2));

        Random random = new Random(seed);
        List<IsolationTree> trees = new ArrayList<>(numTrees);
        for (int i = 0; i < numTrees; i++) {
            double[][] sample = subsample(data, effectiveSample, random);
            trees.add(IsolationTree.build(sample, maxDepth, random));
        }
        return new IsolationForest(Collections.unmodifiableList(trees), effectiveSample);
    }

    /**
     * Anomaly score s(x) = 2^(-E(h(x)) / c(n)) in (0, 1]. Values near 1 are anomalous,
     * values well below 0.5 are normal.
     */
    public double anomalyScore(double[] point) {
        if (trees.isEmpty()) return 0.0;

        double avgPathLength = 0.0;
        for (IsolationTree tree : trees) {
            avgPathLength += tree.pathLength(point);
        }
        avgPathLength /= trees.size();

        double c = IsolationTree.averagePathLength(sampleSize);
        if (c <= 0) return 0.0;

        return Math.pow(2.0, -avgPathLength / c);
    }

    public int getTreeCount() {
        return trees.size();
    }

    public int getSampleSize() {
        return sampleSize;
    }

    private static double[][] subsample(double[][] data, int size, Random random) {
        if (data.length <= size) {
            return Arrays.copyOf(data, data.length);
        }
        double[][] sample = new double[size][];
        // Partial Fisher-Yates shuffle on indices
        int[] indices = new int[data.length];
        for (int i = 0; i < data.length; i++) indices[i] = i;
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(data.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            sample[i] = data[indices[i]];
        }
        return sample;
    }
}
