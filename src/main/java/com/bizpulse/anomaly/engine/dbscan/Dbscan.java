package com.bizpulse.anomaly.engine.dbscan;

import org.apache.commons.math3.ml.distance.DistanceMeasure;
import org.apache.commons.math3.ml.distance.EuclideanDistance;

import java.util.ArrayList;
import java.util.List;

/**
 * Density model: the core points of a DBSCAN pass over the training data. A point is core when at
 * least {@code minSamples} training points (itself included) lie within {@code eps}. New points
 * are judged by their distance to the nearest core point.
 */
public final class Dbscan {

    private static final DistanceMeasure DISTANCE = new EuclideanDistance();

    private final double[][] corePoints;

    private Dbscan(double[][] corePoints) {
        this.corePoints = corePoints;
    }

    public static Dbscan fit(double[][] data, double eps, int minSamples) {
        if (eps <= 0) {
            throw new IllegalArgumentException("eps must be > 0, got: " + eps);
        }
        if (minSamples < 1) {
            throw new IllegalArgumentException("minSamples must be >= 1, got: " + minSamples);
        }
        int[] neighbours = new int[data.length];
        for (int i = 0; i < data.length; i++) {
            neighbours[i]++;
            for (int j = i + 1; j < data.length; j++) {
                if (DISTANCE.compute(data[i], data[j]) <= eps) {
                    neighbours[i]++;
                    neighbours[j]++;
                }
            }
        }
        List<double[]> cores = new ArrayList<>();
        for (int i = 0; i < data.length; i++) {
            if (neighbours[i] >= minSamples) {
                cores.add(data[i].clone());
            }
        }
        return new Dbscan(cores.toArray(new double[0][]));
    }

    /**
     * Distance to the nearest core point, or {@code +Infinity} when there are none.
     */
    public double nearestCoreDistance(double[] point) {
        double best = Double.POSITIVE_INFINITY;
        for (double[] core : corePoints) {
            best = Math.min(best, DISTANCE.compute(core, point));
        }
        return best;
    }

    public int getCoreCount() {
        return corePoints.length;
    }
}
