package com.bizpulse.anomaly.model;

import java.util.Arrays;

/**
 * Labels and raw scores one strategy produced for a matrix. Never persisted: it lives only
 * until the ensemble has combined it.
 */
public final class DetectionResult {

    private final String strategy;
    private final ScoreOrientation orientation;
    private final boolean available;
    private final AnomalyLabel[] labels;
    private final double[] scores;

    public DetectionResult(String strategy, ScoreOrientation orientation, boolean available,
                           AnomalyLabel[] labels, double[] scores) {
        if (labels.length != scores.length) {
            throw new IllegalArgumentException("labels and scores differ in length: "
                    + labels.length + " vs " + scores.length);
        }
        this.strategy = strategy;
        this.orientation = orientation;
        this.available = available;
        this.labels = labels;
        this.scores = scores;
    }

    /**
     * All-normal result with zero scores, used whenever a strategy cannot produce a real answer.
     */
    public static DetectionResult neutral(String strategy, ScoreOrientation orientation, int size) {
        return new DetectionResult(strategy, orientation, false, neutralLabels(size), new double[size]);
    }

    public static AnomalyLabel[] neutralLabels(int size) {
        AnomalyLabel[] labels = new AnomalyLabel[size];
        Arrays.fill(labels, AnomalyLabel.NORMAL);
        return labels;
    }

    public String getStrategy() {
        return strategy;
    }

    public ScoreOrientation getOrientation() {
        return orientation;
    }

    public boolean isAvailable() {
        return available;
    }

    public int size() {
        return labels.length;
    }

    public AnomalyLabel label(int row) {
        return labels[row];
    }

    public double score(int row) {
        return scores[row];
    }

    public AnomalyLabel[] getLabels() {
        return Arrays.copyOf(labels, labels.length);
    }

    public double[] getScores() {
        return Arrays.copyOf(scores, scores.length);
    }

    public long anomalyCount() {
        return Arrays.stream(labels).filter(AnomalyLabel::isAnomalous).count();
    }

    /**
     * Scores min-max normalized to [0, 1] with the orientation corrected, so that 1 is the
     * most anomalous row of this batch. A constant score column normalizes to all zeros.
     */
    public double[] normalizedScores() {
        double[] oriented = new double[scores.length];
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < scores.length; i++) {
            double s = Double.isFinite(scores[i]) ? orientation.toAnomalyDirection(scores[i]) : 0.0;
            oriented[i] = s;
            min = Math.min(min, s);
            max = Math.max(max, s);
        }
        double[] normalized = new double[scores.length];
        if (scores.length == 0 || max <= min) {
            return normalized;
        }
        for (int i = 0; i < oriented.length; i++) {
            normalized[i] = (oriented[i] - min) / (max - min);
        }
        return normalized;
    }
}
