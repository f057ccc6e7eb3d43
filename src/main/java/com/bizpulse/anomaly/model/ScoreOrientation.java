package com.bizpulse.anomaly.model;

/**
 * Direction in which a detector's raw score moves as a row becomes more anomalous.
 */
public enum ScoreOrientation {
    HIGHER_IS_ANOMALOUS,
    LOWER_IS_ANOMALOUS;

    /**
     * Flip a raw score so that larger always means more anomalous.
     */
    public double toAnomalyDirection(double rawScore) {
        return this == HIGHER_IS_ANOMALOUS ? rawScore : -rawScore;
    }
}
