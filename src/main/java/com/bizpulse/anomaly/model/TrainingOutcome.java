package com.bizpulse.anomaly.model;

/**
 * Result of training a single detector strategy.
 */
public record TrainingOutcome(String strategy, boolean success, String message) {

    public static TrainingOutcome succeeded(String strategy, String message) {
        return new TrainingOutcome(strategy, true, message);
    }

    public static TrainingOutcome failed(String strategy, String message) {
        return new TrainingOutcome(strategy, false, message);
    }
}
