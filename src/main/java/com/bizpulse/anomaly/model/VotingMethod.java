package com.bizpulse.anomaly.model;

/**
 * How the ensemble reconciles the per-strategy verdicts into one label.
 */
public enum VotingMethod {
    /** Anomalous when more strategies vote anomalous than normal. Ties resolve to normal. */
    MAJORITY,
    /** Anomalous when the weighted share of anomalous votes exceeds 0.5. */
    WEIGHTED,
    /** Anomalous when the mean of the normalized, orientation-corrected scores exceeds 0.5. */
    AVERAGE
}
