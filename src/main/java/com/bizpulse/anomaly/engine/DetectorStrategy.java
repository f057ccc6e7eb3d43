package com.bizpulse.anomaly.engine;

import com.bizpulse.anomaly.model.AnomalyLabel;
import com.bizpulse.anomaly.model.DetectionResult;
import com.bizpulse.anomaly.model.FeatureMatrix;
import com.bizpulse.anomaly.model.ScoreOrientation;
import com.bizpulse.anomaly.model.TrainingOutcome;

/**
 * Contract for all detection strategies the ensemble combines.
 *
 * <p>Implementations never throw from {@link #train}, {@link #predict} or {@link #anomalyScores}.
 * When a strategy is unavailable, untrained, or fails, it reports an unsuccessful
 * {@link TrainingOutcome} or returns an all-normal, zero-score result of the input's length.</p>
 *
 * <p>After {@link #train} returns, concurrent {@code predict}/{@code anomalyScores} calls are safe.
 * {@code train} itself is not meant to run concurrently with predictions; it swaps in a new
 * fitted state when done.</p>
 */
public interface DetectorStrategy {

    /**
     * Stable name used for weights, contributions and logging (e.g. "statistical").
     */
    String getName();

    /**
     * Whether this strategy can run at all in the current configuration.
     */
    boolean isAvailable();

    boolean isTrained();

    ScoreOrientation scoreOrientation();

    TrainingOutcome train(FeatureMatrix data);

    /**
     * Labels and raw scores in one pass.
     */
    DetectionResult detect(FeatureMatrix data);

    default AnomalyLabel[] predict(FeatureMatrix data) {
        return detect(data).getLabels();
    }

    default double[] anomalyScores(FeatureMatrix data) {
        return detect(data).getScores();
    }
}
