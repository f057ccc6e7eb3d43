package com.bizpulse.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnsembleVerdict {
    private int rowIndex;
    private AnomalyLabel label;
    private double combinedScore;             // mean normalized score in [0,1], higher = more anomalous
    private int anomalousVotes;
    private int voters;
    private Map<String, Double> contributions; // strategy -> normalized score for this row

    /**
     * Share of voting strategies that flagged this row. Unlike {@code combinedScore} it does not
     * depend on the other rows of the batch.
     */
    public double voteShare() {
        return voters == 0 ? 0.0 : (double) anomalousVotes / voters;
    }

    public boolean isAnomalous() {
        return label != null && label.isAnomalous();
    }
}
