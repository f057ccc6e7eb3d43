package com.bizpulse.anomaly.engine.ensemble;

import java.util.List;

/**
 * Anomalous when the mean normalized score across strategies exceeds 0.5. Labels are ignored.
 */
public class AverageScoreVoting implements VotingPolicy {

    @Override
    public boolean isAnomalous(List<StrategyVote> votes) {
        if (votes.isEmpty()) {
            return false;
        }
        return votes.stream().mapToDouble(StrategyVote::normalizedScore).average().orElse(0.0) > 0.5;
    }
}
