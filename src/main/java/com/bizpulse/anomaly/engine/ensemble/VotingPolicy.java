package com.bizpulse.anomaly.engine.ensemble;

import com.bizpulse.anomaly.model.VotingMethod;

import java.util.List;
import java.util.Map;

/**
 * Combines the votes of the strategies that took part into one label for a row.
 */
public interface VotingPolicy {

    boolean isAnomalous(List<StrategyVote> votes);

    static VotingPolicy of(VotingMethod method, Map<String, Double> weights) {
        return switch (method) {
            case MAJORITY -> new MajorityVoting();
            case WEIGHTED -> new WeightedVoting(weights);
            case AVERAGE -> new AverageScoreVoting();
        };
    }
}
