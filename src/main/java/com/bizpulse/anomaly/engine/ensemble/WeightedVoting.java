package com.bizpulse.anomaly.engine.ensemble;

import java.util.List;
import java.util.Map;

/**
 * Anomalous when the weight behind the anomalous votes is more than half of the total weight of
 * the strategies that voted. A strategy without a configured weight counts 1.0.
 */
public class WeightedVoting implements VotingPolicy {

    private static final double DEFAULT_WEIGHT = 1.0;

    private final Map<String, Double> weights;

    public WeightedVoting(Map<String, Double> weights) {
        this.weights = weights == null ? Map.of() : Map.copyOf(weights);
    }

    @Override
    public boolean isAnomalous(List<StrategyVote> votes) {
        double total = 0.0;
        double anomalous = 0.0;
        for (StrategyVote vote : votes) {
            double weight = weights.getOrDefault(vote.strategy(), DEFAULT_WEIGHT);
            total += weight;
            if (vote.anomalous()) {
                anomalous += weight;
            }
        }
        return total > 0 && anomalous / total > 0.5;
    }
}
