package com.bizpulse.anomaly.engine.ensemble;

/**
 * One strategy's opinion on one row.
 *
 * @param normalizedScore orientation-corrected score in [0, 1], higher = more anomalous
 */
public record StrategyVote(String strategy, boolean anomalous, double normalizedScore) {
}
