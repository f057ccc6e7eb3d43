package com.bizpulse.anomaly.engine.ensemble;

import java.util.List;

/**
 * Anomalous when more strategies vote anomalous than normal. Ties go to normal.
 */
public class MajorityVoting implements VotingPolicy {

    @Override
    public boolean isAnomalous(List<StrategyVote> votes) {
        long anomalous = votes.stream().filter(StrategyVote::anomalous).count();
        return anomalous > votes.size() - anomalous;
    }
}
