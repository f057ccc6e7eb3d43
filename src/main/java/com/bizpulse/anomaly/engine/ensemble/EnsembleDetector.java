package com.bizpulse.anomaly.engine.ensemble;

import com.bizpulse.anomaly.config.DetectionProperties;
import com.bizpulse.anomaly.engine.DetectorStrategy;
import com.bizpulse.anomaly.model.AnomalyLabel;
import com.bizpulse.anomaly.model.DetectionResult;
import com.bizpulse.anomaly.model.EnsembleVerdict;
import com.bizpulse.anomaly.model.FeatureMatrix;
import com.bizpulse.anomaly.model.TrainingOutcome;
import com.bizpulse.anomaly.model.VotingMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Trains every registered strategy and reconciles their per-row opinions into one verdict.
 *
 * <p>Ensemble training only counts as successful when every strategy trained. Whether a partially
 * trained ensemble still serves depends on {@code require-all-strategies}: when false it votes with
 * the strategies that did train, when true it returns all-normal verdicts until a full training
 * succeeds. With no trained strategy the result is always all-normal.</p>
 */
@Component
public class EnsembleDetector {

    private static final Logger log = LoggerFactory.getLogger(EnsembleDetector.class);

    private final List<DetectorStrategy> strategies;
    private final VotingMethod votingMethod;
    private final VotingPolicy votingPolicy;
    private final boolean requireAllStrategies;

    private volatile Map<String, TrainingOutcome> trainingOutcomes = Map.of();

    public EnsembleDetector(List<DetectorStrategy> strategies, DetectionProperties properties) {
        DetectionProperties.Ensemble config = properties.getEnsemble();
        Map<String, DetectorStrategy> byName = new LinkedHashMap<>();
        for (DetectorStrategy strategy : strategies) {
            if (byName.put(strategy.getName(), strategy) != null) {
                throw new IllegalArgumentException("Duplicate detector strategy name: " + strategy.getName());
            }
            log.info("Registered detector strategy: {} -> {}",
                    strategy.getName(), strategy.getClass().getSimpleName());
        }
        Map<String, Double> weights = config.getWeights() == null ? Map.of() : config.getWeights();
        weights.forEach((name, weight) -> {
            if (!byName.containsKey(name)) {
                throw new IllegalArgumentException("Weight configured for unknown strategy: " + name);
            }
            if (weight == null || weight < 0) {
                throw new IllegalArgumentException("Weight for strategy " + name + " must be >= 0, got: " + weight);
            }
        });

        this.strategies = List.copyOf(byName.values());
        this.votingMethod = config.getVotingMethod();
        this.votingPolicy = VotingPolicy.of(config.getVotingMethod(), weights);
        this.requireAllStrategies = config.isRequireAllStrategies();
    }

    /**
     * Train every strategy on the same data.
     *
     * @return true only if every strategy trained successfully
     */
    public boolean train(FeatureMatrix data) {
        Map<String, TrainingOutcome> outcomes = new LinkedHashMap<>();
        for (DetectorStrategy strategy : strategies) {
            TrainingOutcome outcome = strategy.train(data);
            outcomes.put(strategy.getName(), outcome);
            if (!outcome.success()) {
                log.warn("Strategy [{}] failed to train: {}", strategy.getName(), outcome.message());
            }
        }
        this.trainingOutcomes = Collections.unmodifiableMap(outcomes);

        boolean allSucceeded = !outcomes.isEmpty()
                && outcomes.values().stream().allMatch(TrainingOutcome::success);
        List<DetectorStrategy> active = activeStrategies();
        if (allSucceeded) {
            log.info("Ensemble trained: {} strategies, voting={}", outcomes.size(), votingMethod);
        } else if (active.isEmpty()) {
            log.warn("Ensemble training failed; detection will return neutral results");
        } else {
            log.warn("Ensemble partially trained; serving with {} of {} strategies",
                    active.size(), strategies.size());
        }
        return allSucceeded;
    }

    /**
     * True when the last training run succeeded for every strategy.
     */
    public boolean isTrained() {
        Map<String, TrainingOutcome> outcomes = trainingOutcomes;
        return !outcomes.isEmpty() && outcomes.values().stream().allMatch(TrainingOutcome::success);
    }

    public Map<String, TrainingOutcome> getTrainingOutcomes() {
        return trainingOutcomes;
    }

    public VotingMethod getVotingMethod() {
        return votingMethod;
    }

    public List<DetectorStrategy> getStrategies() {
        return strategies;
    }

    /**
     * Strategies that currently take part in voting.
     */
    public List<DetectorStrategy> activeStrategies() {
        if (requireAllStrategies && !isTrained()) {
            return List.of();
        }
        List<DetectorStrategy> active = new ArrayList<>();
        for (DetectorStrategy strategy : strategies) {
            if (strategy.isAvailable() && strategy.isTrained()) {
                active.add(strategy);
            }
        }
        return active;
    }

    public AnomalyLabel[] predict(FeatureMatrix data) {
        List<EnsembleVerdict> verdicts = verdicts(data);
        AnomalyLabel[] labels = new AnomalyLabel[verdicts.size()];
        for (int i = 0; i < labels.length; i++) {
            labels[i] = verdicts.get(i).getLabel();
        }
        return labels;
    }

    public List<EnsembleVerdict> verdicts(FeatureMatrix data) {
        return evaluate(data).verdicts();
    }

    /**
     * Share of all individual anomalous flags each active strategy raised, as a percentage with
     * two decimals. Independent of the voting method. Empty when nothing is trained.
     */
    public Map<String, Double> getModelContributions(FeatureMatrix data) {
        return evaluate(data).contributions();
    }

    /**
     * Run every active strategy once and derive both verdicts and contributions from the same
     * results.
     */
    public Evaluation evaluate(FeatureMatrix data) {
        int size = data == null ? 0 : data.size();
        List<DetectorStrategy> active = activeStrategies();
        if (active.isEmpty()) {
            log.warn("Ensemble has no trained strategies, returning neutral verdicts");
            return new Evaluation(neutralVerdicts(size), Map.of(), List.of());
        }

        List<DetectionResult> results = new ArrayList<>(active.size());
        List<double[]> normalized = new ArrayList<>(active.size());
        for (DetectorStrategy strategy : active) {
            DetectionResult result = strategy.detect(data);
            if (result.size() != size) {
                log.error("Strategy [{}] returned {} results for {} rows; ignoring it for this batch",
                        strategy.getName(), result.size(), size);
                result = DetectionResult.neutral(strategy.getName(), strategy.scoreOrientation(), size);
            }
            results.add(result);
            normalized.add(result.normalizedScores());
        }

        List<EnsembleVerdict> verdicts = new ArrayList<>(size);
        for (int row = 0; row < size; row++) {
            List<StrategyVote> votes = new ArrayList<>(results.size());
            Map<String, Double> perStrategy = new LinkedHashMap<>();
            double scoreSum = 0.0;
            int anomalousVotes = 0;
            for (int s = 0; s < results.size(); s++) {
                DetectionResult result = results.get(s);
                double score = normalized.get(s)[row];
                boolean anomalous = result.label(row).isAnomalous();
                votes.add(new StrategyVote(result.getStrategy(), anomalous, score));
                perStrategy.put(result.getStrategy(), score);
                scoreSum += score;
                if (anomalous) anomalousVotes++;
            }
            verdicts.add(EnsembleVerdict.builder()
                    .rowIndex(row)
                    .label(AnomalyLabel.of(votingPolicy.isAnomalous(votes)))
                    .combinedScore(scoreSum / results.size())
                    .anomalousVotes(anomalousVotes)
                    .voters(results.size())
                    .contributions(perStrategy)
                    .build());
        }
        return new Evaluation(verdicts, contributions(results), results);
    }

    private static Map<String, Double> contributions(List<DetectionResult> results) {
        long total = 0;
        for (DetectionResult result : results) {
            total += result.anomalyCount();
        }
        Map<String, Double> contributions = new LinkedHashMap<>();
        for (DetectionResult result : results) {
            double pct = total == 0 ? 0.0 : 100.0 * result.anomalyCount() / total;
            contributions.put(result.getStrategy(), Math.round(pct * 100.0) / 100.0);
        }
        return contributions;
    }

    private static List<EnsembleVerdict> neutralVerdicts(int size) {
        List<EnsembleVerdict> verdicts = new ArrayList<>(size);
        for (int row = 0; row < size; row++) {
            verdicts.add(EnsembleVerdict.builder()
                    .rowIndex(row)
                    .label(AnomalyLabel.NORMAL)
                    .combinedScore(0.0)
                    .anomalousVotes(0)
                    .voters(0)
                    .contributions(Map.of())
                    .build());
        }
        return verdicts;
    }

    /**
     * Verdicts, contributions and the raw per-strategy results of one pass.
     */
    public record Evaluation(List<EnsembleVerdict> verdicts,
                             Map<String, Double> contributions,
                             List<DetectionResult> strategyResults) {
    }
}
