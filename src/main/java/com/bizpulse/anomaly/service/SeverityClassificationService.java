package com.bizpulse.anomaly.service;

import com.bizpulse.anomaly.config.ScoringProperties;
import com.bizpulse.anomaly.model.AnomalyRecord;
import com.bizpulse.anomaly.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps a flagged row to a severity tier.
 *
 * severityScore = wScore * detection + wFreq * frequency + wImpact * impact, each input clamped
 * to [0,1] and the sum clamped to [0,1]. A record with any input missing scores 0.5.
 * Tiers: >= high is CRITICAL, >= medium HIGH, >= low MEDIUM, otherwise LOW.
 */
@Service
public class SeverityClassificationService {

    private static final Logger log = LoggerFactory.getLogger(SeverityClassificationService.class);

    static final double MISSING_INPUT_SCORE = 0.5;

    private final ScoringProperties.Thresholds thresholds;
    private final ScoringProperties.FeatureWeights weights;

    public SeverityClassificationService(ScoringProperties properties) {
        this.thresholds = properties.getThresholds();
        this.weights = properties.getFeatureWeights();
        validate();
    }

    private void validate() {
        double low = thresholds.getLow();
        double medium = thresholds.getMedium();
        double high = thresholds.getHigh();
        if (low < 0 || high > 1 || !(low < medium && medium < high)) {
            throw new IllegalArgumentException(String.format(
                    "Severity thresholds must be ascending within [0,1], got low=%s medium=%s high=%s",
                    low, medium, high));
        }
        if (weights.getScore() < 0 || weights.getFrequency() < 0 || weights.getImpact() < 0) {
            throw new IllegalArgumentException("Severity feature weights must be >= 0");
        }
    }

    public Severity classify(AnomalyRecord record) {
        return fromScore(severityScore(record));
    }

    public List<Severity> classifyAll(List<AnomalyRecord> records) {
        List<Severity> severities = new ArrayList<>(records.size());
        for (AnomalyRecord record : records) {
            severities.add(classify(record));
        }
        return severities;
    }

    public double severityScore(AnomalyRecord record) {
        if (record == null) {
            return MISSING_INPUT_SCORE;
        }
        Double detection = record.getDetectionScore();
        Double frequency = record.getFrequencyFactor();
        Double impact = record.getImpactFactor();
        if (isMissing(detection) || isMissing(frequency) || isMissing(impact)) {
            log.debug("Anomaly {} has missing scoring inputs, defaulting severity score to {}",
                    record.getAnomalyId(), MISSING_INPUT_SCORE);
            return MISSING_INPUT_SCORE;
        }
        double score = weights.getScore() * clamp(detection)
                + weights.getFrequency() * clamp(frequency)
                + weights.getImpact() * clamp(impact);
        return clamp(score);
    }

    public Severity fromScore(double score) {
        if (score >= thresholds.getHigh()) return Severity.CRITICAL;
        if (score >= thresholds.getMedium()) return Severity.HIGH;
        if (score >= thresholds.getLow()) return Severity.MEDIUM;
        return Severity.LOW;
    }

    public String describe(Severity severity) {
        return severity.getDescription();
    }

    private static boolean isMissing(Double value) {
        return value == null || value.isNaN();
    }

    static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
