package com.bizpulse.anomaly.service;

import com.bizpulse.anomaly.config.MetricsConfig;
import com.bizpulse.anomaly.engine.DetectorStrategy;
import com.bizpulse.anomaly.engine.ensemble.EnsembleDetector;
import com.bizpulse.anomaly.model.Alert;
import com.bizpulse.anomaly.model.AnomalyRecord;
import com.bizpulse.anomaly.model.DetectionReport;
import com.bizpulse.anomaly.model.DetectionResult;
import com.bizpulse.anomaly.model.EnsembleVerdict;
import com.bizpulse.anomaly.model.FeatureMatrix;
import com.bizpulse.anomaly.model.Severity;
import com.bizpulse.anomaly.model.TrainingOutcome;
import com.bizpulse.anomaly.repository.AlertHistoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the full pipeline for a batch: ensemble verdicts, anomaly records for flagged rows,
 * impact and severity scoring, then alert generation.
 *
 * Context columns are optional. When the batch carries a {@code frequency_factor} column it is
 * used as is, otherwise the factor is the share of the batch that was flagged. Columns named
 * {@code financial_impact}, {@code operational_impact}, {@code reputational_impact} and
 * {@code regulatory_impact} feed the impact assessment. The detection score of an anomaly is the
 * share of strategies that flagged it, so a row scores the same alone or inside a larger batch.
 */
@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    static final String FREQUENCY_FACTOR = "frequency_factor";
    static final String FINANCIAL_IMPACT = "financial_impact";
    static final String OPERATIONAL_IMPACT = "operational_impact";
    static final String REPUTATIONAL_IMPACT = "reputational_impact";
    static final String REGULATORY_IMPACT = "regulatory_impact";

    private final EnsembleDetector ensemble;
    private final SeverityClassificationService severityService;
    private final ImpactAssessmentService impactService;
    private final AlertGenerationService alertService;
    private final AlertHistoryRepository historyRepository;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    private volatile Instant lastTrainedAt;
    private volatile Instant lastDetectionAt;

    public AnomalyDetectionService(EnsembleDetector ensemble,
                                   SeverityClassificationService severityService,
                                   ImpactAssessmentService impactService,
                                   AlertGenerationService alertService,
                                   AlertHistoryRepository historyRepository,
                                   MetricsConfig metricsConfig,
                                   Clock clock) {
        this.ensemble = ensemble;
        this.severityService = severityService;
        this.impactService = impactService;
        this.alertService = alertService;
        this.historyRepository = historyRepository;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Train every strategy on the batch.
     *
     * @return true only if every strategy trained
     */
    public boolean train(FeatureMatrix data) {
        log.info("Training ensemble on {} rows", data == null ? 0 : data.size());
        boolean success = ensemble.train(data);
        for (TrainingOutcome outcome : ensemble.getTrainingOutcomes().values()) {
            metricsConfig.recordTraining(outcome.strategy(), outcome.success());
        }
        lastTrainedAt = clock.instant();
        return success;
    }

    public DetectionReport detect(FeatureMatrix data) {
        Instant now = clock.instant();
        lastDetectionAt = now;
        if (data == null || data.isEmpty()) {
            return DetectionReport.empty(now);
        }

        EnsembleDetector.Evaluation evaluation = ensemble.evaluate(data);
        List<EnsembleVerdict> verdicts = evaluation.verdicts();
        for (DetectionResult result : evaluation.strategyResults()) {
            metricsConfig.recordStrategyFlags(result.getStrategy(), result.anomalyCount());
        }

        long flagged = verdicts.stream().filter(EnsembleVerdict::isAnomalous).count();
        double batchFrequency = (double) flagged / data.size();

        List<AnomalyRecord> anomalies = new ArrayList<>();
        List<Double> impacts = new ArrayList<>();
        for (EnsembleVerdict verdict : verdicts) {
            if (!verdict.isAnomalous()) continue;
            AnomalyRecord record = buildRecord(data, verdict, batchFrequency, now);
            double impact = impactService.assess(record);
            record.setImpactFactor(impact);
            anomalies.add(record);
            impacts.add(impact);
        }

        List<Severity> severities = new ArrayList<>(anomalies.size());
        for (AnomalyRecord record : anomalies) {
            double score = severityService.severityScore(record);
            Severity severity = severityService.fromScore(score);
            metricsConfig.recordSeverityScore(severity.name(), score);
            severities.add(severity);
        }

        List<Alert> alerts = alertService.generateBatchAlerts(anomalies, severities);
        metricsConfig.recordDetection(data.size(), anomalies.size());
        log.info("Detection on {} rows: {} anomalies, {} alerts",
                data.size(), anomalies.size(), alerts.stream().filter(a -> a != null).count());

        return DetectionReport.builder()
                .rowCount(data.size())
                .verdicts(verdicts)
                .anomalies(anomalies)
                .severities(severities)
                .impacts(impacts)
                .alerts(alerts)
                .modelContributions(evaluation.contributions())
                .detectedAt(now)
                .build();
    }

    private static AnomalyRecord buildRecord(FeatureMatrix data, EnsembleVerdict verdict,
                                             double batchFrequency, Instant now) {
        int row = verdict.getRowIndex();
        Map<String, Double> features = data.rowAsMap(row);
        Double frequency = features.get(FREQUENCY_FACTOR);
        Instant observedAt = data.timestamp(row);
        return AnomalyRecord.builder()
                .anomalyId(data.rowId(row))
                .rowIndex(row)
                .timestamp(observedAt != null ? observedAt : now)
                .features(features)
                .detectionScore(verdict.voteShare())
                .frequencyFactor(frequency != null ? frequency : batchFrequency)
                .financialImpact(features.get(FINANCIAL_IMPACT))
                .operationalImpact(features.get(OPERATIONAL_IMPACT))
                .reputationalImpact(features.get(REPUTATIONAL_IMPACT))
                .regulatoryImpact(features.get(REGULATORY_IMPACT))
                .build();
    }

    public Map<String, Object> getSystemStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("trained", ensemble.isTrained());
        status.put("votingMethod", ensemble.getVotingMethod());
        status.put("activeStrategies", ensemble.activeStrategies().stream().map(DetectorStrategy::getName).toList());

        Map<String, Object> strategies = new LinkedHashMap<>();
        for (DetectorStrategy strategy : ensemble.getStrategies()) {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("available", strategy.isAvailable());
            info.put("trained", strategy.isTrained());
            TrainingOutcome outcome = ensemble.getTrainingOutcomes().get(strategy.getName());
            if (outcome != null) {
                info.put("lastTraining", outcome.message());
            }
            strategies.put(strategy.getName(), info);
        }
        status.put("strategies", strategies);
        status.put("totalAlerts", historyRepository.count());
        status.put("unhandledAlerts", historyRepository.countUnhandled());
        status.put("lastTrainedAt", lastTrainedAt);
        status.put("lastDetectionAt", lastDetectionAt);
        return status;
    }
}
