package com.bizpulse.anomaly.service;

import com.bizpulse.anomaly.config.AlertingProperties;
import com.bizpulse.anomaly.config.MetricsConfig;
import com.bizpulse.anomaly.config.ScoringProperties;
import com.bizpulse.anomaly.engine.DetectorStrategy;
import com.bizpulse.anomaly.engine.ensemble.EnsembleDetector;
import com.bizpulse.anomaly.model.AnomalyRecord;
import com.bizpulse.anomaly.model.DetectionReport;
import com.bizpulse.anomaly.model.FeatureMatrix;
import com.bizpulse.anomaly.model.Severity;
import com.bizpulse.anomaly.model.VotingMethod;
import com.bizpulse.anomaly.notification.AlertDispatcher;
import com.bizpulse.anomaly.repository.AlertHistoryRepository;
import com.bizpulse.anomaly.testutil.MutableClock;
import com.bizpulse.anomaly.testutil.StubStrategy;
import com.bizpulse.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static com.bizpulse.anomaly.testutil.TestDataFactory.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class AnomalyDetectionServiceTest {

    @Mock
    private MetricsConfig metricsConfig;

    private AlertHistoryRepository repository;
    private AnomalyDetectionService service;

    @BeforeEach
    void setUp() {
        service = serviceWith(List.of(
                new StubStrategy("boundary", true).flags(false, false, false, true),
                new StubStrategy("density", true).flags(false, false, false, true),
                new StubStrategy("statistical", true).flags(false, true, false, true),
                new StubStrategy("reconstruction", true).flags(false, false, false, false)));
    }

    private AnomalyDetectionService serviceWith(List<DetectorStrategy> strategies) {
        MutableClock clock = new MutableClock(T0);
        EnsembleDetector ensemble = new EnsembleDetector(strategies, TestDataFactory.detectionProperties(VotingMethod.MAJORITY, false));

        AlertingProperties alerting = TestDataFactory.alertingProperties();
        ScoringProperties scoring = new ScoringProperties();
        repository = new AlertHistoryRepository(alerting, metricsConfig);
        AlertDispatcher dispatcher = new AlertDispatcher(Runnable::run, alerting, metricsConfig);
        AlertGenerationService alertService = new AlertGenerationService(
                new FalsePositiveFilterService(alerting, metricsConfig, clock),
                repository, dispatcher, List.of(), metricsConfig, alerting, clock);

        return new AnomalyDetectionService(ensemble,
                new SeverityClassificationService(scoring),
                new ImpactAssessmentService(scoring),
                alertService, repository, metricsConfig, clock);
    }

    @Test
    void detect_runsFullPipelineForFlaggedRows() {
        FeatureMatrix batch = TestDataFactory.singleColumn("revenue", 10, 11, 12, 95);
        assertThat(service.train(batch)).isTrue();

        DetectionReport report = service.detect(batch);

        assertThat(report.getRowCount()).isEqualTo(4);
        assertThat(report.getVerdicts()).hasSize(4);
        assertThat(report.getAnomalies()).hasSize(1);

        AnomalyRecord anomaly = report.getAnomalies().get(0);
        assertThat(anomaly.getRowIndex()).isEqualTo(3);
        assertThat(anomaly.getFeatures()).containsEntry("revenue", 95.0);
        assertThat(anomaly.getFrequencyFactor()).isCloseTo(0.25, within(1e-9));
        assertThat(anomaly.getDetectionScore()).isCloseTo(0.75, within(1e-9));
        assertThat(anomaly.getImpactFactor()).isEqualTo(0.0);

        // 0.4 * 0.75 + 0.3 * 0.25 + 0.3 * 0
        assertThat(report.getSeverities()).containsExactly(Severity.MEDIUM);
        assertThat(report.getAlerts()).hasSize(1);
        assertThat(report.getAlerts().get(0).getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(repository.count()).isEqualTo(1);

        assertThat(report.getModelContributions())
                .containsEntry("statistical", 50.0)
                .containsEntry("boundary", 25.0)
                .containsEntry("density", 25.0)
                .containsEntry("reconstruction", 0.0);
        verify(metricsConfig).recordDetection(4, 1);
    }

    @Test
    void detect_usesContextColumnsWhenPresent() {
        FeatureMatrix batch = FeatureMatrix.of(List.of("revenue", "frequency_factor", "financial_impact"), new double[][]{
                {10, 0.1, 0.0},
                {11, 0.1, 0.0},
                {12, 0.1, 0.0},
                {95, 0.9, 1.0}
        });
        service.train(batch);

        DetectionReport report = service.detect(batch);

        AnomalyRecord anomaly = report.getAnomalies().get(0);
        assertThat(anomaly.getFrequencyFactor()).isEqualTo(0.9);
        assertThat(anomaly.getFinancialImpact()).isEqualTo(1.0);
        assertThat(report.getImpacts().get(0)).isCloseTo(0.4, within(1e-9));
        // 0.4 * 0.75 + 0.3 * 0.9 + 0.3 * 0.4 = 0.69
        assertThat(report.getSeverities()).containsExactly(Severity.HIGH);
    }

    @Test
    void detect_singleRowBatch_scoresLikeTheSameRowInLargerBatch() {
        AnomalyDetectionService threeOfFour = serviceWith(List.of(
                new StubStrategy("boundary", true).flags(true),
                new StubStrategy("density", true).flags(true),
                new StubStrategy("statistical", true).flags(true),
                new StubStrategy("reconstruction", true).flags(false)));
        threeOfFour.train(TestDataFactory.singleColumn("revenue", 10, 11, 12));

        DetectionReport alone = threeOfFour.detect(TestDataFactory.singleColumn("revenue", 95));
        DetectionReport withNeighbour = threeOfFour.detect(TestDataFactory.singleColumn("revenue", 95, 10));

        assertThat(alone.getAnomalies()).hasSize(1);
        assertThat(alone.getAnomalies().get(0).getDetectionScore()).isCloseTo(0.75, within(1e-9));
        assertThat(withNeighbour.getAnomalies()).hasSize(1);
        assertThat(withNeighbour.getAnomalies().get(0).getDetectionScore()).isCloseTo(0.75, within(1e-9));
    }

    @Test
    void detect_emptyBatch_returnsEmptyReport() {
        DetectionReport report = service.detect(FeatureMatrix.empty(List.of("revenue")));

        assertThat(report.getRowCount()).isZero();
        assertThat(report.getAnomalies()).isEmpty();
        assertThat(report.getModelContributions()).isEmpty();
        assertThat(report.getDetectedAt()).isEqualTo(T0);
    }

    @Test
    void detect_beforeTraining_flagsNothing() {
        DetectionReport report = service.detect(TestDataFactory.singleColumn("revenue", 10, 11, 12, 95));

        assertThat(report.getVerdicts()).hasSize(4).noneMatch(v -> v.isAnomalous());
        assertThat(report.getAlerts()).isEmpty();
    }

    @Test
    void systemStatus_reportsStrategiesAndAlertCounts() {
        FeatureMatrix batch = TestDataFactory.singleColumn("revenue", 10, 11, 12, 95);
        service.train(batch);
        service.detect(batch);

        Map<String, Object> status = service.getSystemStatus();

        assertThat(status).containsKeys("trained", "votingMethod", "activeStrategies", "strategies",
                "totalAlerts", "unhandledAlerts", "lastTrainedAt", "lastDetectionAt");
        assertThat(status.get("trained")).isEqualTo(true);
        assertThat(status.get("votingMethod")).isEqualTo(VotingMethod.MAJORITY);
        assertThat(status.get("activeStrategies"))
                .isEqualTo(List.of("boundary", "density", "statistical", "reconstruction"));
        assertThat(status.get("totalAlerts")).isEqualTo(1);
        assertThat(status.get("unhandledAlerts")).isEqualTo(1);
        assertThat(status.get("lastTrainedAt")).isEqualTo(T0);
    }

    @Test
    void train_recordsOutcomePerStrategy() {
        service.train(TestDataFactory.singleColumn("revenue", 1, 2, 3));

        verify(metricsConfig).recordTraining("boundary", true);
        verify(metricsConfig).recordTraining("reconstruction", true);
    }
}
