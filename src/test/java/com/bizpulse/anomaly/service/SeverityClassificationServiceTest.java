package com.bizpulse.anomaly.service;

import com.bizpulse.anomaly.config.ScoringProperties;
import com.bizpulse.anomaly.model.AnomalyRecord;
import com.bizpulse.anomaly.model.Severity;
import com.bizpulse.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SeverityClassificationServiceTest {

    private SeverityClassificationService service;

    @BeforeEach
    void setUp() {
        service = new SeverityClassificationService(new ScoringProperties());
    }

    @Test
    void highScoresAcrossTheBoard_areCritical() {
        AnomalyRecord record = TestDataFactory.createAnomalyRecord("A-1", 0.9, 0.9, 0.9);

        assertThat(service.severityScore(record)).isCloseTo(0.9, within(1e-9));
        assertThat(service.classify(record)).isEqualTo(Severity.CRITICAL);
    }

    @Test
    void thresholdBoundaries_mapToTiers() {
        assertThat(service.fromScore(0.0)).isEqualTo(Severity.LOW);
        assertThat(service.fromScore(0.29)).isEqualTo(Severity.LOW);
        assertThat(service.fromScore(0.3)).isEqualTo(Severity.MEDIUM);
        assertThat(service.fromScore(0.6)).isEqualTo(Severity.HIGH);
        assertThat(service.fromScore(0.8)).isEqualTo(Severity.CRITICAL);
        assertThat(service.fromScore(1.0)).isEqualTo(Severity.CRITICAL);
    }

    @Test
    void missingOrNaNInput_defaultsToMedium() {
        AnomalyRecord missing = TestDataFactory.createAnomalyRecord("A-1", 0.95, null, 0.9);
        AnomalyRecord nan = TestDataFactory.createAnomalyRecord("A-2", Double.NaN, 0.1, 0.1);

        assertThat(service.severityScore(missing)).isEqualTo(0.5);
        assertThat(service.classify(missing)).isEqualTo(Severity.MEDIUM);
        assertThat(service.classify(nan)).isEqualTo(Severity.MEDIUM);
    }

    @Test
    void inputsAreClampedBeforeWeighting() {
        AnomalyRecord record = TestDataFactory.createAnomalyRecord("A-1", 5.0, -1.0, 0.0);

        // 0.4 * 1 + 0.3 * 0 + 0.3 * 0
        assertThat(service.severityScore(record)).isCloseTo(0.4, within(1e-9));
    }

    @Test
    void increasingDetectionScore_neverLowersSeverity() {
        for (double frequency : new double[]{0.0, 0.3, 0.8}) {
            for (double impact : new double[]{0.0, 0.5, 1.0}) {
                Severity previous = Severity.LOW;
                for (int step = 0; step <= 20; step++) {
                    AnomalyRecord record = TestDataFactory.createAnomalyRecord("A", step / 20.0, frequency, impact);
                    Severity current = service.classify(record);
                    assertThat(current.isAtLeast(previous)).isTrue();
                    previous = current;
                }
            }
        }
    }

    @Test
    void classifyAll_preservesOrder() {
        List<Severity> severities = service.classifyAll(List.of(
                TestDataFactory.createAnomalyRecord("A-1", 0.0, 0.0, 0.0),
                TestDataFactory.createAnomalyRecord("A-2", 1.0, 1.0, 1.0)));

        assertThat(severities).containsExactly(Severity.LOW, Severity.CRITICAL);
    }

    @Test
    void describe_returnsSeverityDescription() {
        assertThat(service.describe(Severity.HIGH)).isEqualTo("High priority anomaly, significant impact");
    }

    @Test
    void nonAscendingThresholds_areRejected() {
        ScoringProperties properties = new ScoringProperties();
        properties.getThresholds().setMedium(0.9);

        assertThatThrownBy(() -> new SeverityClassificationService(properties))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void negativeWeight_isRejected() {
        ScoringProperties properties = new ScoringProperties();
        properties.getFeatureWeights().setImpact(-0.1);

        assertThatThrownBy(() -> new SeverityClassificationService(properties))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
