package com.bizpulse.anomaly.engine.detectors;

import com.bizpulse.anomaly.model.AnomalyLabel;
import com.bizpulse.anomaly.model.DetectionResult;
import com.bizpulse.anomaly.model.FeatureMatrix;
import com.bizpulse.anomaly.model.StatisticalMethod;
import com.bizpulse.anomaly.model.TrainingOutcome;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.bizpulse.anomaly.testutil.TestDataFactory.singleColumn;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class StatisticalDetectorTest {

    private static final FeatureMatrix SKEWED = singleColumn("x", 10, 10, 10, 10, 100);

    @Test
    void zscore_outlierBelowDefaultThreshold_isNotFlagged() {
        // mean 28, population std 36: z(100) = 2.0
        StatisticalDetector detector = new StatisticalDetector(StatisticalMethod.ZSCORE, 3.0, true);
        detector.train(SKEWED);

        AnomalyLabel[] labels = detector.predict(singleColumn("x", 10, 100));

        assertThat(labels).containsExactly(AnomalyLabel.NORMAL, AnomalyLabel.NORMAL);
    }

    @Test
    void zscore_lowerThreshold_flagsOnlyTheOutlier() {
        StatisticalDetector detector = new StatisticalDetector(StatisticalMethod.ZSCORE, 1.5, true);
        detector.train(SKEWED);

        DetectionResult result = detector.detect(singleColumn("x", 10, 100));

        assertThat(result.label(0)).isEqualTo(AnomalyLabel.NORMAL);
        assertThat(result.label(1)).isEqualTo(AnomalyLabel.ANOMALOUS);
        assertThat(result.score(0)).isCloseTo(0.5, within(1e-6));
        assertThat(result.score(1)).isCloseTo(2.0, within(1e-6));
    }

    @Test
    void iqr_flagsValuesOutsideTukeyFences() {
        // Q1 = 3.25, Q3 = 7.75, fences [-3.5, 14.5]
        StatisticalDetector detector = new StatisticalDetector(StatisticalMethod.IQR, 3.0, true);
        detector.train(singleColumn("x", 1, 2, 3, 4, 5, 6, 7, 8, 9, 10));

        AnomalyLabel[] labels = detector.predict(singleColumn("x", 5, 14, 15, -4));

        assertThat(labels).containsExactly(
                AnomalyLabel.NORMAL, AnomalyLabel.NORMAL, AnomalyLabel.ANOMALOUS, AnomalyLabel.ANOMALOUS);
    }

    @Test
    void percentile_flagsBothTails() {
        double[] values = new double[100];
        for (int i = 0; i < 100; i++) values[i] = i + 1;
        StatisticalDetector detector = new StatisticalDetector(StatisticalMethod.PERCENTILE, 5.0, true);
        detector.train(singleColumn("x", values));

        AnomalyLabel[] labels = detector.predict(singleColumn("x", 50, 99, 1));

        assertThat(labels).containsExactly(AnomalyLabel.NORMAL, AnomalyLabel.ANOMALOUS, AnomalyLabel.ANOMALOUS);
    }

    @Test
    void percentile_thresholdAboveFiftyIsFoldedIntoLowerTail() {
        double[] values = new double[100];
        for (int i = 0; i < 100; i++) values[i] = i + 1;
        StatisticalDetector low = new StatisticalDetector(StatisticalMethod.PERCENTILE, 5.0, true);
        StatisticalDetector high = new StatisticalDetector(StatisticalMethod.PERCENTILE, 95.0, true);
        low.train(singleColumn("x", values));
        high.train(singleColumn("x", values));

        FeatureMatrix probe = singleColumn("x", 3, 50, 97);
        assertThat(high.predict(probe)).containsExactly(low.predict(probe));
    }

    @Test
    void anyFeatureTriggers_rowIsAnomalous() {
        FeatureMatrix training = FeatureMatrix.of(List.of("a", "b"), new double[][]{
                {1, 100}, {2, 101}, {3, 99}, {2, 100}, {1, 100}, {3, 101}
        });
        StatisticalDetector detector = new StatisticalDetector(StatisticalMethod.ZSCORE, 3.0, true);
        detector.train(training);

        AnomalyLabel[] labels = detector.predict(FeatureMatrix.of(List.of("a", "b"), new double[][]{
                {2, 100}, {2, 150}
        }));

        assertThat(labels).containsExactly(AnomalyLabel.NORMAL, AnomalyLabel.ANOMALOUS);
    }

    @Test
    void missingValue_isImputedWithTrainingMean() {
        StatisticalDetector detector = new StatisticalDetector(StatisticalMethod.ZSCORE, 1.5, true);
        detector.train(SKEWED);

        DetectionResult result = detector.detect(singleColumn("x", Double.NaN));

        assertThat(result.label(0)).isEqualTo(AnomalyLabel.NORMAL);
        assertThat(result.score(0)).isCloseTo(0.0, within(1e-6));
    }

    @Test
    void predict_resultLengthMatchesInput() {
        StatisticalDetector detector = new StatisticalDetector(StatisticalMethod.IQR, 3.0, true);
        detector.train(SKEWED);

        FeatureMatrix batch = singleColumn("x", 1, 2, 3, 4, 5, 6, 700);
        assertThat(detector.predict(batch)).hasSize(7);
        assertThat(detector.anomalyScores(batch)).hasSize(7);
    }

    @Test
    void untrained_returnsNeutralResultOfSameLength() {
        StatisticalDetector detector = new StatisticalDetector(StatisticalMethod.ZSCORE, 3.0, true);

        DetectionResult result = detector.detect(singleColumn("x", 1, 2, 3));

        assertThat(result.isAvailable()).isFalse();
        assertThat(result.getLabels()).containsOnly(AnomalyLabel.NORMAL).hasSize(3);
        assertThat(result.getScores()).containsOnly(0.0);
    }

    @Test
    void schemaMismatch_returnsNeutralResult() {
        StatisticalDetector detector = new StatisticalDetector(StatisticalMethod.ZSCORE, 1.5, true);
        detector.train(SKEWED);

        DetectionResult result = detector.detect(singleColumn("y", 1000));

        assertThat(result.isAvailable()).isFalse();
        assertThat(result.label(0)).isEqualTo(AnomalyLabel.NORMAL);
    }

    @Test
    void train_emptyData_reportsFailure() {
        StatisticalDetector detector = new StatisticalDetector(StatisticalMethod.ZSCORE, 3.0, true);

        TrainingOutcome outcome = detector.train(FeatureMatrix.empty(List.of("x")));

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.message()).isEqualTo("Empty training data provided");
        assertThat(detector.isTrained()).isFalse();
    }

    @Test
    void disabled_neverTrains() {
        StatisticalDetector detector = new StatisticalDetector(StatisticalMethod.ZSCORE, 3.0, false);

        assertThat(detector.isAvailable()).isFalse();
        assertThat(detector.train(SKEWED).success()).isFalse();
        assertThat(detector.predict(SKEWED)).containsOnly(AnomalyLabel.NORMAL);
    }

    @Test
    void constructor_rejectsNonPositiveThreshold() {
        assertThatThrownBy(() -> new StatisticalDetector(StatisticalMethod.ZSCORE, 0.0, true))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
