package com.bizpulse.anomaly.engine.detectors;

import com.bizpulse.anomaly.model.AnomalyLabel;
import com.bizpulse.anomaly.model.DetectionResult;
import com.bizpulse.anomaly.model.FeatureMatrix;
import org.junit.jupiter.api.Test;

import static com.bizpulse.anomaly.testutil.TestDataFactory.normalCluster;
import static com.bizpulse.anomaly.testutil.TestDataFactory.twoColumns;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BoundaryDetectorTest {

    private static final FeatureMatrix TRAINING = normalCluster(200, 11L);

    @Test
    void pointsInsideBoundaryScoreNegative_pointsOutsideScorePositive() {
        BoundaryDetector detector = new BoundaryDetector(0.1, null, 1e-3, 100_000, 2000, 42L, true);
        assertThat(detector.train(TRAINING).success()).isTrue();

        DetectionResult result = detector.detect(twoColumns(new double[]{0, 0}, new double[]{6, 6}));

        assertThat(result.label(0)).isEqualTo(AnomalyLabel.NORMAL);
        assertThat(result.score(0)).isNegative();
        assertThat(result.label(1)).isEqualTo(AnomalyLabel.ANOMALOUS);
        assertThat(result.score(1)).isPositive();
    }

    @Test
    void nu_boundsTrainingOutlierFraction() {
        BoundaryDetector detector = new BoundaryDetector(0.1, null, 1e-3, 100_000, 2000, 42L, true);
        detector.train(TRAINING);

        long flagged = detector.detect(TRAINING).anomalyCount();

        assertThat((double) flagged / TRAINING.size()).isLessThan(0.25);
    }

    @Test
    void largeTrainingSet_isSubsampled() {
        BoundaryDetector detector = new BoundaryDetector(0.1, 0.5, 1e-3, 100_000, 50, 42L, true);

        assertThat(detector.train(TRAINING).success()).isTrue();
        assertThat(detector.predict(TRAINING)).hasSize(TRAINING.size());
    }

    @Test
    void constructor_rejectsInvalidNu() {
        assertThatThrownBy(() -> new BoundaryDetector(0.0, null, 1e-3, 10, 10, 1L, true))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BoundaryDetector(0.1, -1.0, 1e-3, 10, 10, 1L, true))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
