package com.bizpulse.anomaly.engine.detectors;

import com.bizpulse.anomaly.engine.AbstractDetectorStrategy;
import com.bizpulse.anomaly.engine.StandardScaler;
import com.bizpulse.anomaly.engine.isolationforest.IsolationForest;
import com.bizpulse.anomaly.model.DetectionResult;
import com.bizpulse.anomaly.model.FeatureMatrix;
import com.bizpulse.anomaly.model.ScoreOrientation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * Tree-based reconstruction strategy backed by an isolation forest.
 *
 * <p>The raw score is a decision value: {@code -s(x) - offset}, where {@code s(x)} is the forest's
 * path-length anomaly score and {@code offset} is the {@code contamination} quantile of the
 * negated training scores. Lower is more anomalous; a row is anomalous when the decision value is
 * negative, so roughly {@code contamination} of the training rows fall outside.</p>
 */
public class IsolationForestDetector extends AbstractDetectorStrategy<IsolationForestDetector.Model> {

    public static final String NAME = "reconstruction";

    private final double contamination;
    private final int numTrees;
    private final int sampleSize;
    private final long seed;

    public IsolationForestDetector(double contamination, int numTrees, int sampleSize, long seed, boolean enabled) {
        super(NAME, ScoreOrientation.LOWER_IS_ANOMALOUS, enabled);
        if (contamination <= 0 || contamination > 0.5) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5], got: " + contamination);
        }
        this.contamination = contamination;
        this.numTrees = numTrees;
        this.sampleSize = sampleSize;
        this.seed = seed;
    }

    @Override
    protected Model fit(FeatureMatrix data) {
        StandardScaler scaler = StandardScaler.fit(data);
        double[][] scaled = scaler.transform(data);
        IsolationForest forest = IsolationForest.train(scaled, numTrees, sampleSize, seed);

        double[] negatedScores = new double[scaled.length];
        for (int i = 0; i < scaled.length; i++) {
            negatedScores[i] = -forest.anomalyScore(scaled[i]);
        }
        double offset = new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(negatedScores, 100.0 * contamination);
        return new Model(scaler, forest, offset);
    }

    @Override
    protected DetectionResult evaluate(Model model, FeatureMatrix data) {
        return perRow(data.size(), r -> {
            double[] point = model.scaler().transformRow(data.row(r));
            double decision = -model.forest().anomalyScore(point) - model.offset();
            return RowOutcome.of(decision < 0, decision);
        });
    }

    @Override
    protected String describe(Model model) {
        return String.format("Isolation forest trained: %d trees, sample size %d, offset %.4f",
                model.forest().getTreeCount(), model.forest().getSampleSize(), model.offset());
    }

    public record Model(StandardScaler scaler, IsolationForest forest, double offset) {
    }
}
