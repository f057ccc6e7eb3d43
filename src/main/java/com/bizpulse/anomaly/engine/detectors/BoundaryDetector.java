package com.bizpulse.anomaly.engine.detectors;

import com.bizpulse.anomaly.engine.AbstractDetectorStrategy;
import com.bizpulse.anomaly.engine.StandardScaler;
import com.bizpulse.anomaly.engine.svm.OneClassSvm;
import com.bizpulse.anomaly.model.DetectionResult;
import com.bizpulse.anomaly.model.FeatureMatrix;
import com.bizpulse.anomaly.model.ScoreOrientation;
import org.apache.commons.math3.stat.descriptive.moment.Variance;

import java.util.Random;

/**
 * Boundary strategy: a one-class SVM learns a closed region around standardized training data.
 * The score is the negated decision value, so it is positive (anomalous) outside the region.
 */
public class BoundaryDetector extends AbstractDetectorStrategy<BoundaryDetector.Model> {

    public static final String NAME = "boundary";

    private final double nu;
    private final Double gamma;
    private final double tolerance;
    private final int maxIterations;
    private final int maxTrainingSamples;
    private final long seed;

    /**
     * @param gamma RBF width, or {@code null} for {@code 1 / (features * variance)}
     */
    public BoundaryDetector(double nu, Double gamma, double tolerance, int maxIterations,
                            int maxTrainingSamples, long seed, boolean enabled) {
        super(NAME, ScoreOrientation.HIGHER_IS_ANOMALOUS, enabled);
        if (nu <= 0 || nu > 1) {
            throw new IllegalArgumentException("nu must be in (0, 1], got: " + nu);
        }
        if (gamma != null && gamma <= 0) {
            throw new IllegalArgumentException("gamma must be > 0, got: " + gamma);
        }
        this.nu = nu;
        this.gamma = gamma;
        this.tolerance = tolerance;
        this.maxIterations = maxIterations;
        this.maxTrainingSamples = Math.max(1, maxTrainingSamples);
        this.seed = seed;
    }

    @Override
    protected Model fit(FeatureMatrix data) {
        StandardScaler scaler = StandardScaler.fit(data);
        double[][] scaled = subsample(scaler.transform(data));
        double effectiveGamma = gamma != null ? gamma : scaleGamma(scaled);
        OneClassSvm svm = OneClassSvm.train(scaled, nu, effectiveGamma, tolerance, maxIterations);
        if (svm.getIterations() >= maxIterations) {
            log.warn("Boundary solver stopped at the iteration cap ({}) before converging", maxIterations);
        }
        return new Model(scaler, svm);
    }

    @Override
    protected DetectionResult evaluate(Model model, FeatureMatrix data) {
        return perRow(data.size(), r -> {
            double score = -model.svm().decisionValue(model.scaler().transformRow(data.row(r)));
            return RowOutcome.of(score > 0, score);
        });
    }

    @Override
    protected String describe(Model model) {
        return String.format("One-class SVM trained: %d support vectors, gamma %.4f",
                model.svm().getSupportVectorCount(), model.svm().getGamma());
    }

    private double[][] subsample(double[][] rows) {
        if (rows.length <= maxTrainingSamples) {
            return rows;
        }
        double[][] copy = rows.clone();
        Random random = new Random(seed);
        for (int i = 0; i < maxTrainingSamples; i++) {
            int j = i + random.nextInt(copy.length - i);
            double[] tmp = copy[i];
            copy[i] = copy[j];
            copy[j] = tmp;
        }
        double[][] sample = new double[maxTrainingSamples][];
        System.arraycopy(copy, 0, sample, 0, maxTrainingSamples);
        log.info("Boundary strategy subsampled {} of {} training rows", maxTrainingSamples, rows.length);
        return sample;
    }

    private static double scaleGamma(double[][] scaled) {
        int features = scaled[0].length;
        double[] flat = new double[scaled.length * features];
        int i = 0;
        for (double[] row : scaled) {
            for (double v : row) {
                flat[i++] = v;
            }
        }
        double variance = new Variance(false).evaluate(flat);
        return variance > 0 ? 1.0 / (features * variance) : 1.0 / Math.max(1, features);
    }

    public record Model(StandardScaler scaler, OneClassSvm svm) {
    }
}
