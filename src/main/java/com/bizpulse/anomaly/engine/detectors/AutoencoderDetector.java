package com.bizpulse.anomaly.engine.detectors;

import com.bizpulse.anomaly.engine.AbstractDetectorStrategy;
import com.bizpulse.anomaly.engine.StandardScaler;
import com.bizpulse.anomaly.engine.autoencoder.Autoencoder;
import com.bizpulse.anomaly.model.DetectionResult;
import com.bizpulse.anomaly.model.FeatureMatrix;
import com.bizpulse.anomaly.model.ScoreOrientation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * Reconstruction strategy backed by a small autoencoder. The score is the per-row mean squared
 * reconstruction error (higher is more anomalous); rows whose error exceeds the configured
 * percentile of the training errors are flagged.
 */
public class AutoencoderDetector extends AbstractDetectorStrategy<AutoencoderDetector.Model> {

    public static final String NAME = "reconstruction";

    private final int epochs;
    private final int batchSize;
    private final double learningRate;
    private final double errorPercentile;
    private final long seed;

    public AutoencoderDetector(int epochs, int batchSize, double learningRate, double errorPercentile,
                               long seed, boolean enabled) {
        super(NAME, ScoreOrientation.HIGHER_IS_ANOMALOUS, enabled);
        if (errorPercentile <= 0 || errorPercentile > 100) {
            throw new IllegalArgumentException("errorPercentile must be in (0, 100], got: " + errorPercentile);
        }
        this.epochs = epochs;
        this.batchSize = batchSize;
        this.learningRate = learningRate;
        this.errorPercentile = errorPercentile;
        this.seed = seed;
    }

    @Override
    protected Model fit(FeatureMatrix data) {
        StandardScaler scaler = StandardScaler.fit(data);
        double[][] scaled = scaler.transform(data);
        int hidden = Math.max(1, data.featureCount() / 2);
        Autoencoder network = Autoencoder.train(scaled, hidden, epochs, batchSize, learningRate, seed);

        double[] errors = new double[scaled.length];
        for (int i = 0; i < scaled.length; i++) {
            errors[i] = network.reconstructionError(scaled[i]);
        }
        double threshold = new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(errors, errorPercentile);
        return new Model(scaler, network, threshold);
    }

    @Override
    protected DetectionResult evaluate(Model model, FeatureMatrix data) {
        return perRow(data.size(), r -> {
            double error = model.network().reconstructionError(model.scaler().transformRow(data.row(r)));
            return RowOutcome.of(error > model.errorThreshold(), error);
        });
    }

    @Override
    protected String describe(Model model) {
        return String.format("Autoencoder trained: hidden=%d, error threshold %.6f",
                model.network().getHiddenDim(), model.errorThreshold());
    }

    public record Model(StandardScaler scaler, Autoencoder network, double errorThreshold) {
    }
}
