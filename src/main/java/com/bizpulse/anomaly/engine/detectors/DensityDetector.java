package com.bizpulse.anomaly.engine.detectors;

import com.bizpulse.anomaly.engine.AbstractDetectorStrategy;
import com.bizpulse.anomaly.engine.StandardScaler;
import com.bizpulse.anomaly.engine.dbscan.Dbscan;
import com.bizpulse.anomaly.model.DetectionResult;
import com.bizpulse.anomaly.model.FeatureMatrix;
import com.bizpulse.anomaly.model.ScoreOrientation;

/**
 * Density strategy. A row is anomalous when it is farther than {@code eps} from every core point
 * of the training data (in standardized space). The score is that distance; if training produced
 * no core points every row is flagged and scores are 0.
 */
public class DensityDetector extends AbstractDetectorStrategy<DensityDetector.Model> {

    public static final String NAME = "density";

    private final double eps;
    private final int minSamples;

    public DensityDetector(double eps, int minSamples, boolean enabled) {
        super(NAME, ScoreOrientation.HIGHER_IS_ANOMALOUS, enabled);
        if (eps <= 0) {
            throw new IllegalArgumentException("eps must be > 0, got: " + eps);
        }
        if (minSamples < 1) {
            throw new IllegalArgumentException("minSamples must be >= 1, got: " + minSamples);
        }
        this.eps = eps;
        this.minSamples = minSamples;
    }

    @Override
    protected Model fit(FeatureMatrix data) {
        StandardScaler scaler = StandardScaler.fit(data);
        Dbscan dbscan = Dbscan.fit(scaler.transform(data), eps, minSamples);
        if (dbscan.getCoreCount() == 0) {
            log.warn("Density strategy found no core points (eps={}, minSamples={}); every row will be flagged",
                    eps, minSamples);
        }
        return new Model(scaler, dbscan);
    }

    @Override
    protected DetectionResult evaluate(Model model, FeatureMatrix data) {
        return perRow(data.size(), r -> {
            double distance = model.dbscan().nearestCoreDistance(model.scaler().transformRow(data.row(r)));
            boolean anomalous = distance > eps;
            return RowOutcome.of(anomalous, Double.isInfinite(distance) ? 0.0 : distance);
        });
    }

    @Override
    protected String describe(Model model) {
        return "DBSCAN trained: " + model.dbscan().getCoreCount() + " core points";
    }

    public record Model(StandardScaler scaler, Dbscan dbscan) {
    }
}
