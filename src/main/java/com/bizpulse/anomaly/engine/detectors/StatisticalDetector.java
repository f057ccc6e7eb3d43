package com.bizpulse.anomaly.engine.detectors;

import com.bizpulse.anomaly.engine.AbstractDetectorStrategy;
import com.bizpulse.anomaly.model.DetectionResult;
import com.bizpulse.anomaly.model.FeatureMatrix;
import com.bizpulse.anomaly.model.ScoreOrientation;
import com.bizpulse.anomaly.model.StatisticalMethod;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.Objects;

/**
 * Distribution-statistics strategy.
 *
 * <p>Training records per-feature mean, population standard deviation, min/max, quartiles and
 * median. Prediction applies one rule to every feature and flags a row as soon as ANY feature
 * breaks it:</p>
 * <ul>
 *   <li>{@code ZSCORE}: {@code |v - mean| / std > threshold}</li>
 *   <li>{@code IQR}: outside {@code [Q1 - 1.5*IQR, Q3 + 1.5*IQR]}</li>
 *   <li>{@code PERCENTILE}: outside the training {@code p}-th and {@code (100-p)}-th percentiles,
 *       where {@code p} is the threshold folded into the lower tail</li>
 * </ul>
 *
 * <p>Works on raw, unscaled values. Missing values are imputed with the training mean (z-score) or median (IQR, percentile).</p>
 */
public class StatisticalDetector extends AbstractDetectorStrategy<StatisticalDetector.Model> {

    public static final String NAME = "statistical";

    private static final double EPSILON = 1e-8;
    private static final double IQR_FACTOR = 1.5;

    private final StatisticalMethod method;
    private final double threshold;

    public StatisticalDetector(StatisticalMethod method, double threshold, boolean enabled) {
        super(NAME, ScoreOrientation.HIGHER_IS_ANOMALOUS, enabled);
        this.method = Objects.requireNonNull(method, "method must not be null");
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be > 0, got: " + threshold);
        }
        this.threshold = threshold;
    }

    public StatisticalMethod getMethod() {
        return method;
    }

    @Override
    protected Model fit(FeatureMatrix data) {
        double tail = threshold < 50 ? threshold : 100 - threshold;
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);

        FeatureStats[] stats = new FeatureStats[data.featureCount()];
        for (int c = 0; c < data.featureCount(); c++) {
            double[] values = data.presentValues(c);
            if (values.length == 0) {
                continue;
            }
            DescriptiveStatistics ds = new DescriptiveStatistics(values);
            percentile.setData(values);
            double mean = ds.getMean();
            double std = Math.sqrt(ds.getPopulationVariance());
            stats[c] = new FeatureStats(
                    mean,
                    std,
                    ds.getMin(),
                    ds.getMax(),
                    percentile.evaluate(25),
                    percentile.evaluate(75),
                    percentile.evaluate(50),
                    tail <= 0 ? ds.getMin() : percentile.evaluate(tail),
                    tail <= 0 ? ds.getMax() : percentile.evaluate(100 - tail));
        }
        return new Model(stats);
    }

    @Override
    protected DetectionResult evaluate(Model model, FeatureMatrix data) {
        int features = data.featureCount();
        double[] maxDistance = method == StatisticalMethod.PERCENTILE
                ? batchMaxDistances(model, data)
                : null;

        return perRow(data.size(), r -> {
            boolean anomalous = false;
            double scoreSum = 0.0;
            for (int c = 0; c < features; c++) {
                FeatureStats s = model.stats()[c];
                if (s == null) {
                    continue;
                }
                double raw = data.value(r, c);
                switch (method) {
                    case ZSCORE -> {
                        double v = Double.isNaN(raw) ? s.mean() : raw;
                        double z = Math.abs(v - s.mean()) / (s.std() + EPSILON);
                        anomalous |= z > threshold;
                        scoreSum += z;
                    }
                    case IQR -> {
                        double v = Double.isNaN(raw) ? s.median() : raw;
                        double iqr = s.q75() - s.q25();
                        anomalous |= v < s.q25() - IQR_FACTOR * iqr || v > s.q75() + IQR_FACTOR * iqr;
                        scoreSum += Math.abs(v - s.median()) / (iqr + EPSILON);
                    }
                    case PERCENTILE -> {
                        double v = Double.isNaN(raw) ? s.median() : raw;
                        anomalous |= v < s.lowerBound() || v > s.upperBound();
                        double max = maxDistance[c] > 0 ? maxDistance[c] : 1.0;
                        scoreSum += Math.abs(v - s.median()) / max;
                    }
                }
            }
            return RowOutcome.of(anomalous, features > 0 ? scoreSum / features : 0.0);
        });
    }

    private double[] batchMaxDistances(Model model, FeatureMatrix data) {
        double[] max = new double[data.featureCount()];
        for (int c = 0; c < data.featureCount(); c++) {
            FeatureStats s = model.stats()[c];
            if (s == null) {
                continue;
            }
            for (int r = 0; r < data.size(); r++) {
                double raw = data.value(r, c);
                double v = Double.isNaN(raw) ? s.median() : raw;
                max[c] = Math.max(max[c], Math.abs(v - s.median()));
            }
        }
        return max;
    }

    @Override
    protected String describe(Model model) {
        return "Statistical model (" + method + ") trained on " + model.stats().length + " features";
    }

    /**
     * Training statistics of one feature. Mean/std are population moments; percentiles use
     * linear interpolation between order statistics.
     */
    public record FeatureStats(double mean, double std, double min, double max,
                               double q25, double q75, double median,
                               double lowerBound, double upperBound) {
    }

    /**
     * Per-feature statistics in schema order; {@code null} where the feature had no values.
     */
    public record Model(FeatureStats[] stats) {
    }
}
