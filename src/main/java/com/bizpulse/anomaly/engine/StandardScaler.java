package com.bizpulse.anomaly.engine;

import com.bizpulse.anomaly.model.FeatureMatrix;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

/**
 * Per-feature standardization fitted on training data only and reused at predict time.
 * Missing values are imputed with the training mean, i.e. they map to 0 after scaling.
 * A feature with zero variance keeps a unit scale.
 */
public final class StandardScaler {

    private final double[] means;
    private final double[] scales;

    private StandardScaler(double[] means, double[] scales) {
        this.means = means;
        this.scales = scales;
    }

    public static StandardScaler fit(FeatureMatrix data) {
        int features = data.featureCount();
        double[] means = new double[features];
        double[] scales = new double[features];
        StandardDeviation std = new StandardDeviation(false);
        Mean mean = new Mean();
        for (int c = 0; c < features; c++) {
            double[] present = data.presentValues(c);
            if (present.length == 0) {
                means[c] = 0.0;
                scales[c] = 1.0;
                continue;
            }
            means[c] = mean.evaluate(present);
            double s = std.evaluate(present);
            scales[c] = s > 0 ? s : 1.0;
        }
        return new StandardScaler(means, scales);
    }

    public double[][] transform(FeatureMatrix data) {
        double[][] out = new double[data.size()][];
        for (int r = 0; r < data.size(); r++) {
            out[r] = transformRow(data.row(r));
        }
        return out;
    }

    public double[] transformRow(double[] row) {
        if (row.length != means.length) {
            throw new IllegalArgumentException("Expected " + means.length + " features, got " + row.length);
        }
        double[] out = new double[row.length];
        for (int c = 0; c < row.length; c++) {
            double v = Double.isNaN(row[c]) ? means[c] : row[c];
            out[c] = (v - means[c]) / scales[c];
        }
        return out;
    }

    public int featureCount() {
        return means.length;
    }
}
