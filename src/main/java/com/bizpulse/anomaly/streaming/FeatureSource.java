package com.bizpulse.anomaly.streaming;

import com.bizpulse.anomaly.model.FeatureMatrix;

/**
 * Upstream supplier of fixed-schema feature rows. Training and live batches must share a schema.
 */
public interface FeatureSource {

    /**
     * Historical rows representing normal behaviour; empty if none are available yet.
     */
    FeatureMatrix trainingData();

    /**
     * Up to {@code maxRows} rows that arrived since the last poll; empty if nothing is new.
     */
    FeatureMatrix poll(int maxRows);
}
