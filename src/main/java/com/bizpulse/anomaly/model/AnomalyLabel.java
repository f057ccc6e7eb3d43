package com.bizpulse.anomaly.model;

/**
 * Binary outcome of a detector for one row. The numeric codes follow the usual
 * one-class convention: {@code 1} for inliers, {@code -1} for outliers.
 */
public enum AnomalyLabel {
    NORMAL(1),
    ANOMALOUS(-1);

    private final int code;

    AnomalyLabel(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public boolean isAnomalous() {
        return this == ANOMALOUS;
    }

    public static AnomalyLabel of(boolean anomalous) {
        return anomalous ? ANOMALOUS : NORMAL;
    }
}
