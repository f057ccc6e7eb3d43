package com.bizpulse.anomaly.model;

public enum StatisticalMethod {
    ZSCORE,
    IQR,
    PERCENTILE
}
