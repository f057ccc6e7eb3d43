package com.bizpulse.anomaly.model;

public enum ReconstructionType {
    ISOLATION_FOREST,
    AUTOENCODER
}
