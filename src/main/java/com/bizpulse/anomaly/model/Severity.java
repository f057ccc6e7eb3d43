package com.bizpulse.anomaly.model;

public enum Severity {
    LOW("Low priority anomaly, minimal impact"),
    MEDIUM("Medium priority anomaly, moderate impact"),
    HIGH("High priority anomaly, significant impact"),
    CRITICAL("Critical priority anomaly, immediate attention required");

    private final String description;

    Severity(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
