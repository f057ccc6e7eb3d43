package com.bizpulse.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Everything one detection pass produced. {@code alerts} is index-aligned with
 * {@code anomalies}; an entry is {@code null} where the alert was suppressed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectionReport {
    private int rowCount;
    private List<EnsembleVerdict> verdicts;
    private List<AnomalyRecord> anomalies;
    private List<Severity> severities;
    private List<Double> impacts;
    private List<Alert> alerts;
    private Map<String, Double> modelContributions;
    private Instant detectedAt;

    public long anomalyCount() {
        return anomalies == null ? 0 : anomalies.size();
    }

    public static DetectionReport empty(Instant at) {
        return DetectionReport.builder()
                .rowCount(0)
                .verdicts(List.of())
                .anomalies(List.of())
                .severities(List.of())
                .impacts(List.of())
                .alerts(List.of())
                .modelContributions(Map.of())
                .detectedAt(at)
                .build();
    }
}
