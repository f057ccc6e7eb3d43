package com.bizpulse.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A row the ensemble flagged, enriched with the context the severity and impact scoring need.
 * Context fields are boxed: {@code null} means the input was not available.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyRecord {

    private String anomalyId;
    private int rowIndex;
    private Instant timestamp;
    private Map<String, Double> features;

    private Double detectionScore;
    private Double frequencyFactor;
    private Double impactFactor;

    private Double financialImpact;
    private Double operationalImpact;
    private Double reputationalImpact;
    private Double regulatoryImpact;

    /**
     * Flat key/value copy used as the alert's data payload.
     */
    public Map<String, Object> toDataSnapshot() {
        Map<String, Object> data = new LinkedHashMap<>();
        if (features != null) {
            data.putAll(features);
        }
        data.put("anomaly_index", rowIndex);
        if (timestamp != null) data.put("observed_at", timestamp.toString());
        if (detectionScore != null) data.put("anomaly_score", detectionScore);
        if (frequencyFactor != null) data.put("frequency_factor", frequencyFactor);
        if (impactFactor != null) data.put("impact_factor", impactFactor);
        if (financialImpact != null) data.put("financial_impact", financialImpact);
        if (operationalImpact != null) data.put("operational_impact", operationalImpact);
        if (reputationalImpact != null) data.put("reputational_impact", reputationalImpact);
        if (regulatoryImpact != null) data.put("regulatory_impact", regulatoryImpact);
        return data;
    }
}
