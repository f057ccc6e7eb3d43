package com.bizpulse.anomaly.service;

import com.bizpulse.anomaly.config.ScoringProperties;
import com.bizpulse.anomaly.model.AnomalyRecord;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Weighted sum of the four business impact dimensions, clamped to [0,1].
 * A missing or NaN dimension contributes nothing.
 */
@Service
public class ImpactAssessmentService {

    private final ScoringProperties.ImpactFactors factors;

    public ImpactAssessmentService(ScoringProperties properties) {
        this.factors = properties.getImpactFactors();
        if (factors.getFinancial() < 0 || factors.getOperational() < 0
                || factors.getReputational() < 0 || factors.getRegulatory() < 0) {
            throw new IllegalArgumentException("Impact factors must be >= 0");
        }
    }

    public double assess(AnomalyRecord record) {
        double impact = factors.getFinancial() * valueOf(record.getFinancialImpact())
                + factors.getOperational() * valueOf(record.getOperationalImpact())
                + factors.getReputational() * valueOf(record.getReputationalImpact())
                + factors.getRegulatory() * valueOf(record.getRegulatoryImpact());
        return Math.max(0.0, Math.min(1.0, impact));
    }

    public List<Double> assessAll(List<AnomalyRecord> records) {
        List<Double> impacts = new ArrayList<>(records.size());
        for (AnomalyRecord record : records) {
            impacts.add(assess(record));
        }
        return impacts;
    }

    private static double valueOf(Double dimension) {
        return dimension == null || dimension.isNaN() ? 0.0 : dimension;
    }
}
