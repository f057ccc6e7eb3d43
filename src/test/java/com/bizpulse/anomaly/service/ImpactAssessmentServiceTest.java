package com.bizpulse.anomaly.service;

import com.bizpulse.anomaly.config.ScoringProperties;
import com.bizpulse.anomaly.model.AnomalyRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ImpactAssessmentServiceTest {

    private ImpactAssessmentService service;

    @BeforeEach
    void setUp() {
        service = new ImpactAssessmentService(new ScoringProperties());
    }

    @Test
    void weightedSumOfDimensions() {
        AnomalyRecord record = AnomalyRecord.builder()
                .financialImpact(0.5)
                .operationalImpact(1.0)
                .reputationalImpact(0.0)
                .regulatoryImpact(1.0)
                .build();

        // 0.4*0.5 + 0.3*1 + 0.2*0 + 0.1*1
        assertThat(service.assess(record)).isCloseTo(0.6, within(1e-9));
    }

    @Test
    void missingDimensions_countAsZero() {
        AnomalyRecord record = AnomalyRecord.builder().financialImpact(1.0).build();

        assertThat(service.assess(record)).isCloseTo(0.4, within(1e-9));
        assertThat(service.assess(new AnomalyRecord())).isEqualTo(0.0);
    }

    @Test
    void result_isClampedToOne() {
        AnomalyRecord record = AnomalyRecord.builder()
                .financialImpact(3.0)
                .operationalImpact(3.0)
                .build();

        assertThat(service.assess(record)).isEqualTo(1.0);
    }

    @Test
    void assessAll_keepsOrder() {
        List<Double> impacts = service.assessAll(List.of(
                AnomalyRecord.builder().regulatoryImpact(1.0).build(),
                AnomalyRecord.builder().financialImpact(1.0).build()));

        assertThat(impacts).hasSize(2);
        assertThat(impacts.get(0)).isCloseTo(0.1, within(1e-9));
        assertThat(impacts.get(1)).isCloseTo(0.4, within(1e-9));
    }
}
