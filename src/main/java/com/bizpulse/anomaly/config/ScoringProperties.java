package com.bizpulse.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "anomaly.scoring")
public class ScoringProperties {

    private Thresholds thresholds = new Thresholds();
    private FeatureWeights featureWeights = new FeatureWeights();
    private ImpactFactors impactFactors = new ImpactFactors();

    // Severity score lower bounds: >= high is CRITICAL, >= medium HIGH, >= low MEDIUM
    @Data
    public static class Thresholds {
        private double low = 0.3;
        private double medium = 0.6;
        private double high = 0.8;
    }

    @Data
    public static class FeatureWeights {
        private double score = 0.4;
        private double frequency = 0.3;
        private double impact = 0.3;
    }

    @Data
    public static class ImpactFactors {
        private double financial = 0.4;
        private double operational = 0.3;
        private double reputational = 0.2;
        private double regulatory = 0.1;
    }
}
