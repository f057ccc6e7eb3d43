package com.bizpulse.anomaly.config;

import com.bizpulse.anomaly.model.ReconstructionType;
import com.bizpulse.anomaly.model.StatisticalMethod;
import com.bizpulse.anomaly.model.VotingMethod;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "anomaly.detection")
public class DetectionProperties {

    private Ensemble ensemble = new Ensemble();
    private Boundary boundary = new Boundary();
    private Density density = new Density();
    private Statistical statistical = new Statistical();
    private Reconstruction reconstruction = new Reconstruction();

    @Data
    public static class Ensemble {
        private VotingMethod votingMethod = VotingMethod.MAJORITY;

        // Keyed by strategy name; strategies missing here vote with weight 1.0
        private Map<String, Double> weights = defaultWeights();

        // When true, an ensemble where any strategy failed to train serves neutral results only.
        // When false it keeps serving with the strategies that did train.
        private boolean requireAllStrategies = false;

        private static Map<String, Double> defaultWeights() {
            Map<String, Double> weights = new LinkedHashMap<>();
            weights.put("boundary", 1.0);
            weights.put("density", 1.0);
            weights.put("statistical", 1.0);
            weights.put("reconstruction", 1.0);
            return weights;
        }
    }

    @Data
    public static class Boundary {
        private boolean enabled = true;
        // Upper bound on the fraction of training rows left outside the boundary
        private double nu = 0.1;
        // Null means "scale": 1 / (featureCount * variance of the scaled training data)
        private Double gamma;
        private double tolerance = 1e-3;
        private int maxIterations = 100_000;
        // The kernel matrix is n^2; larger training sets are subsampled
        private int maxTrainingSamples = 2000;
        private long seed = 42L;
    }

    @Data
    public static class Density {
        private boolean enabled = true;
        private double eps = 0.5;
        private int minSamples = 5;
    }

    @Data
    public static class Statistical {
        private boolean enabled = true;
        private StatisticalMethod method = StatisticalMethod.ZSCORE;
        // z-score cutoff for ZSCORE, tail percentage for PERCENTILE, unused for IQR
        private double threshold = 3.0;
    }

    @Data
    public static class Reconstruction {
        private boolean enabled = true;
        private ReconstructionType type = ReconstructionType.ISOLATION_FOREST;

        // Isolation forest
        private double contamination = 0.1;
        private int numTrees = 100;
        private int sampleSize = 256;
        private long seed = 42L;

        // Autoencoder
        private int epochs = 50;
        private int batchSize = 32;
        private double learningRate = 0.001;
        private double errorPercentile = 90.0;
    }
}
