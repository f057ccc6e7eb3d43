package com.bizpulse.anomaly.config;

import com.bizpulse.anomaly.engine.DetectorStrategy;
import com.bizpulse.anomaly.engine.detectors.AutoencoderDetector;
import com.bizpulse.anomaly.engine.detectors.BoundaryDetector;
import com.bizpulse.anomaly.engine.detectors.DensityDetector;
import com.bizpulse.anomaly.engine.detectors.IsolationForestDetector;
import com.bizpulse.anomaly.engine.detectors.StatisticalDetector;
import com.bizpulse.anomaly.model.ReconstructionType;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the four detector strategies from {@link DetectionProperties}. The ensemble picks them
 * up as a {@code List<DetectorStrategy>}.
 */
@Configuration
public class DetectorConfig {

    @Bean
    public DetectorStrategy boundaryDetector(DetectionProperties properties) {
        DetectionProperties.Boundary cfg = properties.getBoundary();
        return new BoundaryDetector(cfg.getNu(), cfg.getGamma(), cfg.getTolerance(), cfg.getMaxIterations(),
                cfg.getMaxTrainingSamples(), cfg.getSeed(), cfg.isEnabled());
    }

    @Bean
    public DetectorStrategy densityDetector(DetectionProperties properties) {
        DetectionProperties.Density cfg = properties.getDensity();
        return new DensityDetector(cfg.getEps(), cfg.getMinSamples(), cfg.isEnabled());
    }

    @Bean
    public DetectorStrategy statisticalDetector(DetectionProperties properties) {
        DetectionProperties.Statistical cfg = properties.getStatistical();
        return new StatisticalDetector(cfg.getMethod(), cfg.getThreshold(), cfg.isEnabled());
    }

    // Exactly one reconstruction sub-strategy is active
    @Bean
    public DetectorStrategy reconstructionDetector(DetectionProperties properties) {
        DetectionProperties.Reconstruction cfg = properties.getReconstruction();
        if (cfg.getType() == ReconstructionType.AUTOENCODER) {
            return new AutoencoderDetector(cfg.getEpochs(), cfg.getBatchSize(), cfg.getLearningRate(),
                    cfg.getErrorPercentile(), cfg.getSeed(), cfg.isEnabled());
        }
        return new IsolationForestDetector(cfg.getContamination(), cfg.getNumTrees(), cfg.getSampleSize(),
                cfg.getSeed(), cfg.isEnabled());
    }
}
