package com.bizpulse.anomaly.streaming;

import com.bizpulse.anomaly.config.StreamingProperties;
import com.bizpulse.anomaly.engine.ensemble.EnsembleDetector;
import com.bizpulse.anomaly.model.DetectionReport;
import com.bizpulse.anomaly.model.FeatureMatrix;
import com.bizpulse.anomaly.service.AnomalyDetectionService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Polls the {@link FeatureSource}, if one is configured, and pushes each batch through detection.
 * Until the ensemble has strategies to vote with it trains on the source's training data instead.
 */
@Service
public class StreamingDetectionService {

    private static final Logger log = LoggerFactory.getLogger(StreamingDetectionService.class);

    private final ObjectProvider<FeatureSource> featureSource;
    private final AnomalyDetectionService detectionService;
    private final EnsembleDetector ensemble;
    private final StreamingProperties config;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public StreamingDetectionService(ObjectProvider<FeatureSource> featureSource,
                                     AnomalyDetectionService detectionService,
                                     EnsembleDetector ensemble,
                                     StreamingProperties config) {
        this.featureSource = featureSource;
        this.detectionService = detectionService;
        this.ensemble = ensemble;
        this.config = config;
    }

    @Scheduled(fixedRateString = "${anomaly.streaming.poll-interval-seconds:10}",
               timeUnit = TimeUnit.SECONDS,
               initialDelayString = "${anomaly.streaming.poll-interval-seconds:10}")
    public void poll() {
        if (!config.isEnabled() || stopped.get()) {
            return;
        }
        FeatureSource source = featureSource.getIfAvailable();
        if (source == null) {
            return;
        }
        try {
            if (ensemble.activeStrategies().isEmpty()) {
                FeatureMatrix training = source.trainingData();
                if (training == null || training.isEmpty()) {
                    log.debug("No training data available yet; skipping detection cycle");
                    return;
                }
                detectionService.train(training);
                return;
            }
            FeatureMatrix batch = source.poll(config.getBatchSize());
            if (batch == null || batch.isEmpty()) {
                return;
            }
            DetectionReport report = detectionService.detect(batch);
            log.debug("Streaming batch of {} rows produced {} anomalies", report.getRowCount(), report.anomalyCount());
        } catch (RuntimeException e) {
            log.error("Streaming detection cycle failed: {}", e.getMessage(), e);
        }
    }

    @PreDestroy
    public void stop() {
        stopped.set(true);
    }
}
