package com.bizpulse.anomaly.service;

import com.bizpulse.anomaly.config.AlertingProperties;
import com.bizpulse.anomaly.config.MetricsConfig;
import com.bizpulse.anomaly.model.AnomalyRecord;
import com.bizpulse.anomaly.model.FalsePositivePattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Decides whether an anomaly is known noise. Checks run in order and the first match wins:
 * <ol>
 *   <li>registered patterns against the anomaly's data snapshot</li>
 *   <li>recurrence: the same rounded feature signature seen more than {@code frequency-threshold}
 *       times within {@code frequency-window-minutes}</li>
 *   <li>cosine similarity above {@code similarity-threshold} to an operator-confirmed false positive</li>
 * </ol>
 * Errors never suppress an alert.
 */
@Service
public class FalsePositiveFilterService {

    private static final Logger log = LoggerFactory.getLogger(FalsePositiveFilterService.class);

    private static final Duration PURGE_INTERVAL = Duration.ofMinutes(1);

    private final AlertingProperties.FalsePositive config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    private final List<FalsePositivePattern> patterns = new CopyOnWriteArrayList<>();
    private final List<Map<String, Double>> confirmedFalsePositives = new CopyOnWriteArrayList<>();
    private final Map<String, Deque<Instant>> signatureSightings = new ConcurrentHashMap<>();
    private volatile Instant lastPurge;

    public FalsePositiveFilterService(AlertingProperties properties, MetricsConfig metricsConfig, Clock clock) {
        this.config = properties.getFalsePositive();
        this.metricsConfig = metricsConfig;
        this.clock = clock;
        if (config.getPatterns() != null) {
            config.getPatterns().forEach(this::addPattern);
        }
    }

    public boolean isFalsePositive(AnomalyRecord record) {
        try {
            Map<String, Object> data = record.toDataSnapshot();
            for (FalsePositivePattern pattern : patterns) {
                if (pattern.matches(data)) {
                    log.info("Anomaly {} matches false positive pattern '{}'", record.getAnomalyId(), pattern.getName());
                    metricsConfig.recordSuppressed("pattern");
                    return true;
                }
            }

            if (isRecurring(record.getFeatures())) {
                log.info("Anomaly {} suppressed: signature recurred more than {} times in {} minutes",
                        record.getAnomalyId(), config.getFrequencyThreshold(), config.getFrequencyWindowMinutes());
                metricsConfig.recordSuppressed("frequency");
                return true;
            }

            if (isSimilarToConfirmed(record.getFeatures())) {
                log.info("Anomaly {} suppressed: similar to a confirmed false positive", record.getAnomalyId());
                metricsConfig.recordSuppressed("similarity");
                return true;
            }
            return false;
        } catch (RuntimeException e) {
            log.warn("False positive check failed for anomaly {}, letting the alert through: {}",
                    record == null ? null : record.getAnomalyId(), e.getMessage());
            return false;
        }
    }

    public void addPattern(FalsePositivePattern pattern) {
        Objects.requireNonNull(pattern, "pattern must not be null");
        if (pattern.getConditions() == null || pattern.getConditions().isEmpty()) {
            throw new IllegalArgumentException("False positive pattern '" + pattern.getName() + "' has no conditions");
        }
        patterns.add(pattern);
        log.info("Registered false positive pattern '{}' with conditions on {}",
                pattern.getName(), pattern.getConditions().keySet());
    }

    public boolean removePattern(String name) {
        boolean removed = patterns.removeIf(p -> Objects.equals(p.getName(), name));
        if (removed) {
            log.info("Removed false positive pattern '{}'", name);
        }
        return removed;
    }

    public List<FalsePositivePattern> getPatterns() {
        return List.copyOf(patterns);
    }

    /**
     * Remember an anomaly an operator judged to be noise; similar anomalies are suppressed later.
     */
    public void confirmFalsePositive(AnomalyRecord record) {
        if (record.getFeatures() == null || record.getFeatures().isEmpty()) {
            log.warn("Anomaly {} has no features; nothing to remember as a false positive", record.getAnomalyId());
            return;
        }
        confirmedFalsePositives.add(Map.copyOf(withoutNulls(record.getFeatures())));
        log.info("Confirmed anomaly {} as a false positive ({} known)",
                record.getAnomalyId(), confirmedFalsePositives.size());
    }

    public int getConfirmedFalsePositiveCount() {
        return confirmedFalsePositives.size();
    }

    private boolean isRecurring(Map<String, Double> features) {
        if (features == null || features.isEmpty()) {
            return false;
        }
        String signature = signature(features);
        Instant now = clock.instant();
        Instant windowStart = now.minus(Duration.ofMinutes(config.getFrequencyWindowMinutes()));
        purgeExpiredSightings(now, windowStart);

        boolean[] recurring = new boolean[1];
        signatureSightings.compute(signature, (key, sightings) -> {
            Deque<Instant> window = sightings != null ? sightings : new ArrayDeque<>();
            dropOlderThan(window, windowStart);
            window.addLast(now);
            recurring[0] = window.size() > config.getFrequencyThreshold();
            return window;
        });
        return recurring[0];
    }

    /**
     * Forget signatures with no sighting inside the window. Runs at most once per
     * {@link #PURGE_INTERVAL}.
     */
    private void purgeExpiredSightings(Instant now, Instant windowStart) {
        Instant last = lastPurge;
        if (last != null && now.isBefore(last.plus(PURGE_INTERVAL))) {
            return;
        }
        lastPurge = now;
        int before = signatureSightings.size();
        for (String signature : signatureSightings.keySet()) {
            signatureSightings.computeIfPresent(signature, (key, window) -> {
                dropOlderThan(window, windowStart);
                return window.isEmpty() ? null : window;
            });
        }
        int purged = before - signatureSightings.size();
        if (purged > 0) {
            log.debug("Purged {} expired anomaly signatures, {} still tracked", purged, signatureSightings.size());
        }
    }

    private static void dropOlderThan(Deque<Instant> window, Instant windowStart) {
        while (!window.isEmpty() && window.peekFirst().isBefore(windowStart)) {
            window.pollFirst();
        }
    }

    int trackedSignatureCount() {
        return signatureSightings.size();
    }

    String signature(Map<String, Double> features) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Double> entry : new TreeMap<>(features).entrySet()) {
            Double value = entry.getValue();
            String rounded = value == null || value.isNaN() || value.isInfinite()
                    ? "null"
                    : BigDecimal.valueOf(value).setScale(config.getSignaturePrecision(), RoundingMode.HALF_UP)
                            .stripTrailingZeros().toPlainString();
            sb.append(entry.getKey()).append('=').append(rounded).append(';');
        }
        return sb.toString();
    }

    private boolean isSimilarToConfirmed(Map<String, Double> features) {
        if (features == null || features.isEmpty() || confirmedFalsePositives.isEmpty()) {
            return false;
        }
        Map<String, Double> current = withoutNulls(features);
        for (Map<String, Double> known : confirmedFalsePositives) {
            if (cosineSimilarity(current, known) > config.getSimilarityThreshold()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Cosine similarity over the features both maps share; 0 when nothing is shared or a vector is zero.
     */
    static double cosineSimilarity(Map<String, Double> a, Map<String, Double> b) {
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        int shared = 0;
        for (Map.Entry<String, Double> entry : a.entrySet()) {
            Double other = b.get(entry.getKey());
            if (other == null) continue;
            double x = entry.getValue();
            dot += x * other;
            normA += x * x;
            normB += other * other;
            shared++;
        }
        if (shared == 0 || normA == 0 || normB == 0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private static Map<String, Double> withoutNulls(Map<String, Double> features) {
        Map<String, Double> clean = new TreeMap<>();
        features.forEach((k, v) -> {
            if (v != null && Double.isFinite(v)) {
                clean.put(k, v);
            }
        });
        return clean;
    }
}
