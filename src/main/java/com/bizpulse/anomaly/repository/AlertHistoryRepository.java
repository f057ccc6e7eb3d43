package com.bizpulse.anomaly.repository;

import com.bizpulse.anomaly.config.AlertingProperties;
import com.bizpulse.anomaly.config.MetricsConfig;
import com.bizpulse.anomaly.model.Alert;
import com.bizpulse.anomaly.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory alert history in creation order. Appends and iteration are safe to run concurrently;
 * escalation mutates alerts in place through their own synchronized setters.
 *
 * Once the history holds more than {@code max-history} alerts the oldest handled alert is dropped,
 * or the oldest alert of all when none is handled. Dropping an unhandled alert is logged at WARN.
 */
@Repository
public class AlertHistoryRepository {

    private static final Logger log = LoggerFactory.getLogger(AlertHistoryRepository.class);

    private final ConcurrentLinkedDeque<Alert> alerts = new ConcurrentLinkedDeque<>();
    private final AtomicInteger size = new AtomicInteger();
    private final int maxHistory;
    private final MetricsConfig metricsConfig;

    public AlertHistoryRepository(AlertingProperties properties, MetricsConfig metricsConfig) {
        if (properties.getMaxHistory() < 1) {
            throw new IllegalArgumentException("max-history must be >= 1, got: " + properties.getMaxHistory());
        }
        this.maxHistory = properties.getMaxHistory();
        this.metricsConfig = metricsConfig;
    }

    public void save(Alert alert) {
        alerts.addLast(alert);
        if (size.incrementAndGet() > maxHistory) {
            evict();
        }
    }

    private synchronized void evict() {
        while (size.get() > maxHistory) {
            Alert victim = null;
            for (Alert alert : alerts) {
                if (alert.isHandled()) {
                    victim = alert;
                    break;
                }
            }
            if (victim == null) {
                victim = alerts.peekFirst();
            }
            if (victim == null || !alerts.remove(victim)) {
                return;
            }
            size.decrementAndGet();
            boolean handled = victim.isHandled();
            if (handled) {
                log.debug("Evicted handled alert {} from history", victim.getAlertId());
            } else {
                log.warn("Alert history full ({} alerts, none handled); dropped unhandled {} alert {}",
                        maxHistory, victim.getSeverity(), victim.getAlertId());
            }
            metricsConfig.recordEviction(handled);
        }
    }

    public Optional<Alert> findById(String alertId) {
        for (Alert alert : alerts) {
            if (alert.getAlertId().equals(alertId)) {
                return Optional.of(alert);
            }
        }
        return Optional.empty();
    }

    public List<Alert> findAll() {
        return new ArrayList<>(alerts);
    }

    public List<Alert> findUnhandled() {
        List<Alert> result = new ArrayList<>();
        for (Alert alert : alerts) {
            if (!alert.isHandled()) {
                result.add(alert);
            }
        }
        return result;
    }

    /**
     * Alerts created at or after {@code since} (null = any time) whose current severity equals
     * {@code severity} (null = any severity).
     */
    public List<Alert> find(Instant since, Severity severity) {
        List<Alert> result = new ArrayList<>();
        Iterator<Alert> it = alerts.iterator();
        while (it.hasNext()) {
            Alert alert = it.next();
            if (since != null && alert.getTimestamp().isBefore(since)) continue;
            if (severity != null && alert.getSeverity() != severity) continue;
            result.add(alert);
        }
        return result;
    }

    public int count() {
        return size.get();
    }

    public int countUnhandled() {
        int count = 0;
        for (Alert alert : alerts) {
            if (!alert.isHandled()) count++;
        }
        return count;
    }
}
