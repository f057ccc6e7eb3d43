package com.bizpulse.anomaly.service;

import com.bizpulse.anomaly.config.AlertingProperties;
import com.bizpulse.anomaly.config.MetricsConfig;
import com.bizpulse.anomaly.model.Alert;
import com.bizpulse.anomaly.model.AnomalyRecord;
import com.bizpulse.anomaly.model.Severity;
import com.bizpulse.anomaly.notification.AlertDispatcher;
import com.bizpulse.anomaly.notification.AlertHandler;
import com.bizpulse.anomaly.repository.AlertHistoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns classified anomalies into alerts: false-positive check, id and message, history, then
 * hand-off to every registered handler.
 */
@Service
public class AlertGenerationService {

    private static final Logger log = LoggerFactory.getLogger(AlertGenerationService.class);

    private static final DateTimeFormatter ID_TIME = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss")
            .withZone(ZoneOffset.UTC);

    private final FalsePositiveFilterService falsePositiveFilter;
    private final AlertHistoryRepository historyRepository;
    private final AlertDispatcher dispatcher;
    private final MetricsConfig metricsConfig;
    private final AlertingProperties properties;
    private final Clock clock;

    private final List<AlertHandler> handlers = new CopyOnWriteArrayList<>();
    private final AtomicLong alertSequence = new AtomicLong();
    private final AtomicLong anomalySequence = new AtomicLong();

    public AlertGenerationService(FalsePositiveFilterService falsePositiveFilter,
                                  AlertHistoryRepository historyRepository,
                                  AlertDispatcher dispatcher,
                                  List<AlertHandler> handlers,
                                  MetricsConfig metricsConfig,
                                  AlertingProperties properties,
                                  Clock clock) {
        this.falsePositiveFilter = falsePositiveFilter;
        this.historyRepository = historyRepository;
        this.dispatcher = dispatcher;
        this.metricsConfig = metricsConfig;
        this.properties = properties;
        this.clock = clock;
        handlers.forEach(this::registerHandler);
    }

    public void registerHandler(AlertHandler handler) {
        Objects.requireNonNull(handler, "handler must not be null");
        handlers.add(handler);
        log.info("Registered alert handler: {}", handler.getName());
    }

    public List<AlertHandler> getHandlers() {
        return List.copyOf(handlers);
    }

    public Optional<Alert> generateAlert(AnomalyRecord record, Severity severity) {
        return generateAlert(record, severity, properties.getMessageTemplate());
    }

    /**
     * Create, record and dispatch an alert.
     *
     * @param messageTemplate text where {@code {severity}} is replaced with the lower-cased
     *                        severity description
     * @return the alert, or empty if the anomaly was judged a false positive
     */
    public Optional<Alert> generateAlert(AnomalyRecord record, Severity severity, String messageTemplate) {
        Objects.requireNonNull(record, "record must not be null");
        Objects.requireNonNull(severity, "severity must not be null");

        if (falsePositiveFilter.isFalsePositive(record)) {
            log.info("Alert suppressed for anomaly {} ({})", record.getAnomalyId(), severity);
            return Optional.empty();
        }

        Instant now = clock.instant();
        String alertId = "ALERT_" + ID_TIME.format(now) + "_" + alertSequence.incrementAndGet();
        String anomalyId = record.getAnomalyId() != null
                ? record.getAnomalyId()
                : "ANOMALY_" + anomalySequence.incrementAndGet();
        String template = messageTemplate != null ? messageTemplate : properties.getMessageTemplate();
        String message = template.replace("{severity}", severity.getDescription().toLowerCase(Locale.ROOT));

        Alert alert = new Alert(alertId, anomalyId, now, severity, message,
                record.toDataSnapshot(), properties.getSource());
        historyRepository.save(alert);
        metricsConfig.recordAlert(severity.name());
        metricsConfig.updateOpenAlertCount(historyRepository.countUnhandled());
        log.info("Generated alert {} for anomaly {} with severity {}", alertId, anomalyId, severity);

        dispatcher.dispatch(alert, handlers);
        return Optional.of(alert);
    }

    /**
     * Generate alerts for index-aligned records and severities. The result has the same size;
     * an entry is {@code null} where the alert was suppressed or could not be created.
     */
    public List<Alert> generateBatchAlerts(List<AnomalyRecord> records, List<Severity> severities) {
        if (records.size() != severities.size()) {
            throw new IllegalArgumentException("records and severities differ in size: "
                    + records.size() + " vs " + severities.size());
        }
        List<Alert> alerts = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            try {
                alerts.add(generateAlert(records.get(i), severities.get(i)).orElse(null));
            } catch (RuntimeException e) {
                log.error("Failed to generate alert for batch item {}: {}", i, e.getMessage(), e);
                alerts.add(null);
            }
        }
        long generated = alerts.stream().filter(Objects::nonNull).count();
        log.info("Batch alert generation: {} of {} anomalies alerted", generated, records.size());
        return alerts;
    }

    /**
     * @param hoursBack only alerts created within this many hours; {@code null} for all
     * @param severity  only alerts currently at this severity; {@code null} for all
     */
    public List<Alert> getAlertHistory(Integer hoursBack, Severity severity) {
        Instant since = hoursBack == null ? null : clock.instant().minus(Duration.ofHours(hoursBack));
        return historyRepository.find(since, severity);
    }

    public List<Alert> getUnhandledAlerts() {
        return historyRepository.findUnhandled();
    }

    /**
     * Mark an alert as handled. Returns false if no such alert exists or it was already handled.
     */
    public boolean acknowledge(String alertId) {
        Optional<Alert> alert = historyRepository.findById(alertId);
        if (alert.isEmpty()) {
            log.warn("Cannot acknowledge unknown alert {}", alertId);
            return false;
        }
        boolean changed = alert.get().markHandled(clock.instant());
        if (changed) {
            log.info("Alert {} acknowledged", alertId);
            metricsConfig.updateOpenAlertCount(historyRepository.countUnhandled());
        }
        return changed;
    }
}
