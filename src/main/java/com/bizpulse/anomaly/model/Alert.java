package com.bizpulse.anomaly.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An alert raised for one anomaly.
 *
 * Identity, creation time, message and data are fixed at construction. Severity only moves
 * upwards through escalation, and the handled flag only flips once. All mutable state is
 * guarded by the alert's own monitor so a reader never sees a severity without the matching
 * escalation level.
 */
public class Alert {

    private final String alertId;
    private final String anomalyId;
    private final Instant timestamp;
    private final Severity initialSeverity;
    private final String message;
    private final Map<String, Object> data;
    private final String source;

    private Severity severity;
    private int escalationLevel;
    private boolean handled;
    private Instant handledTimestamp;

    public Alert(String alertId, String anomalyId, Instant timestamp, Severity severity,
                 String message, Map<String, Object> data, String source) {
        this.alertId = Objects.requireNonNull(alertId, "alertId must not be null");
        this.anomalyId = anomalyId;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.initialSeverity = Objects.requireNonNull(severity, "severity must not be null");
        this.severity = severity;
        this.message = message;
        this.data = data == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        this.source = source;
    }

    public String getAlertId() {
        return alertId;
    }

    public String getAnomalyId() {
        return anomalyId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Severity getInitialSeverity() {
        return initialSeverity;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Object> getData() {
        return data;
    }

    public String getSource() {
        return source;
    }

    public synchronized Severity getSeverity() {
        return severity;
    }

    public synchronized int getEscalationLevel() {
        return escalationLevel;
    }

    public synchronized boolean isHandled() {
        return handled;
    }

    public synchronized Instant getHandledTimestamp() {
        return handledTimestamp;
    }

    /**
     * Raise the severity by one escalation step.
     *
     * @throws IllegalArgumentException if {@code target} is not above the current severity
     */
    public synchronized void escalateTo(Severity target) {
        if (target.compareTo(severity) <= 0) {
            throw new IllegalArgumentException("Alert " + alertId + " cannot move from "
                    + severity + " to " + target);
        }
        this.severity = target;
        this.escalationLevel++;
    }

    /**
     * Mark the alert as acknowledged. Returns false if it already was.
     */
    public synchronized boolean markHandled(Instant at) {
        if (handled) {
            return false;
        }
        this.handled = true;
        this.handledTimestamp = at;
        return true;
    }

    /**
     * Sink-facing view of the alert with snake_case keys, ISO-8601 timestamp and severity name.
     */
    public synchronized Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("alert_id", alertId);
        payload.put("anomaly_id", anomalyId);
        payload.put("timestamp", timestamp.toString());
        payload.put("severity", severity.name());
        payload.put("message", message);
        payload.put("data", data);
        payload.put("source", source);
        payload.put("escalation_level", escalationLevel);
        payload.put("handled", handled);
        return payload;
    }

    @Override
    public synchronized String toString() {
        return "Alert{" + alertId + ", " + severity + ", level=" + escalationLevel
                + ", handled=" + handled + "}";
    }
}
