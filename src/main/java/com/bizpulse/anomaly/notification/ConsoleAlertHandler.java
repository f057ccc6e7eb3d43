package com.bizpulse.anomaly.notification;

import com.bizpulse.anomaly.model.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Writes a one-line summary of each alert to the application log.
 */
@Component
@ConditionalOnProperty(prefix = "anomaly.alerting.handlers.console", name = "enabled",
        havingValue = "true", matchIfMissing = true)
public class ConsoleAlertHandler implements AlertHandler {

    private static final Logger log = LoggerFactory.getLogger(ConsoleAlertHandler.class);

    @Override
    public String getName() {
        return "console";
    }

    @Override
    public void handle(Alert alert) {
        log.warn("[ALERT] {} severity={} level={} anomaly={} message=\"{}\"",
                alert.getAlertId(), alert.getSeverity(), alert.getEscalationLevel(),
                alert.getAnomalyId(), alert.getMessage());
    }
}
