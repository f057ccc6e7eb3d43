package com.bizpulse.anomaly.notification;

import com.bizpulse.anomaly.model.Alert;

/**
 * A sink for alerts. Called from the dispatch pool, possibly concurrently for different alerts.
 * Exceptions thrown here are logged by the dispatcher and never reach the caller.
 */
public interface AlertHandler {

    String getName();

    void handle(Alert alert) throws Exception;
}
