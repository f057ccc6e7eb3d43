package com.bizpulse.anomaly.model;

import java.time.Duration;

/**
 * Escalation policy for one severity: how long an unhandled alert may sit at that
 * severity and which severity it moves to afterwards. A {@code null} target marks
 * the severity as terminal.
 */
public record EscalationRule(Duration timeout, Severity escalateTo) {

    public boolean isTerminal() {
        return escalateTo == null;
    }
}
