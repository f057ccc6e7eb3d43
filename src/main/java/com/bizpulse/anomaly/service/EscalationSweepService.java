package com.bizpulse.anomaly.service;

import com.bizpulse.anomaly.config.AlertingProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically runs the escalation sweep over all unhandled alerts. Once shutdown starts no new
 * cycle begins; an in-flight cycle completes.
 */
@Service
public class EscalationSweepService {

    private static final Logger log = LoggerFactory.getLogger(EscalationSweepService.class);

    private final EscalationService escalationService;
    private final AlertingProperties config;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public EscalationSweepService(EscalationService escalationService, AlertingProperties config) {
        this.escalationService = escalationService;
        this.config = config;
    }

    @Scheduled(fixedRateString = "${anomaly.alerting.escalation.sweep-interval-seconds:60}",
               timeUnit = TimeUnit.SECONDS,
               initialDelayString = "${anomaly.alerting.escalation.sweep-interval-seconds:60}")
    public void runSweep() {
        if (!config.getEscalation().isEnabled() || stopped.get()) {
            return;
        }
        try {
            int escalated = escalationService.sweep();
            log.debug("Escalation sweep finished, {} escalated", escalated);
        } catch (RuntimeException e) {
            log.error("Escalation sweep failed: {}", e.getMessage(), e);
        }
    }

    @PreDestroy
    public void stop() {
        if (stopped.compareAndSet(false, true)) {
            log.info("Escalation sweep stopped; no further cycles will run");
        }
    }

    public boolean isStopped() {
        return stopped.get();
    }
}
