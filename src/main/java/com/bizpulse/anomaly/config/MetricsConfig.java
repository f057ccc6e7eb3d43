package com.bizpulse.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger openAlertCount;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.openAlertCount = registry.gauge("alerts.open", new AtomicInteger(0));
    }

    public void recordDetection(int rows, long anomalies) {
        Counter.builder("detection.rows.count")
                .register(registry)
                .increment(rows);

        Counter.builder("detection.anomalies.count")
                .register(registry)
                .increment(anomalies);
    }

    public void recordStrategyFlags(String strategy, long flagged) {
        Counter.builder("strategy.flagged.count")
                .tag("strategy", strategy)
                .register(registry)
                .increment(flagged);
    }

    public void recordTraining(String strategy, boolean success) {
        Counter.builder("strategy.training.count")
                .tag("strategy", strategy)
                .tag("status", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    public void recordSeverityScore(String severity, double severityScore) {
        DistributionSummary.builder("severity.score")
                .tag("severity", severity)
                .register(registry)
                .record(severityScore);
    }

    public void recordAlert(String severity) {
        Counter.builder("alert.generated.count")
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordSuppressed(String reason) {
        Counter.builder("alert.suppressed.count")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordEviction(boolean handled) {
        Counter.builder("alert.evicted.count")
                .tag("status", handled ? "handled" : "unhandled")
                .register(registry)
                .increment();
    }

    public void recordEscalation(String from, String to) {
        Counter.builder("alert.escalated.count")
                .tag("from", from)
                .tag("to", to)
                .register(registry)
                .increment();
    }

    public void recordHandlerOutcome(String handler, String status) {
        Counter.builder("alert.handler.count")
                .tag("handler", handler)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void updateOpenAlertCount(int count) {
        openAlertCount.set(count);
    }
}
