package com.bizpulse.anomaly.config;

import com.bizpulse.anomaly.model.FalsePositivePattern;
import com.bizpulse.anomaly.model.Severity;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "anomaly.alerting")
public class AlertingProperties {

    private String source = "anomaly_detector";
    private String messageTemplate = "Anomaly detected with {severity} severity";

    // Oldest handled alerts are evicted first once the history grows past this
    private int maxHistory = 10_000;

    private long handlerTimeoutMs = 5_000;
    private int dispatchThreads = 4;
    private int dispatchQueueCapacity = 1_000;
    private int shutdownGraceSeconds = 10;

    private FalsePositive falsePositive = new FalsePositive();
    private Escalation escalation = new Escalation();
    private Handlers handlers = new Handlers();

    @Data
    public static class FalsePositive {
        private double similarityThreshold = 0.95;
        // A signature seen more than this many times within the window is treated as noise
        private int frequencyThreshold = 10;
        private int frequencyWindowMinutes = 60;
        private int signaturePrecision = 2;
        private List<FalsePositivePattern> patterns = new ArrayList<>();
    }

    @Data
    public static class Escalation {
        private boolean enabled = true;
        private int sweepIntervalSeconds = 60;
        private Map<Severity, RuleSpec> rules = defaultRules();

        private static Map<Severity, RuleSpec> defaultRules() {
            Map<Severity, RuleSpec> rules = new EnumMap<>(Severity.class);
            rules.put(Severity.LOW, new RuleSpec(60, Severity.MEDIUM));
            rules.put(Severity.MEDIUM, new RuleSpec(30, Severity.HIGH));
            rules.put(Severity.HIGH, new RuleSpec(15, Severity.CRITICAL));
            rules.put(Severity.CRITICAL, new RuleSpec(5, null));
            return rules;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RuleSpec {
        private long timeoutMinutes;
        private Severity escalateTo;   // null = terminal
    }

    @Data
    public static class Handlers {
        private Console console = new Console();
        private File file = new File();
        private Webhook webhook = new Webhook();
    }

    @Data
    public static class Console {
        private boolean enabled = true;
    }

    @Data
    public static class File {
        private boolean enabled = false;
        private String path = "alerts.log";
    }

    @Data
    public static class Webhook {
        private boolean enabled = false;
        private String url;
        private int connectTimeoutMs = 2_000;
        private int readTimeoutMs = 5_000;
    }
}
