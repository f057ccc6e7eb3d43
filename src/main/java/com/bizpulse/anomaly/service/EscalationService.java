package com.bizpulse.anomaly.service;

import com.bizpulse.anomaly.config.AlertingProperties;
import com.bizpulse.anomaly.config.MetricsConfig;
import com.bizpulse.anomaly.model.Alert;
import com.bizpulse.anomaly.model.EscalationRule;
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
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Raises the severity of alerts nobody has handled.
 *
 * <p>Deadlines are anchored at the alert's creation time. An alert sitting at severity S is due
 * once {@code timestamp + sum(timeout of every severity from its initial one up to S)} has
 * passed. Escalating moves it one step along its rule and bumps {@code escalationLevel}; the
 * next deadline then lies one further timeout ahead, so repeated checks inside a window are
 * no-ops.</p>
 */
@Service
public class EscalationService {

    private static final Logger log = LoggerFactory.getLogger(EscalationService.class);

    private final Map<Severity, EscalationRule> rules;
    private final AlertHistoryRepository historyRepository;
    private final AlertDispatcher dispatcher;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    private final List<AlertHandler> escalationHandlers = new CopyOnWriteArrayList<>();

    public EscalationService(AlertingProperties properties,
                             AlertHistoryRepository historyRepository,
                             AlertDispatcher dispatcher,
                             List<AlertHandler> handlers,
                             MetricsConfig metricsConfig,
                             Clock clock) {
        this.rules = buildRules(properties.getEscalation().getRules());
        this.historyRepository = historyRepository;
        this.dispatcher = dispatcher;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
        escalationHandlers.addAll(handlers);
        log.info("Escalation rules loaded: {}", rules);
    }

    static Map<Severity, EscalationRule> buildRules(Map<Severity, AlertingProperties.RuleSpec> specs) {
        Map<Severity, EscalationRule> rules = new EnumMap<>(Severity.class);
        if (specs == null) {
            return rules;
        }
        specs.forEach((severity, spec) -> {
            if (spec.getTimeoutMinutes() < 0) {
                throw new IllegalArgumentException("Escalation timeout for " + severity + " must be >= 0");
            }
            if (spec.getEscalateTo() != null && spec.getEscalateTo().compareTo(severity) <= 0) {
                throw new IllegalArgumentException("Escalation rule for " + severity
                        + " must target a higher severity, got " + spec.getEscalateTo());
            }
            rules.put(severity, new EscalationRule(Duration.ofMinutes(spec.getTimeoutMinutes()), spec.getEscalateTo()));
        });
        return Collections.unmodifiableMap(rules);
    }

    public void registerEscalationHandler(AlertHandler handler) {
        escalationHandlers.add(Objects.requireNonNull(handler, "handler must not be null"));
        log.info("Registered escalation handler: {}", handler.getName());
    }

    public Map<Severity, EscalationRule> getRules() {
        return rules;
    }

    /**
     * Escalate the alert one step if its current deadline has passed.
     *
     * @return true if the alert was escalated by this call
     */
    public boolean checkEscalation(Alert alert) {
        Instant now = clock.instant();
        Severity from;
        Severity to;
        synchronized (alert) {
            if (alert.isHandled()) {
                return false;
            }
            from = alert.getSeverity();
            EscalationRule rule = rules.get(from);
            if (rule == null || rule.isTerminal()) {
                return false;
            }
            Instant deadline = deadlineFor(alert, from);
            if (now.isBefore(deadline)) {
                return false;
            }
            to = rule.escalateTo();
            alert.escalateTo(to);
        }

        log.warn("Alert {} escalated {} -> {} (level {})", alert.getAlertId(), from, to, alert.getEscalationLevel());
        metricsConfig.recordEscalation(from.name(), to.name());
        dispatcher.dispatch(alert, escalationHandlers);
        return true;
    }

    /**
     * Check every unhandled alert once.
     *
     * @return number of alerts escalated
     */
    public int sweep() {
        int escalated = 0;
        for (Alert alert : historyRepository.findUnhandled()) {
            try {
                if (checkEscalation(alert)) {
                    escalated++;
                }
            } catch (RuntimeException e) {
                log.error("Escalation check failed for alert {}: {}", alert.getAlertId(), e.getMessage(), e);
            }
        }
        if (escalated > 0) {
            log.info("Escalation sweep escalated {} alerts", escalated);
        }
        return escalated;
    }

    /**
     * Follows the rule chain from the initial severity to {@code current}, summing each step's
     * timeout including the current one.
     */
    Instant deadlineFor(Alert alert, Severity current) {
        Duration total = Duration.ZERO;
        Severity step = alert.getInitialSeverity();
        while (step != null) {
            EscalationRule rule = rules.get(step);
            if (rule != null) {
                total = total.plus(rule.timeout());
            }
            if (step == current || rule == null) {
                break;
            }
            step = rule.escalateTo();
        }
        return alert.getTimestamp().plus(total);
    }
}
