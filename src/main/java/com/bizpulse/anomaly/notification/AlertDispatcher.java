package com.bizpulse.anomaly.notification;

import com.bizpulse.anomaly.config.AlertingProperties;
import com.bizpulse.anomaly.config.MetricsConfig;
import com.bizpulse.anomaly.model.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs alert handlers off the caller's thread, one task per handler, each bounded by
 * {@code handler-timeout-ms}. A failing, slow or rejected handler is logged and counted; it
 * never affects the other handlers or the caller.
 */
@Component
public class AlertDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AlertDispatcher.class);

    private final Executor executor;
    private final long timeoutMs;
    private final MetricsConfig metricsConfig;

    public AlertDispatcher(@Qualifier("alertDispatchExecutor") Executor executor,
                           AlertingProperties properties,
                           MetricsConfig metricsConfig) {
        this.executor = executor;
        this.timeoutMs = properties.getHandlerTimeoutMs();
        this.metricsConfig = metricsConfig;
    }

    /**
     * @return a future completing once every handler finished, failed or timed out; it never
     *         completes exceptionally
     */
    public CompletableFuture<Void> dispatch(Alert alert, List<AlertHandler> handlers) {
        List<CompletableFuture<Void>> calls = new ArrayList<>(handlers.size());
        for (AlertHandler handler : handlers) {
            calls.add(dispatchOne(alert, handler));
        }
        return CompletableFuture.allOf(calls.toArray(new CompletableFuture[0]));
    }

    private CompletableFuture<Void> dispatchOne(Alert alert, AlertHandler handler) {
        CompletableFuture<Void> call;
        try {
            call = CompletableFuture.runAsync(() -> invoke(handler, alert), executor);
        } catch (RejectedExecutionException e) {
            log.error("Dispatch queue full, dropping alert {} for handler [{}]", alert.getAlertId(), handler.getName());
            metricsConfig.recordHandlerOutcome(handler.getName(), "rejected");
            return CompletableFuture.completedFuture(null);
        }
        return call.orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .handle((ignored, error) -> {
                    if (error == null) {
                        metricsConfig.recordHandlerOutcome(handler.getName(), "success");
                        return null;
                    }
                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                            ? error.getCause() : error;
                    if (cause instanceof TimeoutException) {
                        log.warn("Handler [{}] timed out after {} ms for alert {}",
                                handler.getName(), timeoutMs, alert.getAlertId());
                        metricsConfig.recordHandlerOutcome(handler.getName(), "timeout");
                    } else {
                        log.error("Handler [{}] failed for alert {}: {}",
                                handler.getName(), alert.getAlertId(), cause.getMessage(), cause);
                        metricsConfig.recordHandlerOutcome(handler.getName(), "error");
                    }
                    return null;
                });
    }

    private static void invoke(AlertHandler handler, Alert alert) {
        try {
            handler.handle(alert);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new CompletionException(e);
        }
    }
}
