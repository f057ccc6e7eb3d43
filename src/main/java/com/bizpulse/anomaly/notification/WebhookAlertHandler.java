package com.bizpulse.anomaly.notification;

import com.bizpulse.anomaly.config.AlertingProperties;
import com.bizpulse.anomaly.model.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * POSTs each alert payload as JSON to the configured URL. Non-2xx responses raise, which the
 * dispatcher logs and counts as an error.
 */
@Component
@ConditionalOnProperty(prefix = "anomaly.alerting.handlers.webhook", name = "enabled", havingValue = "true")
public class WebhookAlertHandler implements AlertHandler {

    private static final Logger log = LoggerFactory.getLogger(WebhookAlertHandler.class);

    private final String url;
    private final RestTemplate restTemplate;

    @Autowired
    public WebhookAlertHandler(AlertingProperties properties) {
        this(properties.getHandlers().getWebhook().getUrl(), buildRestTemplate(properties.getHandlers().getWebhook()));
    }

    WebhookAlertHandler(String url, RestTemplate restTemplate) {
        if (url == null || url.isBlank()) {
            throw new IllegalStateException("anomaly.alerting.handlers.webhook.url must be set when the webhook handler is enabled");
        }
        this.url = url;
        this.restTemplate = restTemplate;
        log.info("Webhook alert handler posting to {}", url);
    }

    private static RestTemplate buildRestTemplate(AlertingProperties.Webhook config) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(config.getConnectTimeoutMs());
        factory.setReadTimeout(config.getReadTimeoutMs());
        return new RestTemplate(factory);
    }

    @Override
    public String getName() {
        return "webhook";
    }

    @Override
    public void handle(Alert alert) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<Map<String, Object>> request = new HttpEntity<>(alert.toPayload(), headers);
        ResponseEntity<String> response = restTemplate.postForEntity(url, request, String.class);
        log.debug("Webhook accepted alert {} with status {}", alert.getAlertId(), response.getStatusCode());
    }
}
