package com.bizpulse.anomaly.notification;

import com.bizpulse.anomaly.model.Alert;
import com.bizpulse.anomaly.model.Severity;
import com.bizpulse.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class WebhookAlertHandlerTest {

    private static final String URL = "http://hooks.example.test/alerts";

    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private WebhookAlertHandler handler;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        handler = new WebhookAlertHandler(URL, restTemplate);
    }

    @Test
    void postsAlertPayloadAsJson() {
        Alert alert = TestDataFactory.createAlert("ALERT_7", Severity.HIGH, TestDataFactory.T0);
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.alert_id").value("ALERT_7"))
                .andExpect(jsonPath("$.severity").value("HIGH"))
                .andExpect(jsonPath("$.source").value("anomaly_detector"))
                .andRespond(withSuccess());

        handler.handle(alert);

        server.verify();
    }

    @Test
    void serverError_isRaisedToTheDispatcher() {
        Alert alert = TestDataFactory.createAlert("ALERT_8", Severity.LOW, TestDataFactory.T0);
        server.expect(requestTo(URL)).andRespond(withServerError());

        assertThatThrownBy(() -> handler.handle(alert)).isInstanceOf(HttpServerErrorException.class);
    }

    @Test
    void missingUrl_failsAtStartup() {
        assertThatThrownBy(() -> new WebhookAlertHandler(" ", restTemplate))
                .isInstanceOf(IllegalStateException.class);
    }
}
