package com.bizpulse.anomaly.notification;

import com.bizpulse.anomaly.config.AlertingProperties;
import com.bizpulse.anomaly.model.Alert;
import com.bizpulse.anomaly.model.Severity;
import com.bizpulse.anomaly.testutil.TestDataFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FileAlertHandlerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void appendsOneJsonLinePerAlert(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("out/alerts.log");
        AlertingProperties properties = TestDataFactory.alertingProperties();
        properties.getHandlers().getFile().setEnabled(true);
        properties.getHandlers().getFile().setPath(file.toString());
        FileAlertHandler handler = new FileAlertHandler(properties, objectMapper);

        Alert first = TestDataFactory.createAlert("ALERT_1", Severity.LOW, TestDataFactory.T0);
        Alert second = TestDataFactory.createAlert("ALERT_2", Severity.CRITICAL, TestDataFactory.T0);
        second.markHandled(TestDataFactory.T0);
        handler.handle(first);
        handler.handle(second);

        List<String> lines = Files.readAllLines(file);
        assertThat(lines).hasSize(2);

        JsonNode json = objectMapper.readTree(lines.get(0));
        assertThat(json.get("alert_id").asText()).isEqualTo("ALERT_1");
        assertThat(json.get("severity").asText()).isEqualTo("LOW");
        assertThat(json.get("timestamp").asText()).isEqualTo("2026-03-02T09:00:00Z");
        assertThat(json.get("data").get("revenue").asDouble()).isEqualTo(1250.0);
        assertThat(json.get("escalation_level").asInt()).isZero();

        assertThat(objectMapper.readTree(lines.get(1)).get("handled").asBoolean()).isTrue();
        assertThat(handler.getName()).isEqualTo("file");
    }
}
