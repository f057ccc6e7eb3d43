package com.bizpulse.anomaly.notification;

import com.bizpulse.anomaly.config.AlertingProperties;
import com.bizpulse.anomaly.model.Alert;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends each alert payload as one JSON line to a file.
 */
@Component
@ConditionalOnProperty(prefix = "anomaly.alerting.handlers.file", name = "enabled", havingValue = "true")
public class FileAlertHandler implements AlertHandler {

    private static final Logger log = LoggerFactory.getLogger(FileAlertHandler.class);

    private final Path path;
    private final ObjectMapper objectMapper;

    public FileAlertHandler(AlertingProperties properties, ObjectMapper objectMapper) {
        this.path = Path.of(properties.getHandlers().getFile().getPath());
        this.objectMapper = objectMapper;
        log.info("File alert handler writing to {}", path.toAbsolutePath());
    }

    @Override
    public String getName() {
        return "file";
    }

    @Override
    public synchronized void handle(Alert alert) throws IOException {
        String line = objectMapper.writeValueAsString(alert.toPayload()) + System.lineSeparator();
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, line, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }
}
