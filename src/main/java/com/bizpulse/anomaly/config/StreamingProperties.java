package com.bizpulse.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "anomaly.streaming")
public class StreamingProperties {
    private boolean enabled = true;
    private int pollIntervalSeconds = 10;
    private int batchSize = 100;
}
