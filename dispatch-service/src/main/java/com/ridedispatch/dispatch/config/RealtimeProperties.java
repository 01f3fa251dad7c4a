package com.ridedispatch.dispatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

@Data
@ConfigurationProperties(prefix = "realtime")
public class RealtimeProperties {

    private String endpoint = "/ws";
    private List<String> allowedOrigins = List.of("*");
    /** Identifies this process on the cluster bus. */
    private String instanceId = "gw-" + UUID.randomUUID().toString().substring(0, 8);
    private long pingIntervalMs = 30_000;
    private Duration livenessTimeout = Duration.ofSeconds(60);
    private String relayTopic = "ws:message";
    private String broadcastTopic = "ws:broadcast";
    private int sendTimeLimitMs = 5_000;
    private int sendBufferSizeBytes = 512 * 1024;
}
