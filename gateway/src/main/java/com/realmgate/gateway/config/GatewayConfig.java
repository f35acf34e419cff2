package com.realmgate.gateway.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration for a gateway node, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class GatewayConfig {

    @Builder.Default
    String nodeId = "gateway-1";

    // 0 binds an ephemeral port
    @Builder.Default
    int wsPort = 8080;

    @Builder.Default
    int adminPort = 8081;

    @Builder.Default
    String wsPath = "/ws";

    @Builder.Default
    int maxConnections = 5000;

    @Builder.Default
    Duration inactivityTimeout = Duration.ofMinutes(5);

    @Builder.Default
    Duration sweepInterval = Duration.ofSeconds(60);

    // Per-connection queued outbound frames before the connection is closed
    @Builder.Default
    int outboundBufferSize = 256;

    @Builder.Default
    int eventBufferSize = 8192;

    @Builder.Default
    int workerThreads = Runtime.getRuntime().availableProcessors();

    @Builder.Default
    int maxFramePayload = 65536;

    public static GatewayConfig fromEnv() {
        return GatewayConfig.builder()
            .nodeId(getEnv("NODE_ID", "gateway-1"))
            .wsPort(Integer.parseInt(getEnv("WS_PORT", "8080")))
            .adminPort(Integer.parseInt(getEnv("ADMIN_PORT", "8081")))
            .wsPath(getEnv("WS_PATH", "/ws"))
            .maxConnections(Integer.parseInt(getEnv("MAX_CONNECTIONS", "5000")))
            .inactivityTimeout(Duration.ofSeconds(Long.parseLong(getEnv("INACTIVITY_TIMEOUT_SEC", "300"))))
            .sweepInterval(Duration.ofSeconds(Long.parseLong(getEnv("SWEEP_INTERVAL_SEC", "60"))))
            .outboundBufferSize(Integer.parseInt(getEnv("OUTBOUND_BUFFER_SIZE", "256")))
            .eventBufferSize(Integer.parseInt(getEnv("EVENT_BUFFER_SIZE", "8192")))
            .workerThreads(Integer.parseInt(getEnv("WORKER_THREADS",
                String.valueOf(Runtime.getRuntime().availableProcessors()))))
            .maxFramePayload(Integer.parseInt(getEnv("MAX_FRAME_PAYLOAD", "65536")))
            .build();
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
