package com.guildhub.gateway.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration for a gateway node, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class GatewayConfig {

    String nodeId;
    int httpPort;
    String kafkaBootstrap;
    String eventsTopic;
    boolean kafkaEnabled;
    String redisUrl;

    // Per-connection outbound queue capacity (frames)
    int sendQueueSize;

    // Client heartbeat cadence and how many missed intervals are tolerated
    Duration heartbeatInterval;
    int heartbeatGraceMultiplier;
    Duration livenessSweepInterval;

    int maxFrameBytes;
    Duration drainTimeout;

    public static GatewayConfig fromEnv() {
        return GatewayConfig.builder()
                .nodeId(getEnv("NODE_ID", "gateway-node-1"))
                .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8080")))
                .kafkaBootstrap(getEnv("KAFKA_BOOTSTRAP", "localhost:9092"))
                .eventsTopic(getEnv("KAFKA_EVENTS_TOPIC", "hub.events"))
                .kafkaEnabled(Boolean.parseBoolean(getEnv("KAFKA_ENABLED", "true")))
                .redisUrl(getEnv("REDIS_URL", "redis://localhost:6379"))
                .sendQueueSize(Integer.parseInt(getEnv("SEND_QUEUE_SIZE", "256")))
                .heartbeatInterval(Duration.ofSeconds(Integer.parseInt(getEnv("HEARTBEAT_INTERVAL_SEC", "30"))))
                .heartbeatGraceMultiplier(Integer.parseInt(getEnv("HEARTBEAT_GRACE_MULTIPLIER", "3")))
                .livenessSweepInterval(Duration.ofSeconds(Integer.parseInt(getEnv("LIVENESS_SWEEP_SEC", "5"))))
                .maxFrameBytes(Integer.parseInt(getEnv("MAX_FRAME_BYTES", "4096")))
                .drainTimeout(Duration.ofSeconds(Integer.parseInt(getEnv("DRAIN_TIMEOUT_SEC", "30"))))
                .build();
    }

    /**
     * Time without a heartbeat after which a connection is considered dead.
     */
    public Duration getHeartbeatGrace() {
        return heartbeatInterval.multipliedBy(heartbeatGraceMultiplier);
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
