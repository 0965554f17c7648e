package com.guildhub.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.guildhub.core.util.JsonUtils;
import com.guildhub.gateway.config.GatewayConfig;
import com.guildhub.gateway.metrics.MetricsService;
import com.guildhub.gateway.registry.Connection;
import com.guildhub.gateway.registry.ConnectionFactory;
import com.guildhub.gateway.registry.Transport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

/**
 * Shared fixtures for gateway tests.
 */
public final class TestSupport {
    private TestSupport() {
    }

    public static GatewayConfig config() {
        return GatewayConfig.builder()
            .nodeId("gateway-test")
            .httpPort(0)
            .kafkaBootstrap("localhost:9092")
            .eventsTopic("hub.events")
            .kafkaEnabled(false)
            .redisUrl("redis://localhost:6379")
            .sendQueueSize(8)
            .heartbeatInterval(Duration.ofSeconds(30))
            .heartbeatGraceMultiplier(3)
            .livenessSweepInterval(Duration.ofSeconds(5))
            .maxFrameBytes(4096)
            .drainTimeout(Duration.ofSeconds(5))
            .build();
    }

    public static MetricsService metrics() {
        return new MetricsService(new SimpleMeterRegistry(), config());
    }

    /**
     * Waits for a condition that is reached asynchronously, such as a removal on the registry thread.
     */
    public static void await(BooleanSupplier condition) {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Condition not met within 5s");
            }
            Thread.onSpinWait();
        }
    }

    /**
     * Transport stub recording close calls.
     */
    public static class RecordingTransport implements Transport {
        public final List<Integer> closeCodes = new CopyOnWriteArrayList<>();

        @Override
        public void close(int code, String reason) {
            closeCodes.add(code);
        }
    }

    /**
     * A connection plus everything written to it.
     */
    public static class TestConnection {
        public final Connection connection;
        public final RecordingTransport transport;
        public final List<String> frames = new CopyOnWriteArrayList<>();

        TestConnection(Connection connection, RecordingTransport transport) {
            this.connection = connection;
            this.transport = transport;
        }

        /**
         * Starts draining the outbound queue into {@link #frames}, as a socket writer would.
         */
        public TestConnection drained() {
            connection.outbound().subscribe(frames::add);
            return this;
        }

        public List<JsonNode> json() {
            return frames.stream().map(JsonUtils::readTreeOrNull).collect(Collectors.toList());
        }

        public List<String> ops() {
            return json().stream().map(node -> node.get("op").asText()).collect(Collectors.toList());
        }
    }

    public static class Connections {
        private final ConnectionFactory factory;

        public Connections(GatewayConfig config, Clock clock) {
            this.factory = new ConnectionFactory(config, clock);
        }

        public Connections() {
            this(config(), Clock.systemUTC());
        }

        public TestConnection create(String userId, String... serverIds) {
            RecordingTransport transport = new RecordingTransport();
            return new TestConnection(factory.create(userId, Set.of(serverIds), transport), transport);
        }
    }

    /**
     * Clock the test moves by hand.
     */
    public static class MutableClock extends Clock {
        private volatile Instant now;

        public MutableClock(Instant start) {
            this.now = start;
        }

        public void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
