package com.guildhub.gateway.registry;

import com.guildhub.gateway.config.GatewayConfig;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;

/**
 * Creates {@link Connection} objects with their bounded outbound queue.
 */
public class ConnectionFactory {
    private final GatewayConfig config;
    private final Clock clock;

    public ConnectionFactory(GatewayConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    /**
     * Creates a new, not yet registered connection.
     *
     * @param userId    owning user
     * @param serverIds server memberships captured at connect time
     * @param transport underlying socket
     * @return Connection instance
     */
    public Connection create(String userId, Set<String> serverIds, Transport transport) {
        // Unicast sink over a fixed-capacity queue: a full queue surfaces as FAIL_OVERFLOW
        Sinks.Many<String> sink = Sinks.many().unicast().onBackpressureBuffer(
            new ArrayBlockingQueue<>(config.getSendQueueSize())
        );

        return new Connection(UUID.randomUUID().toString(), userId, serverIds, clock.millis(), sink, transport);
    }

}
