package com.guildhub.gateway.ws;

import com.guildhub.core.msg.Envelope;
import com.guildhub.core.msg.InboundMessage;
import com.guildhub.core.msg.Ops;
import com.guildhub.core.msg.Payloads;
import com.guildhub.core.util.BytesUtils;
import com.guildhub.gateway.broadcast.EventBroadcaster;
import com.guildhub.gateway.config.GatewayConfig;
import com.guildhub.gateway.liveness.LivenessSupervisor;
import com.guildhub.gateway.metrics.MetricsService;
import com.guildhub.gateway.presence.PresenceTracker;
import com.guildhub.gateway.registry.CloseCodes;
import com.guildhub.gateway.registry.Connection;
import com.guildhub.gateway.registry.ConnectionFactory;
import com.guildhub.gateway.registry.ConnectionRegistry;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.netty.channel.AbortedException;
import reactor.netty.http.websocket.WebsocketInbound;
import reactor.netty.http.websocket.WebsocketOutbound;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Lifecycle of one admitted WebSocket connection.
 * <p>
 * Protocol (server → client): {@code ready {online_user_ids}} first, then {@code heartbeat_ack}
 * replies and published events as {@code {op, d, seq}}.
 * </p>
 * <p>
 * Protocol (client → server):
 * <ul>
 *   <li>{@code heartbeat}: refreshes liveness, answered with {@code heartbeat_ack}</li>
 *   <li>{@code presence_update {status}}: manual status change (online/idle/dnd/invisible, or
 *       offline meaning invisible)</li>
 * </ul>
 * Anything else, or any frame that is not valid JSON, is dropped.
 * </p>
 */
public class WebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(WebSocketHandler.class);

    private static final Duration REFUSED_CLOSE_TIMEOUT = Duration.ofSeconds(5);

    private final GatewayConfig config;
    private final ConnectionRegistry registry;
    private final ConnectionFactory connectionFactory;
    private final EventBroadcaster broadcaster;
    private final PresenceTracker presenceTracker;
    private final LivenessSupervisor livenessSupervisor;
    private final MetricsService metricsService;

    public WebSocketHandler(GatewayConfig config,
                            ConnectionRegistry registry,
                            ConnectionFactory connectionFactory,
                            EventBroadcaster broadcaster,
                            PresenceTracker presenceTracker,
                            LivenessSupervisor livenessSupervisor,
                            MetricsService metricsService) {
        this.config = config;
        this.registry = registry;
        this.connectionFactory = connectionFactory;
        this.broadcaster = broadcaster;
        this.presenceTracker = presenceTracker;
        this.livenessSupervisor = livenessSupervisor;
        this.metricsService = metricsService;
    }

    /**
     * Registers the connection and runs it until either side closes.
     *
     * @param inbound   WebSocket inbound
     * @param outbound  WebSocket outbound
     * @param userId    authenticated user
     * @param serverIds memberships captured for this connection
     * @return Publisher completing when the connection ends
     */
    public Publisher<Void> handle(WebsocketInbound inbound, WebsocketOutbound outbound,
                                  String userId, Set<String> serverIds) {
        MDC.put("userId", userId);
        Connection connection = connectionFactory.create(userId, serverIds, new WebSocketTransport(outbound));

        inbound.withConnection(netty -> netty.onDispose(() -> {
            log.debug("WebSocket channel disposed for connection {}", connection.getId());
            registry.remove(connection).subscribe();
        }));

        // Queued before registration so it precedes any broadcast on this connection
        broadcaster.sendTo(connection, Envelope.of(Ops.READY, new Payloads.Ready(readySnapshot(userId))));

        return registry.add(connection)
            .flatMap(admitted -> {
                if (!admitted) {
                    return refused(inbound, connection);
                }
                return Mono.when(
                    outbound.sendString(connection.outbound()
                        .doOnNext(frame -> metricsService.recordNetworkOutboundWs(BytesUtils.utf8Length(frame)))),
                    handleInbound(inbound, connection)
                );
            })
            .onErrorResume(err -> {
                log.error("WebSocket error for connection {} of user {}", connection.getId(), userId, err);
                return registry.remove(connection).then();
            });
    }

    private Mono<Void> refused(WebsocketInbound inbound, Connection connection) {
        if (connection.isClosed()) {
            log.debug("Connection {} closed before admission", connection.getId());
            return Mono.empty();
        }
        // Upgrade raced a drain: tell the client to go elsewhere, then wait for its close reply
        metricsService.recordForcedClose("drain");
        connection.close(CloseCodes.GOING_AWAY, "server shutting down");
        return inbound.receive()
            .then()
            .timeout(REFUSED_CLOSE_TIMEOUT)
            .onErrorResume(err -> Mono.empty());
    }

    private List<String> readySnapshot(String userId) {
        Set<String> online = registry.onlineUserIds();
        if (!presenceTracker.isInvisible(userId)) {
            online.add(userId);
        }
        return new ArrayList<>(presenceTracker.visibleOnline(online));
    }

    private Mono<Void> handleInbound(WebsocketInbound inbound, Connection connection) {
        return inbound.aggregateFrames(config.getMaxFrameBytes())
            .receive()
            .asString()
            .doOnNext(frame -> handleFrame(connection, frame))
            .doOnError(err -> {
                // AbortedException is expected when the peer goes away
                if (!(err instanceof AbortedException)) {
                    log.error("Fatal error in inbound stream for connection {}", connection.getId(), err);
                }
            })
            .onErrorResume(err -> Mono.empty())
            .then(Mono.defer(() -> registry.remove(connection)))
            .then();
    }

    private void handleFrame(Connection connection, String frame) {
        metricsService.recordNetworkInboundWs(BytesUtils.utf8Length(frame));

        InboundMessage message = InboundMessage.parse(frame).orElse(null);
        if (message == null) {
            metricsService.recordInboundDropped();
            log.debug("Dropping unrecognized frame from connection {}", connection.getId());
            return;
        }

        if (message instanceof InboundMessage.Heartbeat) {
            livenessSupervisor.onHeartbeat(connection);
            broadcaster.sendTo(connection, Envelope.of(Ops.HEARTBEAT_ACK));
        } else if (message instanceof InboundMessage.PresenceUpdate update) {
            presenceTracker.setManualStatus(connection.getUserId(), update.getStatus());
        }
    }
}
