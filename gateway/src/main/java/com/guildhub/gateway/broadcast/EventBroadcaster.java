package com.guildhub.gateway.broadcast;

import com.guildhub.core.msg.Envelope;
import com.guildhub.core.msg.PublishScope;
import com.guildhub.core.util.JsonUtils;
import com.guildhub.gateway.metrics.MetricsService;
import com.guildhub.gateway.registry.CloseCodes;
import com.guildhub.gateway.registry.Connection;
import com.guildhub.gateway.registry.ConnectionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Delivers events to live connections selected from the {@link ConnectionRegistry}.
 * <p>
 * Every published event is stamped with the next value of a node-wide sequence counter and
 * serialized once; the same frame is queued to each recipient. Recipients are snapshotted when the
 * event is published, so a connection that registers concurrently may or may not receive it.
 * </p>
 */
public class EventBroadcaster implements IEventPublisher {
    private static final Logger log = LoggerFactory.getLogger(EventBroadcaster.class);

    private final ConnectionRegistry registry;
    private final MetricsService metricsService;
    private final AtomicLong seq = new AtomicLong();

    public EventBroadcaster(ConnectionRegistry registry, MetricsService metricsService) {
        this.registry = registry;
        this.metricsService = metricsService;
    }

    @Override
    public int toAll(Envelope event) {
        return fanOut(PublishScope.ALL, registry.allConnections(), event);
    }

    @Override
    public int toAllExcept(String excludedUserId, Envelope event) {
        List<Connection> recipients = new ArrayList<>();
        for (Connection connection : registry.allConnections()) {
            if (!connection.getUserId().equals(excludedUserId)) {
                recipients.add(connection);
            }
        }
        return fanOut(PublishScope.ALL_EXCEPT, recipients, event);
    }

    @Override
    public int toUser(String userId, Envelope event) {
        return fanOut(PublishScope.USER, registry.connectionsOf(userId), event);
    }

    @Override
    public int toUsers(Collection<String> userIds, Envelope event) {
        Set<Connection> recipients = new LinkedHashSet<>();
        for (String userId : new LinkedHashSet<>(userIds)) {
            recipients.addAll(registry.connectionsOf(userId));
        }
        return fanOut(PublishScope.USERS, recipients, event);
    }

    @Override
    public int toServer(String serverId, Envelope event) {
        return fanOut(PublishScope.SERVER, registry.connectionsInServer(serverId), event);
    }

    @Override
    public int toChannelViewers(String serverId, Set<String> viewerIds, Envelope event) {
        List<Connection> recipients = new ArrayList<>();
        for (Connection connection : registry.connectionsInServer(serverId)) {
            if (viewerIds.contains(connection.getUserId())) {
                recipients.add(connection);
            }
        }
        return fanOut(PublishScope.CHANNEL, recipients, event);
    }

    @Override
    public int disconnectUser(String userId) {
        Set<Connection> connections = registry.connectionsOf(userId);
        for (Connection connection : connections) {
            closeAndRemove(connection, CloseCodes.DISCONNECTED, "disconnected", "disconnect");
        }
        if (!connections.isEmpty()) {
            log.info("Disconnected {} connection(s) of user {}", connections.size(), userId);
        }
        return connections.size();
    }

    /**
     * Queues a control frame (ready, heartbeat_ack) to a single connection. Control frames carry no
     * sequence number.
     *
     * @param connection target connection
     * @param event      event to send
     * @return true if the frame was queued
     */
    public boolean sendTo(Connection connection, Envelope event) {
        String frame = JsonUtils.writeValueAsString(event);
        return offer(connection, frame);
    }

    private int fanOut(PublishScope scope, Collection<Connection> recipients, Envelope event) {
        Envelope stamped = event.toBuilder().seq(seq.incrementAndGet()).build();

        String frame;
        try {
            frame = JsonUtils.writeValueAsString(stamped);
        } catch (RuntimeException e) {
            log.error("Failed to serialize event op={} seq={}, not publishing", stamped.getOp(), stamped.getSeq(), e);
            return 0;
        }

        int delivered = 0;
        for (Connection connection : recipients) {
            if (offer(connection, frame)) {
                delivered++;
            }
        }

        metricsService.recordPublished(scope, delivered);
        log.debug("Published op={} seq={} scope={} to {} connection(s)",
            stamped.getOp(), stamped.getSeq(), scope.wireName(), delivered);
        return delivered;
    }

    private boolean offer(Connection connection, String frame) {
        switch (connection.offer(frame)) {
            case ENQUEUED -> {
                return true;
            }
            case OVERFLOW -> {
                log.warn("Outbound queue full for connection {} of user {}, closing",
                    connection.getId(), connection.getUserId());
                closeAndRemove(connection, CloseCodes.SLOW_CONSUMER, "send queue overflow", "queue_overflow");
                return false;
            }
            default -> {
                return false;
            }
        }
    }

    private void closeAndRemove(Connection connection, int code, String reason, String metricReason) {
        metricsService.recordForcedClose(metricReason);
        connection.close(code, reason);
        registry.remove(connection).subscribe(
            null,
            err -> log.error("Failed to remove connection {} after close", connection.getId(), err)
        );
    }
}
