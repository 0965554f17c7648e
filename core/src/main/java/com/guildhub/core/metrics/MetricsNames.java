package com.guildhub.core.metrics;

/**
 * Micrometer metric names used by the gateway.
 * <p>
 * <b>Naming convention:</b> {@code hub.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Gauge: Live connections registered on this node.
     * <p>
     * Tags: node_id
     * </p>
     */
    public static final String CONNECTIONS = "hub.gateway.connections";

    /**
     * Gauge: Distinct users with at least one live connection.
     * <p>
     * Tags: node_id
     * </p>
     */
    public static final String ONLINE_USERS = "hub.gateway.online.users";

    /**
     * Counter: Events published, per audience scope.
     * <p>
     * Tags: node_id, scope
     * </p>
     */
    public static final String EVENTS_PUBLISHED_TOTAL = "hub.broadcast.events.total";

    /**
     * Counter: Frames enqueued to connections (one event fans out to many frames).
     * <p>
     * Tags: node_id
     * </p>
     */
    public static final String FRAMES_DELIVERED_TOTAL = "hub.broadcast.frames.total";

    /**
     * Summary: Recipients per published event.
     * <p>
     * Tags: node_id
     * </p>
     */
    public static final String FANOUT_RECIPIENTS = "hub.broadcast.fanout.recipients";

    /**
     * Counter: Connections force-closed.
     * <p>
     * Tags: node_id, reason (queue_overflow/liveness_timeout/drain/disconnect)
     * </p>
     */
    public static final String FORCED_CLOSES_TOTAL = "hub.gateway.forced.closes.total";

    /**
     * Counter: Inbound frames dropped because they could not be decoded.
     * <p>
     * Tags: node_id
     * </p>
     */
    public static final String INBOUND_DROPPED_TOTAL = "hub.gateway.inbound.dropped.total";

    /**
     * Counter: Upgrade requests refused before admission.
     * <p>
     * Tags: node_id, reason (unauthorized/banned/draining/error)
     * </p>
     */
    public static final String REJECTED_UPGRADES_TOTAL = "hub.gateway.upgrades.rejected.total";

    /**
     * Counter: Network traffic outbound to WebSocket (bytes).
     * <p>
     * Tags: node_id
     * </p>
     */
    public static final String NETWORK_OUTBOUND_WS_BYTES = "hub.gateway.network.outbound.ws.bytes";

    /**
     * Counter: Network traffic inbound from WebSocket (bytes).
     * <p>
     * Tags: node_id
     * </p>
     */
    public static final String NETWORK_INBOUND_WS_BYTES = "hub.gateway.network.inbound.ws.bytes";

    /**
     * Counter: Presence callbacks that failed.
     * <p>
     * Tags: node_id
     * </p>
     */
    public static final String PRESENCE_CALLBACK_FAILURES_TOTAL = "hub.presence.callback.failures.total";
}
