package com.guildhub.gateway.registry;

/**
 * WebSocket close codes sent by the hub.
 */
public final class CloseCodes {
    private CloseCodes() {
    }

    public static final int NORMAL = 1000;

    /**
     * Node is shutting down or draining; the client should reconnect.
     */
    public static final int GOING_AWAY = 1001;

    /**
     * Outbound queue overflowed (slow consumer).
     */
    public static final int SLOW_CONSUMER = 1008;

    /**
     * No heartbeat within the grace period.
     */
    public static final int HEARTBEAT_TIMEOUT = 4000;

    /**
     * Closed on request of a domain service (ban, kick).
     */
    public static final int DISCONNECTED = 4001;
}
