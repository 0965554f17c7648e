package com.guildhub.gateway.registry;

/**
 * The underlying bidirectional channel of a {@link Connection}, reduced to what the hub needs to
 * end it.
 */
@FunctionalInterface
public interface Transport {

    /**
     * Closes the transport with a WebSocket close code. Must be safe to call more than once and on
     * an already-closed transport.
     *
     * @param code   close code
     * @param reason human-readable reason
     */
    void close(int code, String reason);
}
