package com.guildhub.gateway.registry;

import lombok.Getter;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One live client transport session.
 * <p>
 * Owned by the {@link ConnectionRegistry}. Frames are queued in a bounded outbound buffer that the
 * socket writer drains; {@link #offer(String)} never blocks. Emission is serialized per connection,
 * which keeps frames in publish order.
 * </p>
 */
public class Connection {

    /**
     * Result of queueing one frame.
     */
    public enum OfferResult {
        ENQUEUED,
        OVERFLOW,
        CLOSED
    }

    @Getter
    private final String id;
    @Getter
    private final String userId;
    @Getter
    private final Set<String> serverIds;
    @Getter
    private final long connectedAtMillis;

    private final AtomicLong lastHeartbeatMillis;
    private final Sinks.Many<String> sink;
    private final Transport transport;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public Connection(String id, String userId, Set<String> serverIds, long connectedAtMillis,
                      Sinks.Many<String> sink, Transport transport) {
        this.id = id;
        this.userId = userId;
        this.serverIds = Set.copyOf(serverIds);
        this.connectedAtMillis = connectedAtMillis;
        this.lastHeartbeatMillis = new AtomicLong(connectedAtMillis);
        this.sink = sink;
        this.transport = transport;
    }

    /**
     * Queues a frame for delivery.
     *
     * @param frame serialized envelope
     * @return {@link OfferResult#OVERFLOW} if the queue is full, {@link OfferResult#CLOSED} if the
     *         connection is already closed
     */
    public synchronized OfferResult offer(String frame) {
        if (closed.get()) {
            return OfferResult.CLOSED;
        }
        Sinks.EmitResult result = sink.tryEmitNext(frame);
        if (result.isSuccess()) {
            return OfferResult.ENQUEUED;
        }
        return result == Sinks.EmitResult.FAIL_OVERFLOW ? OfferResult.OVERFLOW : OfferResult.CLOSED;
    }

    /**
     * Frames to write to the socket, in queue order. Completes once the connection is closed.
     */
    public Flux<String> outbound() {
        return sink.asFlux();
    }

    public void touch(long nowMillis) {
        lastHeartbeatMillis.set(nowMillis);
    }

    public long getLastHeartbeatMillis() {
        return lastHeartbeatMillis.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Stops accepting frames and completes the outbound stream. Does not touch the transport.
     *
     * @return true on the first call
     */
    public synchronized boolean markClosed() {
        if (!closed.compareAndSet(false, true)) {
            return false;
        }
        sink.tryEmitComplete();
        return true;
    }

    /**
     * Closes this connection from the hub side: stops the outbound stream and closes the transport.
     *
     * @param code   WebSocket close code
     * @param reason close reason
     */
    public void close(int code, String reason) {
        markClosed();
        transport.close(code, reason);
    }

    @Override
    public String toString() {
        return "Connection[" + id + ", user=" + userId + "]";
    }
}
