package com.guildhub.gateway.ws;

import com.guildhub.gateway.registry.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.websocket.WebsocketOutbound;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link Transport} over a Reactor Netty WebSocket.
 * <p>
 * Sends a close frame; if that cannot be flushed in time (a stalled peer is the usual reason the
 * hub closes a connection) the channel is disposed outright.
 * </p>
 */
class WebSocketTransport implements Transport {
    private static final Logger log = LoggerFactory.getLogger(WebSocketTransport.class);

    private static final Duration CLOSE_FRAME_TIMEOUT = Duration.ofSeconds(5);

    private final WebsocketOutbound outbound;
    private final AtomicBoolean closing = new AtomicBoolean(false);

    WebSocketTransport(WebsocketOutbound outbound) {
        this.outbound = outbound;
    }

    @Override
    public void close(int code, String reason) {
        if (!closing.compareAndSet(false, true)) {
            return;
        }
        outbound.sendClose(code, reason)
            .timeout(CLOSE_FRAME_TIMEOUT)
            .onErrorResume(err -> {
                log.debug("Close frame ({}) not delivered, disposing channel: {}", code, err.toString());
                outbound.withConnection(connection -> connection.dispose());
                return Mono.empty();
            })
            .subscribe();
    }
}
