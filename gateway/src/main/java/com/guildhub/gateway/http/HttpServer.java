package com.guildhub.gateway.http;

import com.guildhub.core.util.JsonUtils;
import com.guildhub.gateway.config.GatewayConfig;
import com.guildhub.gateway.drain.DrainService;
import com.guildhub.gateway.metrics.MetricsService;
import com.guildhub.gateway.ws.WebSocketUpgradeHandler;
import io.netty.channel.ChannelOption;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;

import java.time.Duration;
import java.util.function.Function;

/**
 * Single listener for the gateway: probes, drain control, Prometheus scrape and the
 * {@code /ws} upgrade.
 */
@RequiredArgsConstructor
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private static final String PROMETHEUS_CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    private final GatewayConfig config;
    private final WebSocketUpgradeHandler upgradeHandler;
    private final DrainService drainService;
    private final MetricsService metricsService;
    private DisposableServer server;

    /**
     * Binds the server on the configured port (0 picks a free one).
     *
     * @return bound server
     */
    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .option(ChannelOption.SO_REUSEADDR, true)
            .metrics(true, Function.identity())
            .route(routes -> routes
                .get("/healthz", this::health)
                .get("/readyz", this::readiness)
                .post("/drain", this::drain)
                .get("/drain/status", this::drainStatus)
                .get("/metrics", this::scrape)
                .get("/ws", upgradeHandler::handle)
            )
            .bind()
            .doOnNext(bound -> log.info("Gateway {} listening on port {}", config.getNodeId(), bound.port()))
            .doOnError(err -> log.error("Failed to bind gateway on port {}", config.getHttpPort(), err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(30));
        }
    }

    private Publisher<Void> health(HttpServerRequest req, HttpServerResponse res) {
        return drainService.isDraining()
            ? res.status(503).sendString(Mono.just("draining"))
            : res.status(200).sendString(Mono.just("ok"));
    }

    private Publisher<Void> readiness(HttpServerRequest req, HttpServerResponse res) {
        return drainService.isDraining()
            ? res.status(503).sendString(Mono.just("not ready: draining"))
            : res.status(200).sendString(Mono.just("ready"));
    }

    // Drain runs detached from the request so the caller gets 202 immediately.
    private Publisher<Void> drain(HttpServerRequest req, HttpServerResponse res) {
        int connections = drainService.getRemainingConnections();
        log.warn("Drain requested with {} live connection(s)", connections);
        drainService.startDrain().subscribe(
            null,
            err -> log.error("Drain failed", err)
        );
        return res.status(202).sendString(Mono.just("drain started, closing " + connections + " connection(s)"));
    }

    private Publisher<Void> drainStatus(HttpServerRequest req, HttpServerResponse res) {
        DrainStatus status = DrainStatus.builder()
            .draining(drainService.isDraining())
            .complete(drainService.isDrainComplete())
            .remaining(drainService.getRemainingConnections())
            .build();
        return res.status(200)
            .header("Content-Type", "application/json")
            .sendString(Mono.fromCallable(() -> JsonUtils.writeValueAsString(status)));
    }

    private Publisher<Void> scrape(HttpServerRequest req, HttpServerResponse res) {
        return res.header("Content-Type", PROMETHEUS_CONTENT_TYPE)
            .sendString(Mono.fromCallable(metricsService::scrape));
    }

    @Value
    @Builder
    public static class DrainStatus {
        boolean draining;
        boolean complete;
        int remaining;
    }
}
