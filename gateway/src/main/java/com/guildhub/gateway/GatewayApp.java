package com.guildhub.gateway;

import com.guildhub.gateway.broadcast.EventBroadcaster;
import com.guildhub.gateway.broadcast.PublishRequestRouter;
import com.guildhub.gateway.config.GatewayConfig;
import com.guildhub.gateway.drain.DrainService;
import com.guildhub.gateway.http.HttpServer;
import com.guildhub.gateway.kafka.IEventBusConsumer;
import com.guildhub.gateway.kafka.KafkaEventConsumer;
import com.guildhub.gateway.liveness.LivenessSupervisor;
import com.guildhub.gateway.metrics.MetricsService;
import com.guildhub.gateway.permission.ChannelPermissionService;
import com.guildhub.gateway.presence.PresenceTracker;
import com.guildhub.gateway.redis.RedisStore;
import com.guildhub.gateway.registry.ConnectionFactory;
import com.guildhub.gateway.registry.ConnectionRegistry;
import com.guildhub.gateway.ws.WebSocketHandler;
import com.guildhub.gateway.ws.WebSocketUpgradeHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;

/**
 * Main entry point for a gateway node.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Serve WebSockets at /ws (query: token)</li>
 *   <li>Track presence and broadcast it to every connection</li>
 *   <li>Evict connections that stop sending heartbeats</li>
 *   <li>Fan out publish requests consumed from Kafka</li>
 *   <li>Expose /healthz, /readyz, /drain and /metrics</li>
 * </ul>
 * </p>
 */
public class GatewayApp {
    private static final Logger log = LoggerFactory.getLogger(GatewayApp.class);

    public static void main(String[] args) {
        GatewayConfig config = GatewayConfig.fromEnv();
        MDC.put("nodeId", config.getNodeId());

        log.info("Starting gateway node: {}", config.getNodeId());
        log.info("  Kafka: {} (enabled={})", config.getKafkaBootstrap(), config.isKafkaEnabled());
        log.info("  Redis: {}", config.getRedisUrl());

        Clock clock = Clock.systemUTC();
        MetricsService metricsService = MetricsService.withPrometheus(config);
        RedisStore redisStore = new RedisStore(config);

        ConnectionRegistry registry = new ConnectionRegistry();
        metricsService.bindRegistryGauges(registry);

        EventBroadcaster broadcaster = new EventBroadcaster(registry, metricsService);
        PresenceTracker presenceTracker = new PresenceTracker(broadcaster, metricsService);
        registry.addListener(presenceTracker);

        // Manual status choices survive restarts
        presenceTracker.onManualPresenceChange(redisStore::updateStatus);

        LivenessSupervisor livenessSupervisor = new LivenessSupervisor(
            registry, metricsService, clock, config.getHeartbeatGrace(), config.getLivenessSweepInterval()
        );

        ChannelPermissionService channelPermissions = new ChannelPermissionService(
            redisStore, redisStore, redisStore, registry, broadcaster
        );
        PublishRequestRouter router = new PublishRequestRouter(broadcaster, channelPermissions);
        IEventBusConsumer eventBusConsumer = new KafkaEventConsumer(config, router);

        DrainService drainService = new DrainService(registry, metricsService, config.getDrainTimeout());
        WebSocketHandler wsHandler = new WebSocketHandler(
            config, registry, new ConnectionFactory(config, clock), broadcaster, presenceTracker,
            livenessSupervisor, metricsService
        );
        WebSocketUpgradeHandler upgradeHandler = new WebSocketUpgradeHandler(
            config, wsHandler, redisStore, redisStore, redisStore, presenceTracker, drainService, metricsService
        );

        if (config.isKafkaEnabled()) {
            eventBusConsumer.start().block(Duration.ofSeconds(30));
        }

        HttpServer httpServer = new HttpServer(config, upgradeHandler, drainService, metricsService);
        httpServer.start();
        livenessSupervisor.start();

        log.info("Gateway node {} is ready", config.getNodeId());

        handleShutdown(config, drainService, eventBusConsumer, livenessSupervisor, httpServer, registry, redisStore);

        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    private static void handleShutdown(GatewayConfig config,
                                       DrainService drainService,
                                       IEventBusConsumer eventBusConsumer,
                                       LivenessSupervisor livenessSupervisor,
                                       HttpServer httpServer,
                                       ConnectionRegistry registry,
                                       RedisStore redisStore) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received, initiating graceful shutdown...");
            MDC.put("nodeId", config.getNodeId());

            // Stop accepting work before closing connections
            if (config.isKafkaEnabled()) {
                eventBusConsumer.stop().block(Duration.ofSeconds(10));
            }
            livenessSupervisor.stop();

            try {
                drainService.startDrain().block(config.getDrainTimeout().plusSeconds(5));
            } catch (RuntimeException e) {
                log.error("Drain did not complete cleanly", e);
            }

            httpServer.stop();
            registry.dispose();
            redisStore.close();

            log.info("Shutdown complete");
        }));
    }
}
