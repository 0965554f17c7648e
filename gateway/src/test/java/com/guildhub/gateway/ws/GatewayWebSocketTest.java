package com.guildhub.gateway.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.guildhub.core.presence.PresenceStatus;
import com.guildhub.core.util.JsonUtils;
import com.guildhub.gateway.InMemoryStores;
import com.guildhub.gateway.TestSupport;
import com.guildhub.gateway.broadcast.EventBroadcaster;
import com.guildhub.gateway.config.GatewayConfig;
import com.guildhub.gateway.drain.DrainService;
import com.guildhub.gateway.http.HttpServer;
import com.guildhub.gateway.liveness.LivenessSupervisor;
import com.guildhub.gateway.metrics.MetricsService;
import com.guildhub.gateway.presence.PresenceTracker;
import com.guildhub.gateway.registry.CloseCodes;
import com.guildhub.gateway.registry.Connection;
import com.guildhub.gateway.registry.ConnectionFactory;
import com.guildhub.gateway.registry.ConnectionRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Runs the real HTTP server on a random port against in-memory stores.
 */
class GatewayWebSocketTest {

    private InMemoryStores stores;
    private ConnectionRegistry registry;
    private PresenceTracker presenceTracker;
    private DrainService drainService;
    private HttpServer httpServer;
    private MetricsService metrics;
    private int port;

    @BeforeEach
    void setUp() {
        GatewayConfig config = TestSupport.config();
        stores = new InMemoryStores()
            .user("t-alice", "alice", "s1", "s2")
            .user("t-bob", "bob", "s1")
            .user("t-mallory", "mallory");
        stores.banned.add("mallory");

        metrics = MetricsService.withPrometheus(config);
        registry = new ConnectionRegistry();
        EventBroadcaster broadcaster = new EventBroadcaster(registry, metrics);
        presenceTracker = new PresenceTracker(broadcaster, metrics);
        registry.addListener(presenceTracker);
        presenceTracker.onManualPresenceChange(stores::updateStatus);

        Clock clock = Clock.systemUTC();
        LivenessSupervisor liveness = new LivenessSupervisor(
            registry, metrics, clock, config.getHeartbeatGrace(), config.getLivenessSweepInterval());
        drainService = new DrainService(registry, metrics, config.getDrainTimeout());
        WebSocketHandler wsHandler = new WebSocketHandler(
            config, registry, new ConnectionFactory(config, clock), broadcaster, presenceTracker, liveness, metrics);
        WebSocketUpgradeHandler upgradeHandler = new WebSocketUpgradeHandler(
            config, wsHandler, stores, stores, stores, presenceTracker, drainService, metrics);

        httpServer = new HttpServer(config, upgradeHandler, drainService, metrics);
        DisposableServer server = httpServer.start();
        port = server.port();
    }

    @AfterEach
    void tearDown() {
        httpServer.stop();
        registry.dispose();
        metrics.close();
    }

    private int upgradeStatus(String query) {
        return HttpClient.create()
            .get()
            .uri("http://localhost:" + port + "/ws" + query)
            .response()
            .map(response -> response.status().code())
            .block(Duration.ofSeconds(10));
    }

    private List<String> exchange(String token, String clientFrame, int expectedFrames) {
        return HttpClient.create()
            .websocket()
            .uri("ws://localhost:" + port + "/ws?token=" + token)
            .handle((in, out) -> in.receive().asString().take(expectedFrames)
                .mergeWith(out.sendString(Mono.just(clientFrame)).then().then(Mono.<String>empty())))
            .collectList()
            .block(Duration.ofSeconds(10));
    }

    private static List<String> ops(List<String> frames) {
        return frames.stream()
            .map(frame -> JsonUtils.readTreeOrNull(frame).get("op").asText())
            .collect(Collectors.toList());
    }

    @Test
    @DisplayName("Upgrades without a valid token are refused before the handshake")
    void testRejectedUpgrades() {
        assertEquals(401, upgradeStatus(""));
        assertEquals(401, upgradeStatus("?token="));
        assertEquals(401, upgradeStatus("?token=forged"));
        assertEquals(403, upgradeStatus("?token=t-mallory"));
        assertEquals(0, registry.size());
    }

    @Test
    @DisplayName("Ready comes first, heartbeats are acknowledged, closing the socket takes the user offline")
    void testReadyHeartbeatAndDisconnect() {
        List<String> frames = exchange("t-alice", "{\"op\":\"heartbeat\"}", 3);

        assertEquals(List.of("ready", "presence_update", "heartbeat_ack"), ops(frames));
        JsonNode ready = JsonUtils.readTreeOrNull(frames.get(0));
        assertEquals("alice", ready.get("d").get("online_user_ids").get(0).asText());

        TestSupport.await(() -> registry.size() == 0);
        assertEquals(PresenceStatus.OFFLINE, presenceTracker.statusOf("alice"));
    }

    @Test
    @DisplayName("A presence_update frame changes status, echoes to the user and is persisted")
    void testPresenceUpdateOverSocket() {
        List<String> frames = exchange("t-alice", "{\"op\":\"presence_update\",\"d\":{\"status\":\"dnd\"}}", 3);

        // ready, own online broadcast, own dnd echo
        JsonNode last = JsonUtils.readTreeOrNull(frames.get(2));
        assertEquals("presence_update", last.get("op").asText());
        assertEquals("dnd", last.get("d").get("status").asText());
        TestSupport.await(() -> stores.statuses.get("alice") == PresenceStatus.DND);
    }

    @Test
    @DisplayName("A stored appear-offline preference keeps the user out of their own ready snapshot")
    void testInvisibleUserReady() {
        stores.statuses.put("alice", PresenceStatus.INVISIBLE);

        List<String> frames = exchange("t-alice", "{\"op\":\"heartbeat\"}", 2);

        // No presence broadcast of their own arrival
        assertEquals(List.of("ready", "heartbeat_ack"), ops(frames));
        JsonNode ready = JsonUtils.readTreeOrNull(frames.get(0));
        assertEquals(0, ready.get("d").get("online_user_ids").size());
    }

    @Test
    @DisplayName("Memberships are captured at connect; a failing lookup connects with none")
    void testMembershipCapture() {
        AtomicReference<Set<String>> captured = new AtomicReference<>();
        HttpClient.create()
            .websocket()
            .uri("ws://localhost:" + port + "/ws?token=t-alice")
            .handle((in, out) -> in.receive().asString().take(1)
                .doOnNext(frame -> captured.set(registry.connectionsOf("alice").stream()
                    .findFirst().map(Connection::getServerIds).orElse(Set.of()))))
            .blockLast(Duration.ofSeconds(10));
        assertEquals(Set.of("s1", "s2"), captured.get());

        stores.failMemberships = true;
        captured.set(null);
        HttpClient.create()
            .websocket()
            .uri("ws://localhost:" + port + "/ws?token=t-bob")
            .handle((in, out) -> in.receive().asString().take(1)
                .doOnNext(frame -> captured.set(registry.connectionsOf("bob").stream()
                    .findFirst().map(Connection::getServerIds).orElse(null))))
            .blockLast(Duration.ofSeconds(10));
        assertTrue(captured.get().isEmpty());
    }

    @Test
    void testDrainingRefusesUpgrades() {
        drainService.startDrain().block(Duration.ofSeconds(5));

        assertEquals(503, upgradeStatus("?token=t-alice"));
    }

    @Test
    @DisplayName("Drain endpoint flips probes and reports status as JSON")
    void testDrainEndpoints() {
        assertEquals(200, get("/readyz"));

        int accepted = HttpClient.create()
            .post()
            .uri("http://localhost:" + port + "/drain")
            .response()
            .map(response -> response.status().code())
            .block(Duration.ofSeconds(10));
        assertEquals(202, accepted);
        assertEquals(503, get("/healthz"));
        assertEquals(503, get("/readyz"));

        TestSupport.await(drainService::isDrainComplete);
        String body = HttpClient.create()
            .get()
            .uri("http://localhost:" + port + "/drain/status")
            .responseContent()
            .aggregate()
            .asString()
            .block(Duration.ofSeconds(10));
        JsonNode status = JsonUtils.readTreeOrNull(body);
        assertTrue(status.get("draining").asBoolean());
        assertTrue(status.get("complete").asBoolean());
        assertEquals(0, status.get("remaining").asInt());
    }

    @Test
    @DisplayName("An upgrade still loading memberships when the drain starts is closed with going-away")
    void testUpgradeRacingDrainIsRefused() {
        stores.membershipDelay = Duration.ofMillis(500);
        AtomicReference<Integer> closeCode = new AtomicReference<>();
        Disposable client = HttpClient.create()
            .websocket()
            .uri("ws://localhost:" + port + "/ws?token=t-alice")
            .handle((in, out) -> in.receiveCloseStatus()
                .doOnNext(status -> closeCode.set(status.code())))
            .subscribe();
        try {
            TestSupport.await(() -> stores.membershipLookups.get() > 0);
            drainService.startDrain().block(Duration.ofSeconds(5));
            assertTrue(drainService.isDrainComplete());

            TestSupport.await(() -> closeCode.get() != null);
            assertEquals(CloseCodes.GOING_AWAY, closeCode.get());
            assertEquals(0, registry.size());
            assertFalse(registry.isOnline("alice"));
        } finally {
            client.dispose();
        }
    }

    @Test
    @DisplayName("Hub meters are scraped from /metrics in Prometheus format")
    void testMetricsEndpoint() {
        assertEquals(401, upgradeStatus("?token=forged"));

        String body = HttpClient.create()
            .get()
            .uri("http://localhost:" + port + "/metrics")
            .responseContent()
            .aggregate()
            .asString()
            .block(Duration.ofSeconds(10));

        assertTrue(body.contains("hub_gateway_upgrades_rejected_total"));
        assertTrue(body.contains("reason=\"unauthorized\""));
    }

    private int get(String path) {
        return HttpClient.create()
            .get()
            .uri("http://localhost:" + port + path)
            .response()
            .map(response -> response.status().code())
            .block(Duration.ofSeconds(10));
    }
}
