package com.guildhub.gateway.broadcast;

import com.guildhub.core.msg.Envelope;
import com.guildhub.core.msg.Ops;
import com.guildhub.core.msg.PublishRequest;
import com.guildhub.core.msg.PublishScope;
import com.guildhub.core.permission.Permissions;
import com.guildhub.core.util.JsonUtils;
import com.guildhub.gateway.InMemoryStores;
import com.guildhub.gateway.TestSupport;
import com.guildhub.gateway.TestSupport.TestConnection;
import com.guildhub.gateway.permission.ChannelPermissionService;
import com.guildhub.gateway.registry.ConnectionRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PublishRequestRouterTest {

    private ConnectionRegistry registry;
    private PublishRequestRouter router;
    private TestSupport.Connections connections;

    @BeforeEach
    void setUp() {
        InMemoryStores stores = new InMemoryStores()
            .role("s1", "everyone", 0, Permissions.VIEW_CHANNEL)
            .grant("s1", "alice", "everyone")
            .channel("s1", "general");
        registry = new ConnectionRegistry();
        EventBroadcaster broadcaster = new EventBroadcaster(registry, TestSupport.metrics());
        ChannelPermissionService permissions = new ChannelPermissionService(stores, stores, stores, registry, broadcaster);
        router = new PublishRequestRouter(broadcaster, permissions);
        connections = new TestSupport.Connections();
    }

    @AfterEach
    void tearDown() {
        registry.dispose();
    }

    private TestConnection connect(String userId, String... serverIds) {
        TestConnection c = connections.create(userId, serverIds).drained();
        registry.add(c.connection).block();
        return c;
    }

    private static Envelope event() {
        return Envelope.of(Ops.MESSAGE_CREATE, Map.of("id", "m1"));
    }

    @Test
    void testRoutesEachScope() {
        TestConnection alice = connect("alice", "s1");
        TestConnection bob = connect("bob");

        StepVerifier.create(router.route(PublishRequest.builder().scope(PublishScope.ALL).event(event()).build()))
            .expectNext(2).verifyComplete();
        StepVerifier.create(router.route(PublishRequest.builder()
                .scope(PublishScope.ALL_EXCEPT).target("alice").event(event()).build()))
            .expectNext(1).verifyComplete();
        StepVerifier.create(router.route(PublishRequest.builder()
                .scope(PublishScope.USERS).targets(List.of("alice", "bob")).event(event()).build()))
            .expectNext(2).verifyComplete();
        StepVerifier.create(router.route(PublishRequest.builder()
                .scope(PublishScope.SERVER).target("s1").event(event()).build()))
            .expectNext(1).verifyComplete();
        StepVerifier.create(router.route(PublishRequest.builder()
                .scope(PublishScope.CHANNEL).target("general").event(event()).build()))
            .expectNext(1).verifyComplete();

        assertEquals(4, alice.frames.size());
        assertEquals(3, bob.frames.size());
    }

    @Test
    void testRoutesRequestDecodedFromJson() {
        TestConnection bob = connect("bob");
        String json = "{\"scope\":\"user\",\"target\":\"bob\","
            + "\"event\":{\"op\":\"friend_request_accept\",\"d\":{\"from\":\"alice\"}}}";

        StepVerifier.create(router.route(JsonUtils.readValue(json, PublishRequest.class)))
            .expectNext(1).verifyComplete();

        assertEquals(List.of("friend_request_accept"), bob.ops());
        assertTrue(bob.json().get(0).has("seq"));
    }

    @Test
    void testIncompleteRequestsRejected() {
        StepVerifier.create(router.route(PublishRequest.builder().scope(PublishScope.USER).event(event()).build()))
            .expectError(IllegalArgumentException.class)
            .verify();
        StepVerifier.create(router.route(PublishRequest.builder().scope(PublishScope.ALL).build()))
            .expectError(IllegalArgumentException.class)
            .verify();
    }
}
