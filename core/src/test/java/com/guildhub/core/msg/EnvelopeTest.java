package com.guildhub.core.msg;

import com.fasterxml.jackson.databind.JsonNode;
import com.guildhub.core.presence.PresenceStatus;
import com.guildhub.core.util.JsonUtils;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

class EnvelopeTest {

    @Test
    void testPresenceWireFormat() {
        Envelope envelope = Envelope.of(Ops.PRESENCE_UPDATE, new Payloads.Presence("u1", PresenceStatus.IDLE))
            .toBuilder().seq(7L).build();

        JsonNode json = JsonUtils.mapper().valueToTree(envelope);

        assertEquals("presence_update", json.get("op").asText());
        assertEquals("u1", json.get("d").get("user_id").asText());
        assertEquals("idle", json.get("d").get("status").asText());
        assertEquals(7L, json.get("seq").asLong());
    }

    @Test
    void testControlFrameOmitsDataAndSeq() {
        String json = JsonUtils.writeValueAsString(Envelope.of(Ops.HEARTBEAT_ACK));

        assertEquals("{\"op\":\"heartbeat_ack\"}", json);
    }

    @Test
    void testReadyPayload() {
        JsonNode json = JsonUtils.mapper().valueToTree(
            Envelope.of(Ops.READY, new Payloads.Ready(List.of("u1", "u2"))));

        assertEquals(2, json.get("d").get("online_user_ids").size());
        assertFalse(json.has("seq"));
    }

    @Test
    void testPublishRequestFromJson() {
        String json = "{\"scope\":\"server\",\"target\":\"s1\","
            + "\"event\":{\"op\":\"message_create\",\"d\":{\"id\":\"m1\"}}}";

        PublishRequest request = JsonUtils.readValue(json, PublishRequest.class);

        assertEquals(PublishScope.SERVER, request.getScope());
        assertEquals("s1", request.getTarget());
        assertEquals("message_create", request.getEvent().getOp());
        assertNull(request.getEvent().getSeq());
    }
}
