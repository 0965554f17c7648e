package com.guildhub.core.msg;

import com.guildhub.core.presence.PresenceStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InboundMessageTest {

    @Test
    void testHeartbeat() {
        Optional<InboundMessage> message = InboundMessage.parse("{\"op\":\"heartbeat\"}");

        assertSame(InboundMessage.Heartbeat.INSTANCE, message.orElseThrow());
    }

    @Test
    void testPresenceUpdate() {
        Optional<InboundMessage> message = InboundMessage.parse("{\"op\":\"presence_update\",\"d\":{\"status\":\"dnd\"}}");

        assertEquals(new InboundMessage.PresenceUpdate(PresenceStatus.DND), message.orElseThrow());
    }

    @Test
    @DisplayName("Choosing offline is tracked as invisible")
    void testPresenceOfflineMeansInvisible() {
        Optional<InboundMessage> message = InboundMessage.parse("{\"op\":\"presence_update\",\"d\":{\"status\":\"offline\"}}");

        assertEquals(new InboundMessage.PresenceUpdate(PresenceStatus.INVISIBLE), message.orElseThrow());
    }

    @Test
    @DisplayName("Malformed, unknown and incomplete frames are ignored")
    void testIgnoredFrames() {
        assertTrue(InboundMessage.parse("not json").isEmpty());
        assertTrue(InboundMessage.parse("[1,2]").isEmpty());
        assertTrue(InboundMessage.parse("{\"d\":{}}").isEmpty());
        assertTrue(InboundMessage.parse("{\"op\":42}").isEmpty());
        assertTrue(InboundMessage.parse("{\"op\":\"message_create\",\"d\":{}}").isEmpty());
        assertTrue(InboundMessage.parse("{\"op\":\"presence_update\"}").isEmpty());
        assertTrue(InboundMessage.parse("{\"op\":\"presence_update\",\"d\":{\"status\":\"away\"}}").isEmpty());
    }
}
