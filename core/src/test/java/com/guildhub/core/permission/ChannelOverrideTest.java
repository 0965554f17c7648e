package com.guildhub.core.permission;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChannelOverrideTest {

    @Test
    void testOverlappingBitsRejected() {
        InvalidOverrideException e = assertThrows(InvalidOverrideException.class,
            () -> ChannelOverride.validated("c1", "r1", 0b101, 0b001));

        assertTrue(e.getMessage().contains("overlapping"));
    }

    @Test
    void testServerWideBitsRejected() {
        assertThrows(InvalidOverrideException.class,
            () -> ChannelOverride.validated("c1", "r1", Permissions.MANAGE_ROLES, 0));
        assertThrows(InvalidOverrideException.class,
            () -> ChannelOverride.validated("c1", "r1", 0, Permissions.ADMINISTRATOR));
    }

    @Test
    void testDisjointOverridableMasksAccepted() {
        ChannelOverride override = assertDoesNotThrow(() -> ChannelOverride.validated(
            "c1", "r1", Permissions.SEND_MESSAGES | Permissions.SPEAK, Permissions.VIEW_CHANNEL));

        assertEquals(Permissions.SEND_MESSAGES | Permissions.SPEAK, override.getAllow());
        assertEquals(Permissions.VIEW_CHANNEL, override.getDeny());
    }

    @Test
    void testEmptyOverride() {
        assertTrue(ChannelOverride.validated("c1", "r1", 0, 0).isEmpty());
    }
}
