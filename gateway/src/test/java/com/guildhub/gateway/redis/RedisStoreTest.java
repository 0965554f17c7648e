package com.guildhub.gateway.redis;

import com.guildhub.core.permission.ChannelOverride;
import com.guildhub.core.permission.Permissions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Stored value parsing; needs no Redis.
 */
class RedisStoreTest {

    @Test
    void testParsesAllowDenyPair() {
        String stored = Permissions.VIEW_CHANNEL + ":" + Permissions.SEND_MESSAGES;

        Optional<ChannelOverride> override = RedisStore.parseOverride("c1", "r1", stored);

        assertTrue(override.isPresent());
        assertEquals("c1", override.get().getChannelId());
        assertEquals("r1", override.get().getRoleId());
        assertEquals(Permissions.VIEW_CHANNEL, override.get().getAllow());
        assertEquals(Permissions.SEND_MESSAGES, override.get().getDeny());
    }

    @Test
    @DisplayName("Corrupt stored masks are skipped instead of failing the channel")
    void testMalformedMasksSkipped() {
        assertTrue(RedisStore.parseOverride("c1", "r1", "1024").isEmpty());
        assertTrue(RedisStore.parseOverride("c1", "r1", "").isEmpty());
        assertTrue(RedisStore.parseOverride("c1", "r1", "abc:1").isEmpty());
        assertTrue(RedisStore.parseOverride("c1", "r1", "1:").isEmpty());
    }
}
