package com.guildhub.gateway.permission;

import com.guildhub.core.permission.ChannelOverride;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Persistence of per-channel role overrides. At most one override exists per (channel, role).
 */
public interface ChannelOverrideStore {

    Flux<ChannelOverride> overridesOf(String channelId);

    /**
     * Overrides of every channel in the server.
     */
    Flux<ChannelOverride> overridesInServer(String serverId);

    /**
     * Inserts or replaces the override for its (channel, role).
     */
    Mono<Void> save(ChannelOverride override);

    /**
     * @return true if an override existed
     */
    Mono<Boolean> delete(String channelId, String roleId);
}
