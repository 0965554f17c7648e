package com.guildhub.gateway.permission;

import reactor.core.publisher.Mono;

/**
 * Looks up the server a channel belongs to.
 */
public interface ChannelDirectory {

    /**
     * @return server id, or empty if the channel does not exist
     */
    Mono<String> serverOf(String channelId);
}
