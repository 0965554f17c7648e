package com.guildhub.gateway.presence;

import reactor.core.publisher.Mono;

/**
 * Reaction to a user's occupancy transition.
 */
@FunctionalInterface
public interface UserPresenceCallback {
    Mono<Void> handle(String userId);
}
