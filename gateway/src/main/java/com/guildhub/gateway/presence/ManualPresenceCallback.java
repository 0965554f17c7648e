package com.guildhub.gateway.presence;

import com.guildhub.core.presence.PresenceStatus;
import reactor.core.publisher.Mono;

/**
 * Reaction to a user picking a presence status, typically persisting it.
 */
@FunctionalInterface
public interface ManualPresenceCallback {
    Mono<Void> handle(String userId, PresenceStatus status);
}
