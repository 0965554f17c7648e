package com.guildhub.gateway.presence;

import com.guildhub.core.presence.PresenceStatus;
import reactor.core.publisher.Mono;

/**
 * Durable store of each user's preferred presence status.
 */
public interface UserStatusStore {

    /**
     * Loads the stored preference.
     *
     * @param userId user identifier
     * @return manual status ({@code invisible} for a stored "appear offline"), or empty if none
     */
    Mono<PresenceStatus> loadStatus(String userId);

    /**
     * Persists a manual status.
     *
     * @param userId user identifier
     * @param status manual status
     * @return Mono completing when saved
     */
    Mono<Void> updateStatus(String userId, PresenceStatus status);
}
