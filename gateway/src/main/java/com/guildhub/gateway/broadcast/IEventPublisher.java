package com.guildhub.gateway.broadcast;

import com.guildhub.core.msg.Envelope;

import java.util.Collection;
import java.util.Set;

/**
 * Scoped fan-out of events to live connections.
 * <p>
 * Publishing never blocks on a slow client: each frame is offered to the recipient's bounded
 * queue and a connection whose queue is full is closed and removed, while every other recipient
 * still receives the event. Each method returns the number of connections the frame was queued to.
 * </p>
 */
public interface IEventPublisher {

    int toAll(Envelope event);

    int toAllExcept(String excludedUserId, Envelope event);

    int toUser(String userId, Envelope event);

    int toUsers(Collection<String> userIds, Envelope event);

    /**
     * Connections whose captured server memberships include the server.
     */
    int toServer(String serverId, Envelope event);

    /**
     * Connections in the channel's server that belong to one of the given users, already checked
     * for permission to view the channel.
     */
    int toChannelViewers(String serverId, Set<String> viewerIds, Envelope event);

    /**
     * Closes every connection of the user, for bans and kicks.
     *
     * @return number of connections closed
     */
    int disconnectUser(String userId);
}
