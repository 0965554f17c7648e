package com.guildhub.gateway.broadcast;

import com.guildhub.core.msg.Envelope;
import com.guildhub.core.msg.PublishRequest;
import com.guildhub.gateway.permission.ChannelPermissionService;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Dispatches a {@link PublishRequest} from a domain service to the matching publish operation.
 */
public class PublishRequestRouter {

    private final IEventPublisher publisher;
    private final ChannelPermissionService channelPermissions;

    public PublishRequestRouter(IEventPublisher publisher, ChannelPermissionService channelPermissions) {
        this.publisher = publisher;
        this.channelPermissions = channelPermissions;
    }

    /**
     * Publishes the request's event to its audience.
     *
     * @param request publish request
     * @return number of connections the frame was queued to; errors with
     *         {@link IllegalArgumentException} for an incomplete request
     */
    public Mono<Integer> route(PublishRequest request) {
        return Mono.defer(() -> {
            if (request.getScope() == null || request.getEvent() == null || request.getEvent().getOp() == null) {
                return Mono.error(new IllegalArgumentException("Publish request needs scope and event.op"));
            }

            Envelope event = request.getEvent();
            return switch (request.getScope()) {
                case ALL -> Mono.just(publisher.toAll(event));
                case ALL_EXCEPT -> Mono.just(publisher.toAllExcept(requireTarget(request), event));
                case USER -> Mono.just(publisher.toUser(requireTarget(request), event));
                case USERS -> Mono.just(publisher.toUsers(
                    request.getTargets() != null ? request.getTargets() : List.of(), event));
                case SERVER -> Mono.just(publisher.toServer(requireTarget(request), event));
                case CHANNEL -> channelPermissions.publishToChannel(requireTarget(request), event);
            };
        });
    }

    private static String requireTarget(PublishRequest request) {
        if (request.getTarget() == null || request.getTarget().isBlank()) {
            throw new IllegalArgumentException("Scope " + request.getScope().wireName() + " needs a target");
        }
        return request.getTarget();
    }
}
