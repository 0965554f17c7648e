package com.guildhub.gateway.permission;

import com.guildhub.core.msg.Envelope;
import com.guildhub.core.msg.Ops;
import com.guildhub.core.msg.Payloads;
import com.guildhub.core.permission.ChannelOverride;
import com.guildhub.core.permission.ChannelVisibilityFilter;
import com.guildhub.core.permission.PermissionResolver;
import com.guildhub.core.permission.Permissions;
import com.guildhub.core.permission.Role;
import com.guildhub.gateway.broadcast.IEventPublisher;
import com.guildhub.gateway.registry.ConnectionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resolves channel permissions from stored roles and overrides, and owns the override write path.
 * <p>
 * Nothing is cached: each check reads the current roles and overrides, so a change is visible to
 * the next check without invalidation.
 * </p>
 */
public class ChannelPermissionService {
    private static final Logger log = LoggerFactory.getLogger(ChannelPermissionService.class);

    private final RoleStore roleStore;
    private final ChannelOverrideStore overrideStore;
    private final ChannelDirectory channelDirectory;
    private final ConnectionRegistry registry;
    private final IEventPublisher publisher;

    public ChannelPermissionService(RoleStore roleStore,
                                    ChannelOverrideStore overrideStore,
                                    ChannelDirectory channelDirectory,
                                    ConnectionRegistry registry,
                                    IEventPublisher publisher) {
        this.roleStore = roleStore;
        this.overrideStore = overrideStore;
        this.channelDirectory = channelDirectory;
        this.registry = registry;
        this.publisher = publisher;
    }

    /**
     * Effective permission mask of a user on a channel.
     *
     * @param userId    member
     * @param channelId channel
     * @return mask; errors with {@link ChannelNotFoundException} for an unknown channel
     */
    public Mono<Long> resolve(String userId, String channelId) {
        return serverOf(channelId)
            .flatMap(serverId -> resolveInServer(userId, serverId, channelId));
    }

    /**
     * Checks one permission bit. Administrators pass every check.
     */
    public Mono<Boolean> can(String userId, String channelId, long permission) {
        return resolve(userId, channelId).map(perms -> Permissions.has(perms, permission));
    }

    /**
     * Which channels of a server the user may see, for filtering the sidebar in one pass.
     *
     * @param userId   member
     * @param serverId server
     * @return visibility filter
     */
    public Mono<ChannelVisibilityFilter> visibilityFilter(String userId, String serverId) {
        return roleStore.rolesOf(userId, serverId).collectList()
            .flatMap(roles -> {
                Set<String> roleIds = roles.stream().map(Role::getId).collect(Collectors.toSet());
                return overrideStore.overridesInServer(serverId)
                    .filter(o -> roleIds.contains(o.getRoleId()))
                    .collectList()
                    .map(overrides -> PermissionResolver.visibility(roles, overrides));
            });
    }

    /**
     * Creates, replaces or (when both masks are zero) removes the override of a role on a channel,
     * then notifies the channel's server.
     *
     * @return Mono erroring with {@link com.guildhub.core.permission.InvalidOverrideException} for
     *         malformed masks
     */
    public Mono<Void> setOverride(String channelId, String roleId, long allow, long deny) {
        return Mono.fromCallable(() -> ChannelOverride.validated(channelId, roleId, allow, deny))
            .flatMap(override -> {
                if (override.isEmpty()) {
                    return deleteOverride(channelId, roleId);
                }
                return serverOf(channelId)
                    .flatMap(serverId -> overrideStore.save(override)
                        .then(Mono.fromRunnable(() -> {
                            publisher.toServer(serverId, Envelope.of(Ops.CHANNEL_PERMISSION_UPDATE, override));
                            log.info("Override on channel {} for role {} set (allow={}, deny={})",
                                channelId, roleId, allow, deny);
                        })));
            })
            .then();
    }

    /**
     * Removes the override of a role on a channel and notifies the channel's server.
     */
    public Mono<Void> deleteOverride(String channelId, String roleId) {
        return serverOf(channelId)
            .flatMap(serverId -> overrideStore.delete(channelId, roleId)
                .doOnNext(existed -> {
                    publisher.toServer(serverId, Envelope.of(
                        Ops.CHANNEL_PERMISSION_DELETE, new Payloads.OverrideRemoved(channelId, roleId)));
                    log.info("Override on channel {} for role {} removed (existed={})", channelId, roleId, existed);
                }))
            .then();
    }

    /**
     * Publishes an event to connections in the channel's server whose user can view the channel.
     *
     * @param channelId channel
     * @param event     event to publish
     * @return number of connections the frame was queued to
     */
    public Mono<Integer> publishToChannel(String channelId, Envelope event) {
        return serverOf(channelId)
            .flatMap(serverId -> Flux.fromIterable(registry.usersInServer(serverId))
                .filterWhen(userId -> resolveInServer(userId, serverId, channelId)
                    .map(perms -> Permissions.has(perms, Permissions.VIEW_CHANNEL)))
                .collect(Collectors.toCollection(HashSet<String>::new))
                .map(viewers -> viewers.isEmpty() ? 0 : publisher.toChannelViewers(serverId, viewers, event)));
    }

    private Mono<Long> resolveInServer(String userId, String serverId, String channelId) {
        Mono<List<Role>> roles = roleStore.rolesOf(userId, serverId).collectList();
        Mono<List<ChannelOverride>> overrides = overrideStore.overridesOf(channelId).collectList();
        return Mono.zip(roles, overrides)
            .map(tuple -> PermissionResolver.resolve(tuple.getT1(), tuple.getT2()));
    }

    private Mono<String> serverOf(String channelId) {
        return channelDirectory.serverOf(channelId)
            .switchIfEmpty(Mono.error(() -> new ChannelNotFoundException(channelId)));
    }
}
