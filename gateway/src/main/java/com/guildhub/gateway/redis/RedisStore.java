package com.guildhub.gateway.redis;

import com.guildhub.core.permission.ChannelOverride;
import com.guildhub.core.permission.Role;
import com.guildhub.core.presence.PresenceStatus;
import com.guildhub.core.redis.Keys;
import com.guildhub.gateway.auth.AuthenticatedUser;
import com.guildhub.gateway.auth.MembershipProvider;
import com.guildhub.gateway.auth.TokenValidator;
import com.guildhub.gateway.config.GatewayConfig;
import com.guildhub.gateway.permission.ChannelDirectory;
import com.guildhub.gateway.permission.ChannelOverrideStore;
import com.guildhub.gateway.permission.RoleStore;
import com.guildhub.gateway.presence.UserStatusStore;
import io.lettuce.core.KeyValue;
import io.lettuce.core.RedisClient;
import io.lettuce.core.Value;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Optional;

/**
 * Reactive Redis access for everything the gateway reads from shared state: tokens, bans,
 * memberships, status preferences, roles, channels and overrides.
 * <p>
 * All operations are non-blocking using the Lettuce reactive API. The key layout is defined in
 * {@link Keys}.
 * </p>
 */
public class RedisStore implements TokenValidator, MembershipProvider, UserStatusStore,
    RoleStore, ChannelOverrideStore, ChannelDirectory {
    private static final Logger log = LoggerFactory.getLogger(RedisStore.class);

    // Stored preference meaning "appear offline"
    private static final String STORED_INVISIBLE = "offline";

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;
    private final RedisReactiveCommands<String, String> commands;

    public RedisStore(GatewayConfig config) {
        this.client = RedisClient.create(config.getRedisUrl());
        this.connection = client.connect();
        this.commands = connection.reactive();
        log.info("Connected to Redis: {}", config.getRedisUrl());
    }

    @Override
    public Mono<AuthenticatedUser> validate(String token) {
        return commands.get(Keys.token(token))
            .flatMap(userId -> commands.exists(Keys.banned(userId))
                .map(count -> new AuthenticatedUser(userId, count > 0)))
            .doOnError(err -> log.error("Failed to validate token", err));
    }

    @Override
    public Flux<String> serverIdsOf(String userId) {
        return commands.smembers(Keys.userServers(userId))
            .doOnError(err -> log.error("Failed to load servers of user {}", userId, err));
    }

    @Override
    public Mono<PresenceStatus> loadStatus(String userId) {
        return commands.get(Keys.userStatus(userId))
            .flatMap(stored -> Mono.justOrEmpty(PresenceStatus.fromManualChoice(stored)));
    }

    @Override
    public Mono<Void> updateStatus(String userId, PresenceStatus status) {
        String stored = status == PresenceStatus.INVISIBLE ? STORED_INVISIBLE : status.wireName();
        return commands.set(Keys.userStatus(userId), stored)
            .doOnSuccess(ok -> log.debug("Stored status {} for user {}", stored, userId))
            .then();
    }

    @Override
    public Flux<Role> rolesOf(String userId, String serverId) {
        return commands.smembers(Keys.memberRoles(serverId, userId))
            .concatMap(roleId -> hash(Keys.role(roleId))
                .filter(fields -> !fields.isEmpty())
                .map(fields -> toRole(roleId, fields)))
            .filter(role -> serverId.equals(role.getServerId()));
    }

    @Override
    public Flux<ChannelOverride> overridesOf(String channelId) {
        return commands.hgetall(Keys.channelOverrides(channelId))
            .concatMap(entry -> Mono.justOrEmpty(parseOverride(channelId, entry.getKey(), entry.getValue())));
    }

    @Override
    public Flux<ChannelOverride> overridesInServer(String serverId) {
        return commands.smembers(Keys.serverChannels(serverId))
            .concatMap(this::overridesOf);
    }

    @Override
    public Mono<Void> save(ChannelOverride override) {
        return commands.hset(Keys.channelOverrides(override.getChannelId()),
                override.getRoleId(), override.getAllow() + ":" + override.getDeny())
            .then();
    }

    @Override
    public Mono<Boolean> delete(String channelId, String roleId) {
        return commands.hdel(Keys.channelOverrides(channelId), roleId)
            .map(removed -> removed > 0);
    }

    @Override
    public Mono<String> serverOf(String channelId) {
        return commands.hget(Keys.channel(channelId), "serverId");
    }

    private Mono<Map<String, String>> hash(String key) {
        return commands.hgetall(key).collectMap(KeyValue::getKey, Value::getValue);
    }

    private static Role toRole(String roleId, Map<String, String> fields) {
        return Role.builder()
            .id(roleId)
            .serverId(fields.get("serverId"))
            .name(fields.getOrDefault("name", ""))
            .position(Integer.parseInt(fields.getOrDefault("position", "0")))
            .permissions(Long.parseLong(fields.getOrDefault("permissions", "0")))
            .build();
    }

    /**
     * Parses a stored {@code allow:deny} pair. A corrupt entry is skipped so it cannot break
     * resolution for the whole channel.
     */
    static Optional<ChannelOverride> parseOverride(String channelId, String roleId, String masks) {
        int sep = masks == null ? -1 : masks.indexOf(':');
        if (sep < 0) {
            log.warn("Skipping override of role {} on channel {}: malformed masks '{}'", roleId, channelId, masks);
            return Optional.empty();
        }
        try {
            long allow = Long.parseLong(masks.substring(0, sep));
            long deny = Long.parseLong(masks.substring(sep + 1));
            return Optional.of(new ChannelOverride(channelId, roleId, allow, deny));
        } catch (NumberFormatException e) {
            log.warn("Skipping override of role {} on channel {}: malformed masks '{}'", roleId, channelId, masks);
            return Optional.empty();
        }
    }

    public void close() {
        connection.close();
        client.shutdown();
        log.info("Redis connection closed");
    }
}
