package com.guildhub.core.redis;

/**
 * Redis keyspace shared by the gateway and the services that own the data.
 * <p>
 * The gateway only reads these keys, except for the status preference, which it writes when a
 * user changes status manually.
 * </p>
 */
public final class Keys {
    private Keys() {
    }

    /**
     * Session token: {@code token:{token}}
     * <p>
     * <b>Type:</b> String (user id). Written by the auth service with the token's TTL.
     * </p>
     */
    public static String token(String token) {
        return "token:" + token;
    }

    /**
     * Ban marker: {@code banned:{userId}}
     * <p>
     * <b>Type:</b> String; presence of the key means the user is banned.
     * </p>
     */
    public static String banned(String userId) {
        return "banned:" + userId;
    }

    /**
     * Server memberships: {@code user:{userId}:servers}
     * <p>
     * <b>Type:</b> Set of server ids.
     * </p>
     */
    public static String userServers(String userId) {
        return "user:" + userId + ":servers";
    }

    /**
     * Stored status preference: {@code user:{userId}:status}
     * <p>
     * <b>Type:</b> String (online/idle/dnd/offline). {@code offline} means invisible.
     * </p>
     */
    public static String userStatus(String userId) {
        return "user:" + userId + ":status";
    }

    /**
     * Roles a member holds in a server: {@code member:{serverId}:{userId}:roles}
     * <p>
     * <b>Type:</b> Set of role ids.
     * </p>
     */
    public static String memberRoles(String serverId, String userId) {
        return "member:" + serverId + ":" + userId + ":roles";
    }

    /**
     * Role definition: {@code role:{roleId}}
     * <p>
     * <b>Type:</b> Hash
     * <br>
     * <b>Fields:</b> {@code serverId}, {@code name}, {@code position}, {@code permissions}
     * </p>
     */
    public static String role(String roleId) {
        return "role:" + roleId;
    }

    /**
     * Channel metadata: {@code channel:{channelId}}
     * <p>
     * <b>Type:</b> Hash
     * <br>
     * <b>Fields:</b> {@code serverId}
     * </p>
     */
    public static String channel(String channelId) {
        return "channel:" + channelId;
    }

    /**
     * Channels of a server: {@code server:{serverId}:channels}
     * <p>
     * <b>Type:</b> Set of channel ids.
     * </p>
     */
    public static String serverChannels(String serverId) {
        return "server:" + serverId + ":channels";
    }

    /**
     * Channel overrides: {@code channel:{channelId}:overrides}
     * <p>
     * <b>Type:</b> Hash of role id to {@code "allow:deny"} (decimal masks).
     * </p>
     */
    public static String channelOverrides(String channelId) {
        return "channel:" + channelId + ":overrides";
    }
}
