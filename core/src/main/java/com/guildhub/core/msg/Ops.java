package com.guildhub.core.msg;

/**
 * Op codes carried in {@link Envelope#getOp()}.
 * <p>
 * Only the heartbeat, ready and presence ops are interpreted by the hub. Domain ops are published
 * by collaborating services and relayed unchanged.
 * </p>
 */
public final class Ops {
    private Ops() {
    }

    // Client -> server
    public static final String HEARTBEAT = "heartbeat";

    // Both directions: status choice from the client, presence broadcast from the hub
    public static final String PRESENCE_UPDATE = "presence_update";

    // Server -> client
    public static final String HEARTBEAT_ACK = "heartbeat_ack";
    public static final String READY = "ready";

    public static final String MESSAGE_CREATE = "message_create";
    public static final String MESSAGE_UPDATE = "message_update";
    public static final String MESSAGE_DELETE = "message_delete";
    public static final String CHANNEL_CREATE = "channel_create";
    public static final String CHANNEL_UPDATE = "channel_update";
    public static final String CHANNEL_DELETE = "channel_delete";
    public static final String CATEGORY_CREATE = "category_create";
    public static final String CATEGORY_UPDATE = "category_update";
    public static final String CATEGORY_DELETE = "category_delete";
    public static final String MEMBER_JOIN = "member_join";
    public static final String MEMBER_LEAVE = "member_leave";
    public static final String MEMBER_UPDATE = "member_update";
    public static final String ROLE_CREATE = "role_create";
    public static final String ROLE_UPDATE = "role_update";
    public static final String ROLE_DELETE = "role_delete";
    public static final String SERVER_UPDATE = "server_update";
    public static final String CHANNEL_PERMISSION_UPDATE = "channel_permission_update";
    public static final String CHANNEL_PERMISSION_DELETE = "channel_permission_delete";
    public static final String VOICE_STATE_UPDATE = "voice_state_update";
    public static final String FRIEND_REQUEST_ACCEPT = "friend_request_accept";
}
