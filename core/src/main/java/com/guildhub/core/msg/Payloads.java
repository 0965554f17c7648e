package com.guildhub.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.guildhub.core.presence.PresenceStatus;
import lombok.Value;

import java.util.List;

/**
 * Payloads of the ops the hub itself produces.
 */
public final class Payloads {
    private Payloads() {
    }

    /**
     * First frame after admission: users currently visible as online.
     */
    @Value
    public static class Ready {
        @JsonProperty("online_user_ids")
        List<String> onlineUserIds;

        @JsonCreator
        public Ready(@JsonProperty("online_user_ids") List<String> onlineUserIds) {
            this.onlineUserIds = onlineUserIds;
        }
    }

    /**
     * Presence broadcast. {@code status} is the visible status, never {@code invisible} for other users.
     */
    @Value
    public static class Presence {
        @JsonProperty("user_id")
        String userId;

        @JsonProperty("status")
        PresenceStatus status;

        @JsonCreator
        public Presence(
            @JsonProperty("user_id") String userId,
            @JsonProperty("status") PresenceStatus status
        ) {
            this.userId = userId;
            this.status = status;
        }
    }

    /**
     * Identifies a removed channel override.
     */
    @Value
    public static class OverrideRemoved {
        @JsonProperty("channel_id")
        String channelId;

        @JsonProperty("role_id")
        String roleId;

        @JsonCreator
        public OverrideRemoved(
            @JsonProperty("channel_id") String channelId,
            @JsonProperty("role_id") String roleId
        ) {
            this.channelId = channelId;
            this.roleId = roleId;
        }
    }
}
