package com.guildhub.core.permission;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Per-channel, per-role adjustment of the base permission mask.
 * <p>
 * Instances read back from storage are trusted as-is. New writes must go through
 * {@link #validated(String, String, long, long)}, which enforces {@code allow & deny == 0}
 * and keeps both masks inside {@link Permissions#CHANNEL_OVERRIDABLE}.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class ChannelOverride {
    @JsonProperty("channel_id")
    String channelId;

    @JsonProperty("role_id")
    String roleId;

    @JsonProperty("allow")
    long allow;

    @JsonProperty("deny")
    long deny;

    @JsonCreator
    public ChannelOverride(
        @JsonProperty("channel_id") String channelId,
        @JsonProperty("role_id") String roleId,
        @JsonProperty("allow") long allow,
        @JsonProperty("deny") long deny
    ) {
        this.channelId = channelId;
        this.roleId = roleId;
        this.allow = allow;
        this.deny = deny;
    }

    /**
     * Creates an override for a write, rejecting malformed masks.
     *
     * @throws InvalidOverrideException if allow and deny overlap or touch server-wide bits
     */
    public static ChannelOverride validated(String channelId, String roleId, long allow, long deny) {
        validate(allow, deny);
        return new ChannelOverride(channelId, roleId, allow, deny);
    }

    /**
     * Validates a pair of override masks.
     *
     * @throws InvalidOverrideException if the masks are not acceptable
     */
    public static void validate(long allow, long deny) {
        if ((allow & deny) != 0) {
            throw new InvalidOverrideException(
                "allow and deny cannot have overlapping permission bits: " + Long.toBinaryString(allow & deny));
        }
        if ((allow & ~Permissions.CHANNEL_OVERRIDABLE) != 0) {
            throw new InvalidOverrideException("allow contains non-overridable permission bits");
        }
        if ((deny & ~Permissions.CHANNEL_OVERRIDABLE) != 0) {
            throw new InvalidOverrideException("deny contains non-overridable permission bits");
        }
    }

    @JsonIgnore
    public boolean isEmpty() {
        return allow == 0 && deny == 0;
    }
}
