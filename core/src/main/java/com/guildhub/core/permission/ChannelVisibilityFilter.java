package com.guildhub.core.permission;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Which channels of one server a member can see in the sidebar.
 * <p>
 * Most channels follow the member's base {@code VIEW_CHANNEL} bit; only channels whose overrides
 * flip that bit are listed explicitly.
 * </p>
 */
@Value
@Builder
public class ChannelVisibilityFilter {
    boolean admin;
    boolean baseView;
    Set<String> hiddenChannels;
    Set<String> grantedChannels;

    public boolean canSee(String channelId) {
        if (admin) {
            return true;
        }
        if (baseView) {
            return !hiddenChannels.contains(channelId);
        }
        return grantedChannels.contains(channelId);
    }
}
