package com.guildhub.gateway.permission;

public class ChannelNotFoundException extends RuntimeException {
    public ChannelNotFoundException(String channelId) {
        super("Channel not found: " + channelId);
    }
}
