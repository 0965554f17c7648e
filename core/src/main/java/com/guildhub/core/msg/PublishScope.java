package com.guildhub.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Audience of a published event.
 */
public enum PublishScope {
    /**
     * Every live connection.
     */
    ALL,
    /**
     * Every live connection except the target user's.
     */
    ALL_EXCEPT,
    /**
     * Every connection of the target user.
     */
    USER,
    /**
     * Every connection of the listed users.
     */
    USERS,
    /**
     * Every connection whose captured memberships include the target server.
     */
    SERVER,
    /**
     * Connections in the channel's server whose user can view the target channel.
     */
    CHANNEL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PublishScope fromWire(String value) {
        return PublishScope.valueOf(value.toUpperCase(Locale.ROOT));
    }
}
