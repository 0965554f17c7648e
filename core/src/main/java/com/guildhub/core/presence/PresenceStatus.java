package com.guildhub.core.presence;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Presence states, serialized with their lowercase wire names.
 */
public enum PresenceStatus {
    ONLINE("online"),
    IDLE("idle"),
    DND("dnd"),
    INVISIBLE("invisible"),
    OFFLINE("offline");

    private final String wireName;

    PresenceStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static PresenceStatus fromWire(String value) {
        return Arrays.stream(values())
            .filter(s -> s.wireName.equals(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown presence status: " + value));
    }

    /**
     * Maps a status a user picked (or a stored preference) to the manual status the hub tracks.
     * <p>
     * A stored or requested {@code offline} means "appear offline" and is tracked as
     * {@link #INVISIBLE}.
     * </p>
     *
     * @param value wire name
     * @return manual status, or empty if the value is not a known status
     */
    public static Optional<PresenceStatus> fromManualChoice(String value) {
        return Arrays.stream(values())
            .filter(s -> s.wireName.equals(value))
            .findFirst()
            .map(s -> s == OFFLINE ? INVISIBLE : s);
    }

    /**
     * Status other users are shown.
     */
    public PresenceStatus visible() {
        return this == INVISIBLE ? OFFLINE : this;
    }
}
