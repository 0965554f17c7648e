package com.guildhub.core.msg;

import com.fasterxml.jackson.databind.JsonNode;
import com.guildhub.core.presence.PresenceStatus;
import com.guildhub.core.util.JsonUtils;
import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.Optional;

/**
 * Client frames the hub understands, decoded once at the socket boundary.
 * <p>
 * The set of variants is closed: the constructor is private, so {@link Heartbeat} and
 * {@link PresenceUpdate} are the only subclasses. Frames that are not valid JSON, carry an unknown
 * op or an invalid payload decode to {@link Optional#empty()} and are dropped by the caller.
 * </p>
 */
public abstract class InboundMessage {

    private InboundMessage() {
    }

    /**
     * Decodes a raw text frame.
     *
     * @param frame raw JSON text
     * @return decoded message, or empty if the frame should be ignored
     */
    public static Optional<InboundMessage> parse(String frame) {
        JsonNode root = JsonUtils.readTreeOrNull(frame);
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }

        JsonNode op = root.get("op");
        if (op == null || !op.isTextual()) {
            return Optional.empty();
        }

        switch (op.asText()) {
            case Ops.HEARTBEAT -> {
                return Optional.of(Heartbeat.INSTANCE);
            }
            case Ops.PRESENCE_UPDATE -> {
                JsonNode data = root.get("d");
                if (data == null || !data.hasNonNull("status")) {
                    return Optional.empty();
                }
                return PresenceStatus.fromManualChoice(data.get("status").asText())
                    .<InboundMessage>map(PresenceUpdate::new);
            }
            default -> {
                return Optional.empty();
            }
        }
    }

    /**
     * Liveness ping.
     */
    public static final class Heartbeat extends InboundMessage {
        public static final Heartbeat INSTANCE = new Heartbeat();

        private Heartbeat() {
        }

        @Override
        public String toString() {
            return "Heartbeat";
        }
    }

    /**
     * Manual status change requested by the user.
     */
    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class PresenceUpdate extends InboundMessage {
        PresenceStatus status;
    }
}
