package com.guildhub.core.msg;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Wire envelope for every WebSocket frame, in both directions: {@code {"op", "d", "seq"}}.
 * <p>
 * <b>Ordering:</b> {@code seq} is stamped by the hub from a single global counter when an event is
 * published. Frames on one connection arrive in publish order; across connections there is no
 * ordering guarantee, and domain services carry their own sequence numbers where ordering matters.
 * </p>
 * <p>
 * {@code d} and {@code seq} are omitted from the JSON when absent.
 * </p>
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Envelope {
    /**
     * Op code, see {@link Ops}.
     */
    @JsonProperty("op")
    String op;

    /**
     * Op-specific payload.
     */
    @JsonProperty("d")
    Object data;

    /**
     * Hub-assigned sequence number; null on client frames and control replies.
     */
    @JsonProperty("seq")
    Long seq;

    public static Envelope of(String op, Object data) {
        return Envelope.builder().op(op).data(data).build();
    }

    public static Envelope of(String op) {
        return Envelope.builder().op(op).build();
    }
}
