package com.guildhub.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Event published by a domain service onto {@link Topics#HUB_EVENTS}.
 * <p>
 * {@code target} is the user, server or channel id for the scoped variants; {@code targets} is the
 * user list for {@link PublishScope#USERS}.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PublishRequest {
    @JsonProperty("scope")
    PublishScope scope;

    @JsonProperty("target")
    String target;

    @JsonProperty("targets")
    List<String> targets;

    @JsonProperty("event")
    Envelope event;

    @JsonCreator
    public PublishRequest(
        @JsonProperty("scope") PublishScope scope,
        @JsonProperty("target") String target,
        @JsonProperty("targets") List<String> targets,
        @JsonProperty("event") Envelope event
    ) {
        this.scope = scope;
        this.target = target;
        this.targets = targets;
        this.event = event;
    }
}
