package com.guildhub.core.permission;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * A server-scoped role. A member may hold several roles in the same server.
 */
@Value
@Builder(toBuilder = true)
public class Role {
    @JsonProperty("id")
    String id;

    @JsonProperty("server_id")
    String serverId;

    @JsonProperty("name")
    String name;

    /**
     * Seniority; higher is more senior. Decides which override wins on a channel.
     */
    @JsonProperty("position")
    int position;

    @JsonProperty("permissions")
    long permissions;

    @JsonCreator
    public Role(
        @JsonProperty("id") String id,
        @JsonProperty("server_id") String serverId,
        @JsonProperty("name") String name,
        @JsonProperty("position") int position,
        @JsonProperty("permissions") long permissions
    ) {
        this.id = id;
        this.serverId = serverId;
        this.name = name;
        this.position = position;
        this.permissions = permissions;
    }
}
