package com.guildhub.gateway.permission;

import com.guildhub.core.permission.Role;
import reactor.core.publisher.Flux;

/**
 * Roles a member holds in a server.
 */
public interface RoleStore {
    Flux<Role> rolesOf(String userId, String serverId);
}
