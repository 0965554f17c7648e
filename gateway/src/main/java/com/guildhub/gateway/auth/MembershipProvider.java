package com.guildhub.gateway.auth;

import reactor.core.publisher.Flux;

/**
 * Server memberships of a user, captured once when a connection is admitted.
 */
public interface MembershipProvider {
    Flux<String> serverIdsOf(String userId);
}
