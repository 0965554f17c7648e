package com.guildhub.gateway.auth;

import reactor.core.publisher.Mono;

/**
 * Validates the bearer token presented on upgrade.
 */
public interface TokenValidator {

    /**
     * @param token token from the {@code token} query parameter
     * @return the user, or empty if the token is unknown or expired
     */
    Mono<AuthenticatedUser> validate(String token);
}
