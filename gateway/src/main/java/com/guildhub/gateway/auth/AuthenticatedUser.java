package com.guildhub.gateway.auth;

import lombok.Value;

/**
 * Identity behind a valid connect token.
 */
@Value
public class AuthenticatedUser {
    String userId;
    boolean banned;
}
