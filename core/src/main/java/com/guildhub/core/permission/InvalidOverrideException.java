package com.guildhub.core.permission;

/**
 * Thrown when a channel override write carries conflicting or non-overridable bits.
 */
public class InvalidOverrideException extends RuntimeException {

    public InvalidOverrideException(String message) {
        super(message);
    }
}
