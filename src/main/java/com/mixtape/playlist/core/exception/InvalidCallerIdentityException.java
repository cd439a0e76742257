package com.mixtape.playlist.core.exception;

/**
 * Thrown when the caller identity supplied by the authentication layer cannot be used as an owner id.
 */
public class InvalidCallerIdentityException extends RuntimeException {

    public InvalidCallerIdentityException(String message) {
        super(message);
    }
}
