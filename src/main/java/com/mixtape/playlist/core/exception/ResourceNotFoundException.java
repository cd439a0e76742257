package com.mixtape.playlist.core.exception;

/**
 * Domain exception thrown when a playlist or a track position does not exist for the caller.
 * Playlists owned by someone else are reported through this exception as well.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
