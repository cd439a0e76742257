package com.mixtape.playlist.core.exception;

/**
 * Domain exception thrown when the owner already has a live playlist with the same name.
 */
public class PlaylistNameConflictException extends RuntimeException {

    public PlaylistNameConflictException(String name) {
        super("Playlist name already exists: " + name);
    }
}
