package com.mixtape.playlist.core.exception;

/**
 * Domain exception thrown when the owner has reached the maximum number of live playlists.
 */
public class PlaylistLimitExceededException extends RuntimeException {

    private final int limit;

    public PlaylistLimitExceededException(int limit) {
        super("Playlists limit exceeded: at most " + limit + " playlists allowed");
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
