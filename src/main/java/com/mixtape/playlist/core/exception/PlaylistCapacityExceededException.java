package com.mixtape.playlist.core.exception;

import com.mixtape.playlist.core.model.PlaylistTrack;

/**
 * Domain exception thrown when a batch of tracks cannot fit into a playlist,
 * either because the live-track ceiling would be crossed or because no free positions remain.
 */
public class PlaylistCapacityExceededException extends RuntimeException {

    private final int currentCount;
    private final int requestedToAdd;

    public PlaylistCapacityExceededException(int currentCount, int requestedToAdd) {
        super("Playlist cannot exceed " + PlaylistTrack.MAX_POSITION + " tracks");
        this.currentCount = currentCount;
        this.requestedToAdd = requestedToAdd;
    }

    public int getCurrentCount() {
        return currentCount;
    }

    public int getRequestedToAdd() {
        return requestedToAdd;
    }

    public int getMaxCount() {
        return PlaylistTrack.MAX_POSITION;
    }
}
