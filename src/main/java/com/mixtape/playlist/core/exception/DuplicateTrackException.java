package com.mixtape.playlist.core.exception;

/**
 * Domain exception thrown when a track is already live in the playlist
 * or appears twice in the same insert batch.
 */
public class DuplicateTrackException extends RuntimeException {

    private final String trackUri;

    public DuplicateTrackException(String trackUri, String message) {
        super(message);
        this.trackUri = trackUri;
    }

    public String getTrackUri() {
        return trackUri;
    }
}
