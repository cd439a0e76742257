package com.mixtape.playlist.core.exception;

/**
 * Domain exception thrown when a track position outside 1..100 is addressed.
 */
public class InvalidPositionException extends RuntimeException {

    private final String position;

    public InvalidPositionException(String position, String message) {
        super(message);
        this.position = position;
    }

    public String getPosition() {
        return position;
    }
}
