package com.mixtape.playlist.core.model;

/**
 * A track URI paired with the position it occupies, or should occupy, in a playlist.
 */
public record TrackPlacement(
        String trackUri,
        int position
) {}
