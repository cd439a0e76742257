package com.mixtape.playlist.core.model;

/**
 * Catalog metadata of a track submitted for insertion into a playlist.
 */
public record TrackMetadata(
        String trackUri,
        String artist,
        String title,
        String album
) {}
