package com.mixtape.playlist.infrastructure.api.dto;

import java.time.Instant;

/**
 * Response DTO for a single playlist track.
 */
public record PlaylistTrackResponse(
        int position,
        String trackUri,
        String artist,
        String title,
        String album,
        Instant addedAt
) {}
