package com.mixtape.playlist.infrastructure.api.dto;

import java.time.Instant;

/**
 * Response DTO for a playlist entry in a listing.
 */
public record PlaylistSummaryResponse(
        String id,
        String name,
        Instant createdAt,
        Instant updatedAt,
        int trackCount
) {}
