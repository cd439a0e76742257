package com.mixtape.playlist.infrastructure.api.dto;

import java.util.List;

/**
 * Response DTO for a page of live playlist tracks.
 */
public record PlaylistTrackListResponse(
        List<PlaylistTrackResponse> items,
        int page,
        int pageSize,
        int total
) {}
