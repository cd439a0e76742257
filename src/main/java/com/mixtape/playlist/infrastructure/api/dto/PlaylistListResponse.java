package com.mixtape.playlist.infrastructure.api.dto;

import java.util.List;

/**
 * Response DTO for a page of playlists.
 */
public record PlaylistListResponse(
        List<PlaylistSummaryResponse> items,
        int page,
        int pageSize,
        int total
) {}
