package com.mixtape.playlist.infrastructure.api.dto;

import java.util.List;

/**
 * Response DTO for reorder operation.
 */
public record ReorderTracksResponse(
        List<TrackPositionResponse> positions
) {}
