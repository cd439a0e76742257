package com.mixtape.playlist.infrastructure.api.dto;

import java.util.List;

/**
 * Response DTO for add tracks operation.
 */
public record AddTracksResponse(
        int added,
        List<Integer> positions
) {}
