package com.mixtape.playlist.infrastructure.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Response DTO for a single playlist. {@code trackCount} is only present on reads.
 */
public record PlaylistResponse(
        String id,
        String name,
        String description,
        Instant createdAt,
        Instant updatedAt,
        @JsonInclude(JsonInclude.Include.NON_NULL)
        Integer trackCount
) {}
