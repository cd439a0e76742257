package com.mixtape.playlist.infrastructure.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Request DTO for adding tracks to a playlist.
 * {@code insertAfterPosition} defaults to 0 when omitted.
 */
public record AddTracksRequest(
        @NotNull(message = "tracks is required")
        @Size(min = 1, message = "At least one track required")
        List<@Valid @NotNull TrackInput> tracks,
        @Min(value = 0, message = "insertAfterPosition must not be negative")
        @Max(value = 100, message = "insertAfterPosition must not exceed 100")
        Integer insertAfterPosition
) {}
