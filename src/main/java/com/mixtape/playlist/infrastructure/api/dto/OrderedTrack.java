package com.mixtape.playlist.infrastructure.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for one entry of a full ordering.
 */
public record OrderedTrack(
        @NotNull(message = "position is required")
        @Min(value = 1, message = "Position must be positive")
        @Max(value = 100, message = "Position must not exceed 100")
        Integer position,
        @NotBlank(message = "Track URI required")
        @Size(max = 500, message = "Track URI must be at most 500 characters")
        String trackUri
) {}
