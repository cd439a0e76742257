package com.mixtape.playlist.infrastructure.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Request DTO for replacing the order of all live tracks.
 */
public record ReorderTracksRequest(
        @NotNull(message = "ordered must be an array of {position, trackUri}")
        @Size(min = 1, message = "At least one track required")
        List<@Valid @NotNull OrderedTrack> ordered
) {}
