package com.mixtape.playlist.infrastructure.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for a single track submitted for insertion.
 */
public record TrackInput(
        @NotBlank(message = "Track URI required")
        @Size(max = 500, message = "Track URI must be at most 500 characters")
        String trackUri,
        @NotBlank(message = "Artist required")
        @Size(max = 500, message = "Artist must be at most 500 characters")
        String artist,
        @NotBlank(message = "Title required")
        @Size(max = 500, message = "Title must be at most 500 characters")
        String title,
        @NotBlank(message = "Album required")
        @Size(max = 500, message = "Album must be at most 500 characters")
        String album
) {}
