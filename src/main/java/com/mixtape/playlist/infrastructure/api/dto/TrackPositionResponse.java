package com.mixtape.playlist.infrastructure.api.dto;

/**
 * Response DTO pairing a track with its position.
 */
public record TrackPositionResponse(
        String trackUri,
        int position
) {}
