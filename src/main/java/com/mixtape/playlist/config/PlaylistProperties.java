package com.mixtape.playlist.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Application settings bound from {@code mixtape.playlists.*}.
 * The per-playlist track ceiling is fixed by the data model and is not configurable here.
 */
@ConfigurationProperties(prefix = "mixtape.playlists")
public record PlaylistProperties(
        @DefaultValue("50") int maxPlaylistsPerOwner,
        @DefaultValue("50") int defaultTrackPageSize,
        @DefaultValue("20") int defaultPlaylistPageSize,
        @DefaultValue("5000") int maxPaginationWindow
) {}
