package com.mixtape.playlist.infrastructure.api.controller;

import com.mixtape.playlist.application.service.PlaylistService;
import com.mixtape.playlist.config.PlaylistProperties;
import com.mixtape.playlist.core.model.Playlist;
import com.mixtape.playlist.infrastructure.api.dto.CreatePlaylistRequest;
import com.mixtape.playlist.infrastructure.api.dto.PlaylistListResponse;
import com.mixtape.playlist.infrastructure.api.dto.PlaylistResponse;
import com.mixtape.playlist.infrastructure.api.dto.PlaylistSummaryResponse;
import com.mixtape.playlist.infrastructure.api.dto.UpdatePlaylistRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for playlist operations.
 */
@RestController
@RequestMapping("/playlists")
public class PlaylistController {

    private final PlaylistService playlistService;
    private final PlaylistProperties properties;

    public PlaylistController(PlaylistService playlistService, PlaylistProperties properties) {
        this.playlistService = playlistService;
        this.properties = properties;
    }

    @GetMapping
    public ResponseEntity<PlaylistListResponse> listPlaylists(
            @RequestHeader(ApiHeaders.USER_ID) String userId,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(required = false) Integer pageSize,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String sort
    ) {
        int size = pageSize != null ? pageSize : properties.defaultPlaylistPageSize();
        PlaylistService.PlaylistPage result = playlistService.listPlaylists(userId, page, size, search, sort);

        List<PlaylistSummaryResponse> items = result.items().stream()
                .map(entry -> new PlaylistSummaryResponse(
                        entry.playlist().getId(),
                        entry.playlist().getName(),
                        entry.playlist().getCreatedAt(),
                        entry.playlist().getUpdatedAt(),
                        entry.trackCount()))
                .toList();

        return ResponseEntity.ok(new PlaylistListResponse(items, result.page(), result.pageSize(), result.total()));
    }

    @PostMapping
    public ResponseEntity<PlaylistResponse> createPlaylist(
            @RequestHeader(ApiHeaders.USER_ID) String userId,
            @Valid @RequestBody CreatePlaylistRequest request
    ) {
        Playlist playlist = playlistService.createPlaylist(userId, request.name(), request.description());
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(playlist, null));
    }

    @GetMapping("/{playlistId}")
    public ResponseEntity<PlaylistResponse> getPlaylist(
            @RequestHeader(ApiHeaders.USER_ID) String userId,
            @PathVariable String playlistId
    ) {
        PlaylistService.PlaylistWithCount result = playlistService.getPlaylist(userId, playlistId);
        return ResponseEntity.ok(toResponse(result.playlist(), result.trackCount()));
    }

    @PatchMapping("/{playlistId}")
    public ResponseEntity<PlaylistResponse> updatePlaylist(
            @RequestHeader(ApiHeaders.USER_ID) String userId,
            @PathVariable String playlistId,
            @Valid @RequestBody UpdatePlaylistRequest request
    ) {
        Playlist playlist = playlistService.updatePlaylist(
                userId, playlistId, request.getName(), request.isDescriptionPresent(), request.getDescription());
        return ResponseEntity.ok(toResponse(playlist, null));
    }

    @DeleteMapping("/{playlistId}")
    public ResponseEntity<Void> deletePlaylist(
            @RequestHeader(ApiHeaders.USER_ID) String userId,
            @PathVariable String playlistId
    ) {
        playlistService.deletePlaylist(userId, playlistId);
        return ResponseEntity.noContent().build();
    }

    private PlaylistResponse toResponse(Playlist playlist, Integer trackCount) {
        return new PlaylistResponse(
                playlist.getId(),
                playlist.getName(),
                playlist.getDescription(),
                playlist.getCreatedAt(),
                playlist.getUpdatedAt(),
                trackCount
        );
    }
}
