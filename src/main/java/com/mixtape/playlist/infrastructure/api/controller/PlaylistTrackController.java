package com.mixtape.playlist.infrastructure.api.controller;

import com.mixtape.playlist.application.service.PlaylistTrackService;
import com.mixtape.playlist.config.PlaylistProperties;
import com.mixtape.playlist.core.model.TrackMetadata;
import com.mixtape.playlist.core.model.TrackPlacement;
import com.mixtape.playlist.infrastructure.api.dto.AddTracksRequest;
import com.mixtape.playlist.infrastructure.api.dto.AddTracksResponse;
import com.mixtape.playlist.infrastructure.api.dto.PlaylistTrackListResponse;
import com.mixtape.playlist.infrastructure.api.dto.PlaylistTrackResponse;
import com.mixtape.playlist.infrastructure.api.dto.ReorderTracksRequest;
import com.mixtape.playlist.infrastructure.api.dto.ReorderTracksResponse;
import com.mixtape.playlist.infrastructure.api.dto.TrackPositionResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for the tracks of a playlist.
 */
@RestController
@RequestMapping("/playlists/{playlistId}/tracks")
public class PlaylistTrackController {

    private final PlaylistTrackService playlistTrackService;
    private final PlaylistProperties properties;

    public PlaylistTrackController(PlaylistTrackService playlistTrackService, PlaylistProperties properties) {
        this.playlistTrackService = playlistTrackService;
        this.properties = properties;
    }

    @GetMapping
    public ResponseEntity<PlaylistTrackListResponse> getTracks(
            @RequestHeader(ApiHeaders.USER_ID) String userId,
            @PathVariable String playlistId,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(required = false) Integer pageSize
    ) {
        int size = pageSize != null ? pageSize : properties.defaultTrackPageSize();
        PlaylistTrackService.TrackPage result = playlistTrackService.getTracks(userId, playlistId, page, size);

        List<PlaylistTrackResponse> items = result.items().stream()
                .map(track -> new PlaylistTrackResponse(
                        track.getPosition(),
                        track.getTrackUri(),
                        track.getArtist(),
                        track.getTitle(),
                        track.getAlbum(),
                        track.getAddedAt()))
                .toList();

        return ResponseEntity.ok(new PlaylistTrackListResponse(items, result.page(), result.pageSize(), result.total()));
    }

    @PostMapping
    public ResponseEntity<AddTracksResponse> addTracks(
            @RequestHeader(ApiHeaders.USER_ID) String userId,
            @PathVariable String playlistId,
            @Valid @RequestBody AddTracksRequest request
    ) {
        List<TrackMetadata> tracks = request.tracks().stream()
                .map(track -> new TrackMetadata(track.trackUri(), track.artist(), track.title(), track.album()))
                .toList();
        int insertAfterPosition = request.insertAfterPosition() != null ? request.insertAfterPosition() : 0;

        PlaylistTrackService.AddResult result = playlistTrackService.addTracks(userId, playlistId, tracks, insertAfterPosition);

        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new AddTracksResponse(result.added(), result.positions()));
    }

    @PutMapping
    public ResponseEntity<ReorderTracksResponse> reorderTracks(
            @RequestHeader(ApiHeaders.USER_ID) String userId,
            @PathVariable String playlistId,
            @Valid @RequestBody ReorderTracksRequest request
    ) {
        List<TrackPlacement> ordered = request.ordered().stream()
                .map(item -> new TrackPlacement(item.trackUri(), item.position()))
                .toList();

        PlaylistTrackService.ReorderResult result = playlistTrackService.reorderTracks(userId, playlistId, ordered);

        List<TrackPositionResponse> positions = result.positions().stream()
                .map(placement -> new TrackPositionResponse(placement.trackUri(), placement.position()))
                .toList();
        return ResponseEntity.ok(new ReorderTracksResponse(positions));
    }

    @DeleteMapping("/{position}")
    public ResponseEntity<Void> removeTrack(
            @RequestHeader(ApiHeaders.USER_ID) String userId,
            @PathVariable String playlistId,
            @PathVariable int position
    ) {
        playlistTrackService.removeTrack(userId, playlistId, position);
        return ResponseEntity.noContent().build();
    }
}
