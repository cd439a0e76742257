package com.mixtape.playlist.application.service;

import com.mixtape.playlist.application.port.PlaylistPort;
import com.mixtape.playlist.application.port.PlaylistTrackPort;
import com.mixtape.playlist.core.exception.InvalidPaginationException;
import com.mixtape.playlist.core.exception.InvalidPositionException;
import com.mixtape.playlist.core.exception.PlaylistCapacityExceededException;
import com.mixtape.playlist.core.exception.ReorderRejectedException;
import com.mixtape.playlist.core.exception.ResourceNotFoundException;
import com.mixtape.playlist.core.model.Playlist;
import com.mixtape.playlist.core.model.PlaylistTrack;
import com.mixtape.playlist.core.model.TrackMetadata;
import com.mixtape.playlist.core.model.TrackPlacement;
import com.mixtape.playlist.core.position.CapacityGuard;
import com.mixtape.playlist.core.position.DuplicateGuard;
import com.mixtape.playlist.core.position.PositionAllocator;
import com.mixtape.playlist.core.position.ReorderValidation;
import com.mixtape.playlist.core.position.ReorderValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Service for the tracks of a playlist: listing, adding, reordering and removing.
 * <p>
 * Every write runs in a single transaction that starts by locking the playlist row,
 * so the read-allocate-write sequence of one request never interleaves with another
 * writer on the same playlist.
 */
@Service
public class PlaylistTrackService {

    private static final Logger log = LoggerFactory.getLogger(PlaylistTrackService.class);

    private static final int MIN_PAGE_SIZE = 1;
    private static final int MAX_PAGE_SIZE = 100;

    private final PlaylistPort playlistPort;
    private final PlaylistTrackPort playlistTrackPort;
    private final CapacityGuard capacityGuard;
    private final DuplicateGuard duplicateGuard;
    private final PositionAllocator positionAllocator;
    private final ReorderValidator reorderValidator;

    public PlaylistTrackService(PlaylistPort playlistPort,
                                PlaylistTrackPort playlistTrackPort,
                                CapacityGuard capacityGuard,
                                DuplicateGuard duplicateGuard,
                                PositionAllocator positionAllocator,
                                ReorderValidator reorderValidator) {
        this.playlistPort = playlistPort;
        this.playlistTrackPort = playlistTrackPort;
        this.capacityGuard = capacityGuard;
        this.duplicateGuard = duplicateGuard;
        this.positionAllocator = positionAllocator;
        this.reorderValidator = reorderValidator;
    }

    /**
     * Result record containing one page of live tracks.
     */
    public record TrackPage(
            List<PlaylistTrack> items,
            int page,
            int pageSize,
            int total
    ) {}

    /**
     * Result record for add operation.
     */
    public record AddResult(
            int added,
            List<Integer> positions
    ) {}

    /**
     * Result record for reorder operation.
     */
    public record ReorderResult(
            List<TrackPlacement> positions
    ) {}

    /**
     * Gets one page of live tracks ordered by position.
     *
     * @param ownerId    the caller identity
     * @param playlistId the playlist identifier
     * @param page       the page number (1-based)
     * @param pageSize   the page size (1..100)
     * @return the requested page and the total live count
     */
    @Transactional(readOnly = true)
    public TrackPage getTracks(String ownerId, String playlistId, int page, int pageSize) {
        validatePagination(page, pageSize);
        requirePlaylist(playlistPort.findOwned(playlistId, ownerId), playlistId);

        int total = playlistTrackPort.countLiveByPlaylistId(playlistId);
        long offset = (long) (page - 1) * pageSize;

        List<PlaylistTrack> items = offset >= total
                ? List.of()
                : playlistTrackPort.findLiveByPlaylistId(playlistId, (int) offset, pageSize);

        return new TrackPage(items, page, pageSize, total);
    }

    /**
     * Adds a batch of tracks after the given anchor position.
     * The batch is accepted or rejected as a whole.
     *
     * @param ownerId             the caller identity
     * @param playlistId          the playlist identifier
     * @param tracks              the tracks in the order they should be placed
     * @param insertAfterPosition anchor position (0 means the front of the free space)
     * @return number of tracks added and their positions in submission order
     */
    @Transactional
    public AddResult addTracks(String ownerId, String playlistId, List<TrackMetadata> tracks, int insertAfterPosition) {
        if (insertAfterPosition < 0 || insertAfterPosition > PlaylistTrack.MAX_POSITION) {
            throw new InvalidPositionException(String.valueOf(insertAfterPosition),
                    "insertAfterPosition must be between 0 and " + PlaylistTrack.MAX_POSITION);
        }

        Playlist playlist = requirePlaylist(playlistPort.findOwnedForUpdate(playlistId, ownerId), playlistId);

        List<PlaylistTrack> allTracks = playlistTrackPort.findAllByPlaylistId(playlistId);
        List<PlaylistTrack> liveTracks = allTracks.stream().filter(track -> !track.isDeleted()).toList();

        capacityGuard.check(liveTracks.size(), tracks.size());
        duplicateGuard.check(liveTracks.stream().map(PlaylistTrack::getTrackUri).toList(), tracks);

        List<Integer> occupied = allTracks.stream().map(PlaylistTrack::getPosition).toList();
        List<Integer> positions = positionAllocator.allocate(occupied, insertAfterPosition, tracks.size())
                .orElseThrow(() -> {
                    log.debug("No free positions after {} in playlist {} for {} tracks",
                            insertAfterPosition, playlistId, tracks.size());
                    return new PlaylistCapacityExceededException(liveTracks.size(), tracks.size());
                });

        Instant now = Instant.now();
        List<PlaylistTrack> newTracks = new ArrayList<>(tracks.size());
        for (int i = 0; i < tracks.size(); i++) {
            TrackMetadata track = tracks.get(i);
            newTracks.add(new PlaylistTrack(playlistId, positions.get(i), track.trackUri(), track.artist(),
                    track.title(), track.album(), false, now));
        }
        playlistTrackPort.saveAll(newTracks);
        touch(playlist, now);

        log.info("Added {} tracks to playlist {} at positions {}", newTracks.size(), playlistId, positions);
        return new AddResult(newTracks.size(), positions);
    }

    /**
     * Replaces the positions of all live tracks with a client-submitted ordering.
     * Nothing is written unless the ordering is an exact permutation of the live tracks.
     *
     * @param ownerId    the caller identity
     * @param playlistId the playlist identifier
     * @param ordered    the full ordering, one entry per live track
     * @return the applied placements
     */
    @Transactional
    public ReorderResult reorderTracks(String ownerId, String playlistId, List<TrackPlacement> ordered) {
        for (TrackPlacement placement : ordered) {
            if (!PlaylistTrack.isValidPosition(placement.position())) {
                throw new InvalidPositionException(String.valueOf(placement.position()),
                        "Position must be between " + PlaylistTrack.MIN_POSITION + " and " + PlaylistTrack.MAX_POSITION);
            }
        }

        Playlist playlist = requirePlaylist(playlistPort.findOwnedForUpdate(playlistId, ownerId), playlistId);

        List<PlaylistTrack> allTracks = playlistTrackPort.findAllByPlaylistId(playlistId);
        List<TrackPlacement> live = new ArrayList<>();
        List<Integer> reserved = new ArrayList<>();
        for (PlaylistTrack track : allTracks) {
            if (track.isDeleted()) {
                reserved.add(track.getPosition());
            } else {
                live.add(new TrackPlacement(track.getTrackUri(), track.getPosition()));
            }
        }

        ReorderValidation validation = reorderValidator.validate(live, reserved, ordered);
        if (!validation.isValid()) {
            log.debug("Rejected reorder of playlist {}: {}", playlistId, validation.reason());
            throw new ReorderRejectedException(validation);
        }

        // Park every track on a negative slot first so no intermediate state breaks position uniqueness
        for (TrackPlacement placement : ordered) {
            playlistTrackPort.updatePosition(playlistId, placement.trackUri(), -placement.position());
        }
        for (TrackPlacement placement : ordered) {
            playlistTrackPort.updatePosition(playlistId, placement.trackUri(), placement.position());
        }
        touch(playlist, Instant.now());

        log.info("Reordered {} tracks in playlist {}", ordered.size(), playlistId);
        return new ReorderResult(List.copyOf(ordered));
    }

    /**
     * Soft-deletes the live track at a position. The position stays occupied afterwards.
     *
     * @param ownerId    the caller identity
     * @param playlistId the playlist identifier
     * @param position   the position (1..100)
     */
    @Transactional
    public void removeTrack(String ownerId, String playlistId, int position) {
        if (!PlaylistTrack.isValidPosition(position)) {
            throw new InvalidPositionException(String.valueOf(position),
                    "Invalid position: must be between " + PlaylistTrack.MIN_POSITION + " and " + PlaylistTrack.MAX_POSITION);
        }

        Playlist playlist = requirePlaylist(playlistPort.findOwnedForUpdate(playlistId, ownerId), playlistId);

        PlaylistTrack track = playlistTrackPort.findByPosition(playlistId, position);
        if (track == null) {
            throw new ResourceNotFoundException("Track not found at this position");
        }
        if (track.isDeleted()) {
            throw new ResourceNotFoundException("Track already deleted");
        }

        playlistTrackPort.softDeleteAtPosition(playlistId, position);
        touch(playlist, Instant.now());

        log.info("Removed track {} at position {} from playlist {}", track.getTrackUri(), position, playlistId);
    }

    private Playlist requirePlaylist(Playlist playlist, String playlistId) {
        if (playlist == null) {
            throw new ResourceNotFoundException("Playlist not found: " + playlistId);
        }
        return playlist;
    }

    private void touch(Playlist playlist, Instant now) {
        playlist.setUpdatedAt(now);
        playlistPort.save(playlist);
    }

    private void validatePagination(int page, int pageSize) {
        if (page < 1) {
            throw new InvalidPaginationException("page", "Page must be at least 1");
        }
        if (pageSize < MIN_PAGE_SIZE || pageSize > MAX_PAGE_SIZE) {
            throw new InvalidPaginationException("pageSize", "Page size must be between " + MIN_PAGE_SIZE + " and " + MAX_PAGE_SIZE);
        }
    }
}
