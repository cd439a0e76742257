package com.mixtape.playlist.application.service;

import com.mixtape.playlist.application.port.PlaylistPort;
import com.mixtape.playlist.application.port.PlaylistTrackPort;
import com.mixtape.playlist.config.PlaylistProperties;
import com.mixtape.playlist.core.exception.InvalidPaginationException;
import com.mixtape.playlist.core.exception.PlaylistLimitExceededException;
import com.mixtape.playlist.core.exception.PlaylistNameConflictException;
import com.mixtape.playlist.core.exception.ResourceNotFoundException;
import com.mixtape.playlist.core.model.Playlist;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Service for playlist operations.
 */
@Service
public class PlaylistService {

    private static final Logger log = LoggerFactory.getLogger(PlaylistService.class);

    private static final int MIN_PAGE_SIZE = 1;
    private static final int MAX_PAGE_SIZE = 100;
    private static final String DEFAULT_SORT = "updated_at.desc";

    private final PlaylistPort playlistPort;
    private final PlaylistTrackPort playlistTrackPort;
    private final PlaylistProperties properties;

    public PlaylistService(PlaylistPort playlistPort, PlaylistTrackPort playlistTrackPort, PlaylistProperties properties) {
        this.playlistPort = playlistPort;
        this.playlistTrackPort = playlistTrackPort;
        this.properties = properties;
    }

    /**
     * A playlist together with its live track count.
     */
    public record PlaylistWithCount(
            Playlist playlist,
            int trackCount
    ) {}

    /**
     * Result record containing one page of playlists.
     */
    public record PlaylistPage(
            List<PlaylistWithCount> items,
            int page,
            int pageSize,
            int total
    ) {}

    /**
     * Lists the caller's live playlists.
     *
     * @param ownerId  the caller identity
     * @param page     the page number (1-based)
     * @param pageSize the page size (1..100)
     * @param search   optional case-insensitive name filter
     * @param sort     {@code column.direction}, column one of created_at, updated_at, name
     * @return the requested page and the total number of matching playlists
     */
    @Transactional(readOnly = true)
    public PlaylistPage listPlaylists(String ownerId, int page, int pageSize, String search, String sort) {
        validatePagination(page, pageSize);
        String sortOption = (sort == null || sort.isBlank() ? DEFAULT_SORT : sort).toLowerCase(Locale.ROOT);
        PlaylistPort.SortField sortField = parseSortField(sortOption);
        boolean ascending = sortOption.endsWith(".asc");
        String filter = search == null || search.isBlank() ? null : search.trim();

        List<Playlist> playlists = playlistPort.findByOwner(ownerId, filter, sortField, ascending,
                (page - 1) * pageSize, pageSize);
        int total = playlistPort.countByOwner(ownerId, filter);
        Map<String, Integer> counts = playlistPort.countLiveTracks(playlists.stream().map(Playlist::getId).toList());

        List<PlaylistWithCount> items = playlists.stream()
                .map(playlist -> new PlaylistWithCount(playlist, counts.getOrDefault(playlist.getId(), 0)))
                .toList();
        return new PlaylistPage(items, page, pageSize, total);
    }

    /**
     * Creates a playlist for the caller.
     *
     * @param ownerId     the caller identity
     * @param name        the playlist name, unique per owner ignoring case
     * @param description optional description
     * @return the created playlist
     */
    @Transactional
    public Playlist createPlaylist(String ownerId, String name, String description) {
        int owned = playlistPort.countByOwner(ownerId, null);
        if (owned >= properties.maxPlaylistsPerOwner()) {
            throw new PlaylistLimitExceededException(properties.maxPlaylistsPerOwner());
        }
        if (playlistPort.existsByOwnerAndName(ownerId, name, null)) {
            throw new PlaylistNameConflictException(name);
        }

        Instant now = Instant.now();
        Playlist playlist = new Playlist(UUID.randomUUID().toString(), ownerId, name, description, false, now, now);
        Playlist saved = playlistPort.save(playlist);

        log.info("Created playlist {} for owner {}", saved.getId(), ownerId);
        return saved;
    }

    /**
     * Gets a single playlist of the caller.
     */
    @Transactional(readOnly = true)
    public PlaylistWithCount getPlaylist(String ownerId, String playlistId) {
        Playlist playlist = requirePlaylist(playlistPort.findOwned(playlistId, ownerId), playlistId);
        return new PlaylistWithCount(playlist, playlistTrackPort.countLiveByPlaylistId(playlistId));
    }

    /**
     * Updates the name or description of a playlist. A null name leaves the name unchanged;
     * the description is replaced, possibly with null, only when {@code descriptionPresent} is set.
     */
    @Transactional
    public Playlist updatePlaylist(String ownerId, String playlistId, String name,
                                   boolean descriptionPresent, String description) {
        Playlist playlist = requirePlaylist(playlistPort.findOwnedForUpdate(playlistId, ownerId), playlistId);

        if (name != null) {
            if (playlistPort.existsByOwnerAndName(ownerId, name, playlistId)) {
                throw new PlaylistNameConflictException(name);
            }
            playlist.setName(name);
        }
        if (descriptionPresent) {
            playlist.setDescription(description);
        }
        playlist.setUpdatedAt(Instant.now());

        return playlistPort.save(playlist);
    }

    /**
     * Soft-deletes a playlist and every live track in it.
     */
    @Transactional
    public void deletePlaylist(String ownerId, String playlistId) {
        Playlist playlist = requirePlaylist(playlistPort.findOwnedForUpdate(playlistId, ownerId), playlistId);

        int removedTracks = playlistTrackPort.softDeleteAllByPlaylistId(playlistId);
        playlist.setDeleted(true);
        playlist.setUpdatedAt(Instant.now());
        playlistPort.save(playlist);

        log.info("Deleted playlist {} with {} live tracks", playlistId, removedTracks);
    }

    private Playlist requirePlaylist(Playlist playlist, String playlistId) {
        if (playlist == null) {
            throw new ResourceNotFoundException("Playlist not found: " + playlistId);
        }
        return playlist;
    }

    private PlaylistPort.SortField parseSortField(String sort) {
        return switch (sort) {
            case "created_at.asc", "created_at.desc" -> PlaylistPort.SortField.CREATED_AT;
            case "updated_at.asc", "updated_at.desc" -> PlaylistPort.SortField.UPDATED_AT;
            case "name.asc", "name.desc" -> PlaylistPort.SortField.NAME;
            default -> throw new InvalidPaginationException("sort", "Invalid sort option: " + sort);
        };
    }

    private void validatePagination(int page, int pageSize) {
        if (page < 1) {
            throw new InvalidPaginationException("page", "Page must be at least 1");
        }
        if (pageSize < MIN_PAGE_SIZE || pageSize > MAX_PAGE_SIZE) {
            throw new InvalidPaginationException("pageSize", "Page size must be between " + MIN_PAGE_SIZE + " and " + MAX_PAGE_SIZE);
        }
        if ((long) page * pageSize > properties.maxPaginationWindow()) {
            throw new InvalidPaginationException("page", "Pagination limit exceeded");
        }
    }
}
