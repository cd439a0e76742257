package com.mixtape.playlist.application.port;

import com.mixtape.playlist.core.model.Playlist;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Persistence interface for playlists.
 * All lookups only see live playlists belonging to the given owner.
 */
public interface PlaylistPort {

    /**
     * Sort keys accepted by {@link #findByOwner}.
     */
    enum SortField {
        CREATED_AT,
        UPDATED_AT,
        NAME
    }

    /**
     * Finds a live playlist of an owner without locking it.
     *
     * @return the playlist, or null if absent, deleted or owned by someone else
     */
    Playlist findOwned(String playlistId, String ownerId);

    /**
     * Finds a live playlist of an owner and takes a write lock on its row until the
     * surrounding transaction ends. Concurrent writers to the same playlist queue up here.
     *
     * @return the playlist, or null if absent, deleted or owned by someone else
     */
    Playlist findOwnedForUpdate(String playlistId, String ownerId);

    /**
     * Finds a page of an owner's live playlists.
     *
     * @param ownerId   the owner identifier
     * @param search    case-insensitive substring of the name, or null for no filter
     * @param sortField the sort key
     * @param ascending the sort direction
     * @param offset    the number of playlists to skip
     * @param limit     the maximum number of playlists to return
     */
    List<Playlist> findByOwner(String ownerId, String search, SortField sortField, boolean ascending, int offset, int limit);

    /**
     * Counts an owner's live playlists matching the search filter.
     */
    int countByOwner(String ownerId, String search);

    /**
     * Checks whether the owner has another live playlist with the same name, ignoring case.
     *
     * @param excludedPlaylistId playlist to ignore (the one being renamed), or null
     */
    boolean existsByOwnerAndName(String ownerId, String name, String excludedPlaylistId);

    /**
     * Counts live tracks for each of the given playlists. Playlists without tracks are absent from the map.
     */
    Map<String, Integer> countLiveTracks(Collection<String> playlistIds);

    /**
     * Saves a playlist.
     *
     * @param playlist the playlist to save
     * @return the saved playlist
     */
    Playlist save(Playlist playlist);
}
