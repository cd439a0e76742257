package com.mixtape.playlist.application.port;

import com.mixtape.playlist.core.model.PlaylistTrack;

import java.util.List;

/**
 * Persistence interface for playlist tracks. Database plugs into here for the actual implementation.
 * Callers that mutate tracks are expected to hold the playlist lock obtained through {@link PlaylistPort}.
 */
public interface PlaylistTrackPort {

    /**
     * Finds live tracks of a playlist with pagination.
     *
     * @param playlistId the playlist identifier
     * @param offset     the number of live tracks to skip (0-based)
     * @param limit      the maximum number of tracks to return
     * @return live tracks ordered by position
     */
    List<PlaylistTrack> findLiveByPlaylistId(String playlistId, int offset, int limit);

    /**
     * Finds every track of a playlist, removed ones included, ordered by position.
     * Used to compute occupied positions and the live set in one read.
     *
     * @param playlistId the playlist identifier
     * @return all tracks ordered by position
     */
    List<PlaylistTrack> findAllByPlaylistId(String playlistId);

    /**
     * Counts live tracks of a playlist.
     *
     * @param playlistId the playlist identifier
     * @return the live track count
     */
    int countLiveByPlaylistId(String playlistId);

    /**
     * Finds the track occupying a position, live or removed.
     *
     * @param playlistId the playlist identifier
     * @param position   the position (1-based)
     * @return the track, or null if the position was never used
     */
    PlaylistTrack findByPosition(String playlistId, int position);

    /**
     * Inserts new tracks. Positions must already be allocated.
     *
     * @param tracks the tracks to insert
     */
    void saveAll(List<PlaylistTrack> tracks);

    /**
     * Moves a live track to a new position, identified by its URI.
     *
     * @param playlistId the playlist identifier
     * @param trackUri   the live track's URI
     * @param position   the new position; may be negative while parking tracks during a reorder
     * @return the number of rows updated
     */
    int updatePosition(String playlistId, String trackUri, int position);

    /**
     * Flags the live track at a position as deleted.
     *
     * @param playlistId the playlist identifier
     * @param position   the position (1-based)
     * @return the number of rows updated, 0 if no live track sits there
     */
    int softDeleteAtPosition(String playlistId, int position);

    /**
     * Flags every live track of a playlist as deleted.
     *
     * @param playlistId the playlist identifier
     * @return the number of rows updated
     */
    int softDeleteAllByPlaylistId(String playlistId);
}
