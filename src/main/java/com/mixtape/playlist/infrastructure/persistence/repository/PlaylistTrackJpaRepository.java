package com.mixtape.playlist.infrastructure.persistence.repository;

import com.mixtape.playlist.infrastructure.persistence.dao.PlaylistTrackDao;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA repository for playlist tracks.
 */
@Repository
public interface PlaylistTrackJpaRepository extends JpaRepository<PlaylistTrackDao, String> {

    /**
     * Finds live tracks with pagination using native query for proper offset/limit support.
     */
    @Query(value = "SELECT * FROM playlist_tracks WHERE playlist_id = :playlistId AND is_deleted = FALSE "
            + "ORDER BY track_position ASC LIMIT :limit OFFSET :offset",
            nativeQuery = true)
    List<PlaylistTrackDao> findLiveByPlaylistIdWithPagination(
            @Param("playlistId") String playlistId,
            @Param("offset") int offset,
            @Param("limit") int limit
    );

    /**
     * Finds all tracks of a playlist, removed ones included, ordered by position.
     */
    List<PlaylistTrackDao> findByPlaylistIdOrderByPositionAsc(String playlistId);

    int countByPlaylistIdAndDeletedFalse(String playlistId);

    Optional<PlaylistTrackDao> findByPlaylistIdAndPosition(String playlistId, int position);

    /**
     * Counts live tracks per playlist. Each row is {@code [playlistId, count]}.
     */
    @Query("SELECT t.playlistId, COUNT(t) FROM PlaylistTrackDao t "
            + "WHERE t.playlistId IN :playlistIds AND t.deleted = false GROUP BY t.playlistId")
    List<Object[]> countLiveGroupedByPlaylistId(@Param("playlistIds") Collection<String> playlistIds);

    /**
     * Updates the position of the live track with the given URI.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE PlaylistTrackDao t SET t.position = :position "
            + "WHERE t.playlistId = :playlistId AND t.trackUri = :trackUri AND t.deleted = false")
    int updatePosition(
            @Param("playlistId") String playlistId,
            @Param("trackUri") String trackUri,
            @Param("position") int position
    );

    /**
     * Flags the live track at the given position as deleted.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE PlaylistTrackDao t SET t.deleted = true "
            + "WHERE t.playlistId = :playlistId AND t.position = :position AND t.deleted = false")
    int softDeleteAtPosition(
            @Param("playlistId") String playlistId,
            @Param("position") int position
    );

    /**
     * Flags every live track of a playlist as deleted.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE PlaylistTrackDao t SET t.deleted = true WHERE t.playlistId = :playlistId AND t.deleted = false")
    int softDeleteAllByPlaylistId(@Param("playlistId") String playlistId);
}
