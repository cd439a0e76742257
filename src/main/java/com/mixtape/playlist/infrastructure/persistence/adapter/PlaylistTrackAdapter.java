package com.mixtape.playlist.infrastructure.persistence.adapter;

import com.mixtape.playlist.application.port.PlaylistTrackPort;
import com.mixtape.playlist.core.model.PlaylistTrack;
import com.mixtape.playlist.infrastructure.persistence.dao.PlaylistTrackDao;
import com.mixtape.playlist.infrastructure.persistence.repository.PlaylistTrackJpaRepository;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Adapter implementing PlaylistTrackPort using Spring Data JPA.
 * Maps between JPA DAOs and core domain entities.
 */
@Component
public class PlaylistTrackAdapter implements PlaylistTrackPort {

    private final PlaylistTrackJpaRepository jpaRepository;

    public PlaylistTrackAdapter(PlaylistTrackJpaRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }

    @Override
    public List<PlaylistTrack> findLiveByPlaylistId(String playlistId, int offset, int limit) {
        return jpaRepository.findLiveByPlaylistIdWithPagination(playlistId, offset, limit)
                .stream()
                .map(this::toCoreEntity)
                .toList();
    }

    @Override
    public List<PlaylistTrack> findAllByPlaylistId(String playlistId) {
        return jpaRepository.findByPlaylistIdOrderByPositionAsc(playlistId)
                .stream()
                .map(this::toCoreEntity)
                .toList();
    }

    @Override
    public int countLiveByPlaylistId(String playlistId) {
        return jpaRepository.countByPlaylistIdAndDeletedFalse(playlistId);
    }

    @Override
    public PlaylistTrack findByPosition(String playlistId, int position) {
        return jpaRepository.findByPlaylistIdAndPosition(playlistId, position)
                .map(this::toCoreEntity)
                .orElse(null);
    }

    @Override
    public void saveAll(List<PlaylistTrack> tracks) {
        jpaRepository.saveAll(tracks.stream().map(this::toNewDao).toList());
    }

    @Override
    public int updatePosition(String playlistId, String trackUri, int position) {
        return jpaRepository.updatePosition(playlistId, trackUri, position);
    }

    @Override
    public int softDeleteAtPosition(String playlistId, int position) {
        return jpaRepository.softDeleteAtPosition(playlistId, position);
    }

    @Override
    public int softDeleteAllByPlaylistId(String playlistId) {
        return jpaRepository.softDeleteAllByPlaylistId(playlistId);
    }

    private PlaylistTrack toCoreEntity(PlaylistTrackDao dao) {
        return new PlaylistTrack(
                dao.getPlaylistId(),
                dao.getPosition(),
                dao.getTrackUri(),
                dao.getArtist(),
                dao.getTitle(),
                dao.getAlbum(),
                dao.isDeleted(),
                dao.getAddedAt()
        );
    }

    private PlaylistTrackDao toNewDao(PlaylistTrack track) {
        return new PlaylistTrackDao(
                UUID.randomUUID().toString(),
                track.getPlaylistId(),
                track.getPosition(),
                track.getTrackUri(),
                track.getArtist(),
                track.getTitle(),
                track.getAlbum(),
                track.isDeleted(),
                track.getAddedAt()
        );
    }
}
