package com.mixtape.playlist.infrastructure.persistence.adapter;

import com.mixtape.playlist.application.port.PlaylistPort;
import com.mixtape.playlist.core.model.Playlist;
import com.mixtape.playlist.infrastructure.persistence.dao.PlaylistDao;
import com.mixtape.playlist.infrastructure.persistence.repository.PlaylistJpaRepository;
import com.mixtape.playlist.infrastructure.persistence.repository.PlaylistTrackJpaRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Adapter implementing PlaylistPort using Spring Data JPA.
 * Maps between JPA DAOs and core domain entities.
 */
@Component
public class PlaylistAdapter implements PlaylistPort {

    private final PlaylistJpaRepository jpaRepository;
    private final PlaylistTrackJpaRepository trackJpaRepository;

    public PlaylistAdapter(PlaylistJpaRepository jpaRepository, PlaylistTrackJpaRepository trackJpaRepository) {
        this.jpaRepository = jpaRepository;
        this.trackJpaRepository = trackJpaRepository;
    }

    @Override
    public Playlist findOwned(String playlistId, String ownerId) {
        return jpaRepository.findByIdAndOwnerIdAndDeletedFalse(playlistId, ownerId)
                .map(this::toCoreEntity)
                .orElse(null);
    }

    @Override
    public Playlist findOwnedForUpdate(String playlistId, String ownerId) {
        return jpaRepository.findLiveForUpdate(playlistId, ownerId)
                .map(this::toCoreEntity)
                .orElse(null);
    }

    @Override
    public List<Playlist> findByOwner(String ownerId, String search, SortField sortField, boolean ascending,
                                      int offset, int limit) {
        Sort sort = Sort.by(ascending ? Sort.Direction.ASC : Sort.Direction.DESC, toProperty(sortField))
                .and(Sort.by(Sort.Direction.ASC, "id"));
        Pageable pageable = PageRequest.of(offset / limit, limit, sort);

        List<PlaylistDao> daos = search == null
                ? jpaRepository.findByOwnerIdAndDeletedFalse(ownerId, pageable)
                : jpaRepository.findByOwnerIdAndDeletedFalseAndNameContainingIgnoreCase(ownerId, search, pageable);
        return daos.stream().map(this::toCoreEntity).toList();
    }

    @Override
    public int countByOwner(String ownerId, String search) {
        return search == null
                ? jpaRepository.countByOwnerIdAndDeletedFalse(ownerId)
                : jpaRepository.countByOwnerIdAndDeletedFalseAndNameContainingIgnoreCase(ownerId, search);
    }

    @Override
    public boolean existsByOwnerAndName(String ownerId, String name, String excludedPlaylistId) {
        return excludedPlaylistId == null
                ? jpaRepository.existsByOwnerIdAndDeletedFalseAndNameIgnoreCase(ownerId, name)
                : jpaRepository.existsByOwnerIdAndDeletedFalseAndNameIgnoreCaseAndIdNot(ownerId, name, excludedPlaylistId);
    }

    @Override
    public Map<String, Integer> countLiveTracks(Collection<String> playlistIds) {
        if (playlistIds.isEmpty()) {
            return Map.of();
        }
        Map<String, Integer> counts = new HashMap<>();
        for (Object[] row : trackJpaRepository.countLiveGroupedByPlaylistId(playlistIds)) {
            counts.put((String) row[0], ((Number) row[1]).intValue());
        }
        return counts;
    }

    @Override
    public Playlist save(Playlist playlist) {
        PlaylistDao dao = toDao(playlist);
        PlaylistDao savedDao = jpaRepository.save(dao);
        return toCoreEntity(savedDao);
    }

    private String toProperty(SortField sortField) {
        return switch (sortField) {
            case CREATED_AT -> "createdAt";
            case UPDATED_AT -> "updatedAt";
            case NAME -> "name";
        };
    }

    private Playlist toCoreEntity(PlaylistDao dao) {
        return new Playlist(
                dao.getId(),
                dao.getOwnerId(),
                dao.getName(),
                dao.getDescription(),
                dao.isDeleted(),
                dao.getCreatedAt(),
                dao.getUpdatedAt()
        );
    }

    private PlaylistDao toDao(Playlist playlist) {
        return new PlaylistDao(
                playlist.getId(),
                playlist.getOwnerId(),
                playlist.getName(),
                playlist.getDescription(),
                playlist.isDeleted(),
                playlist.getCreatedAt(),
                playlist.getUpdatedAt()
        );
    }
}
