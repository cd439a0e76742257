package com.mixtape.playlist.infrastructure.persistence.repository;

import com.mixtape.playlist.infrastructure.persistence.dao.PlaylistDao;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA repository for playlists.
 */
@Repository
public interface PlaylistJpaRepository extends JpaRepository<PlaylistDao, String> {

    Optional<PlaylistDao> findByIdAndOwnerIdAndDeletedFalse(String id, String ownerId);

    /**
     * Loads a live playlist with {@code SELECT ... FOR UPDATE}; the row lock is held until the transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PlaylistDao p WHERE p.id = :id AND p.ownerId = :ownerId AND p.deleted = false")
    Optional<PlaylistDao> findLiveForUpdate(@Param("id") String id, @Param("ownerId") String ownerId);

    List<PlaylistDao> findByOwnerIdAndDeletedFalse(String ownerId, Pageable pageable);

    List<PlaylistDao> findByOwnerIdAndDeletedFalseAndNameContainingIgnoreCase(String ownerId, String name, Pageable pageable);

    int countByOwnerIdAndDeletedFalse(String ownerId);

    int countByOwnerIdAndDeletedFalseAndNameContainingIgnoreCase(String ownerId, String name);

    boolean existsByOwnerIdAndDeletedFalseAndNameIgnoreCase(String ownerId, String name);

    boolean existsByOwnerIdAndDeletedFalseAndNameIgnoreCaseAndIdNot(String ownerId, String name, String id);
}
