package com.mixtape.playlist.core.position;

import com.mixtape.playlist.core.model.PlaylistTrack;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Computes positions for a batch of new tracks.
 * <p>
 * First-fit, left-to-right scan starting right after the anchor position. Every position that was
 * ever used in the playlist counts as occupied, soft-deleted tracks included. Positions are handed
 * out in submission order, so the first submitted track always receives the lowest position.
 */
public class PositionAllocator {

    /**
     * Allocates one position per new track.
     *
     * @param occupiedPositions   positions held by any track of the playlist, live or deleted
     * @param insertAfterPosition anchor; scanning starts at {@code insertAfterPosition + 1}
     * @param batchSize           number of tracks to place
     * @return ascending positions, one per track, or empty if the batch does not fit before position 100
     */
    public Optional<List<Integer>> allocate(Collection<Integer> occupiedPositions, int insertAfterPosition, int batchSize) {
        if (insertAfterPosition < 0 || insertAfterPosition > PlaylistTrack.MAX_POSITION) {
            throw new IllegalArgumentException("insertAfterPosition must be between 0 and " + PlaylistTrack.MAX_POSITION);
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive");
        }

        Set<Integer> occupied = new HashSet<>(occupiedPositions);
        List<Integer> positions = new ArrayList<>(batchSize);
        int cursor = insertAfterPosition + 1;

        for (int i = 0; i < batchSize; i++) {
            while (cursor <= PlaylistTrack.MAX_POSITION && occupied.contains(cursor)) {
                cursor++;
            }
            if (cursor > PlaylistTrack.MAX_POSITION) {
                return Optional.empty();
            }
            positions.add(cursor);
            occupied.add(cursor);
            cursor++;
        }

        return Optional.of(positions);
    }
}
