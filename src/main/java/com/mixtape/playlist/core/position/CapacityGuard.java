package com.mixtape.playlist.core.position;

import com.mixtape.playlist.core.exception.PlaylistCapacityExceededException;
import com.mixtape.playlist.core.model.PlaylistTrack;

/**
 * Enforces the live-track ceiling of a playlist before any position is allocated.
 */
public class CapacityGuard {

    public void check(int liveCount, int batchSize) {
        if (liveCount + batchSize > PlaylistTrack.MAX_POSITION) {
            throw new PlaylistCapacityExceededException(liveCount, batchSize);
        }
    }
}
