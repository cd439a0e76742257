package com.mixtape.playlist.core.position;

import com.mixtape.playlist.core.exception.DuplicateTrackException;
import com.mixtape.playlist.core.model.TrackMetadata;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Rejects an insert batch as a whole when any of its tracks is already live in the playlist
 * or is submitted twice. The first offending track in submission order is reported.
 */
public class DuplicateGuard {

    public void check(Collection<String> liveTrackUris, List<TrackMetadata> batch) {
        Set<String> live = new HashSet<>(liveTrackUris);
        Set<String> seen = new HashSet<>();

        for (TrackMetadata track : batch) {
            if (live.contains(track.trackUri())) {
                throw new DuplicateTrackException(track.trackUri(),
                        "Track already in playlist: " + track.artist() + " - " + track.title());
            }
            if (!seen.add(track.trackUri())) {
                throw new DuplicateTrackException(track.trackUri(),
                        "Track submitted more than once: " + track.artist() + " - " + track.title());
            }
        }
    }
}
