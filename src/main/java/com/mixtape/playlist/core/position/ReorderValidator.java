package com.mixtape.playlist.core.position;

import com.mixtape.playlist.core.model.TrackPlacement;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Validates a client-submitted full ordering against the live tracks of a playlist.
 * <p>
 * Checks run in a fixed order and the first failing one determines the result:
 * <ol>
 *     <li>the number of submitted items equals the number of live tracks</li>
 *     <li>the submitted URIs are exactly the live URIs</li>
 *     <li>no position is submitted twice</li>
 *     <li>no submitted position is held by a removed track</li>
 * </ol>
 */
public class ReorderValidator {

    /**
     * @param liveTracks        live tracks of the playlist, ordered by position
     * @param reservedPositions positions held by removed tracks of the same playlist
     * @param submitted         the requested ordering
     */
    public ReorderValidation validate(List<TrackPlacement> liveTracks,
                                      Collection<Integer> reservedPositions,
                                      List<TrackPlacement> submitted) {
        int currentCount = liveTracks.size();
        if (submitted.size() != currentCount) {
            return ReorderValidation.countMismatch(currentCount, submitted.size());
        }

        Set<String> currentUris = new LinkedHashSet<>();
        liveTracks.forEach(track -> currentUris.add(track.trackUri()));
        Set<String> submittedUris = new LinkedHashSet<>();
        submitted.forEach(track -> submittedUris.add(track.trackUri()));

        List<String> missing = currentUris.stream().filter(uri -> !submittedUris.contains(uri)).toList();
        List<String> extra = submittedUris.stream().filter(uri -> !currentUris.contains(uri)).toList();
        if (!missing.isEmpty() || !extra.isEmpty()) {
            return ReorderValidation.missingOrExtra(currentCount, missing, extra);
        }

        Set<Integer> seenPositions = new HashSet<>();
        Set<Integer> duplicates = new LinkedHashSet<>();
        for (TrackPlacement placement : submitted) {
            if (!seenPositions.add(placement.position())) {
                duplicates.add(placement.position());
            }
        }
        if (!duplicates.isEmpty()) {
            return ReorderValidation.duplicatePosition(currentCount, new ArrayList<>(duplicates));
        }

        Set<Integer> reserved = new HashSet<>(reservedPositions);
        List<Integer> taken = submitted.stream()
                .map(TrackPlacement::position)
                .filter(reserved::contains)
                .sorted()
                .toList();
        if (!taken.isEmpty()) {
            return ReorderValidation.positionReserved(currentCount, taken);
        }

        return ReorderValidation.valid(currentCount);
    }
}
