package com.mixtape.playlist.core.position;

import java.util.List;

/**
 * Outcome of validating a submitted ordering. A valid result carries no reason;
 * a rejected one names the first check that failed together with what it found.
 */
public record ReorderValidation(
        Reason reason,
        String message,
        int currentCount,
        int submittedCount,
        List<String> missing,
        List<String> extra,
        List<Integer> conflictingPositions
) {

    public enum Reason {
        COUNT_MISMATCH,
        MISSING_OR_EXTRA_ITEMS,
        DUPLICATE_POSITION,
        POSITION_RESERVED
    }

    public static ReorderValidation valid(int count) {
        return new ReorderValidation(null, "Ordering accepted", count, count, List.of(), List.of(), List.of());
    }

    static ReorderValidation countMismatch(int currentCount, int submittedCount) {
        return new ReorderValidation(Reason.COUNT_MISMATCH,
                "Ordered tracks must match current playlist tracks exactly",
                currentCount, submittedCount, List.of(), List.of(), List.of());
    }

    static ReorderValidation missingOrExtra(int count, List<String> missing, List<String> extra) {
        return new ReorderValidation(Reason.MISSING_OR_EXTRA_ITEMS,
                "Ordered tracks must match current playlist tracks exactly",
                count, count, List.copyOf(missing), List.copyOf(extra), List.of());
    }

    static ReorderValidation duplicatePosition(int count, List<Integer> positions) {
        return new ReorderValidation(Reason.DUPLICATE_POSITION,
                "Duplicate positions found in ordered list",
                count, count, List.of(), List.of(), List.copyOf(positions));
    }

    static ReorderValidation positionReserved(int count, List<Integer> positions) {
        return new ReorderValidation(Reason.POSITION_RESERVED,
                "Positions are held by removed tracks and cannot be reused",
                count, count, List.of(), List.of(), List.copyOf(positions));
    }

    public boolean isValid() {
        return reason == null;
    }
}
