package com.example.sourcesync.domain.enumtype;

public enum LoopType {

    /** Another access to the same path is still open. */
    CONCURRENT_ACCESS(true),

    /** The path was completed less than the minimum scan interval ago. */
    TOO_SOON(false),

    /** The path reached the access limit inside the trailing time window. */
    TOO_FREQUENT(false),

    /** The scan revisited a path after moving through other paths (A, B, A). */
    PATTERN_CYCLE(true),

    /** An access stayed open longer than the maximum scan duration. */
    STUCK_SCAN(false);

    private final boolean critical;

    LoopType(boolean critical) {
        this.critical = critical;
    }

    public boolean isCritical() {
        return critical;
    }
}
