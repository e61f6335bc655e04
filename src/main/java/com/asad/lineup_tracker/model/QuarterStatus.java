package com.asad.lineup_tracker.model;

public enum QuarterStatus {
    /** On court at the start of the period (first substitution was OUT). */
    STARTED,
    /** Off court at the start of the period. */
    BENCHED,
    /** No substitution in the period, but recorded on-court actions. */
    PLAYED_FULL;

    public boolean onCourtAtStart() {
        return this == STARTED || this == PLAYED_FULL;
    }
}
