package com.asad.lineup_tracker.model;

public enum DiagnosticType {
    MINUTES_FORMAT(false),
    CLOCK_FORMAT(false),
    UNPARSEABLE_SUBSTITUTION(true),
    UNRESOLVED_PLAYER(true),
    UNKNOWN_TEAM(true),
    PLAYER_NOT_ON_COURT(true),
    PLAYER_ALREADY_ON_COURT(true),
    LINEUP_FALLBACK(false);

    private final boolean dataLoss;

    DiagnosticType(boolean dataLoss) {
        this.dataLoss = dataLoss;
    }

    /** true when a substitution was dropped or could not be applied. */
    public boolean isDataLoss() {
        return dataLoss;
    }
}
