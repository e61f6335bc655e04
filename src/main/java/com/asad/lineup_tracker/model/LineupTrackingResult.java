package com.asad.lineup_tracker.model;

import java.util.List;

public record LineupTrackingResult(
        String gameId,
        long homeTeamId,
        long awayTeamId,
        List<LineupState> states,
        List<SubstitutionEvent> substitutions,
        List<SubstitutionChain> substitutionChains,
        List<Diagnostic> diagnostics) {

    public long droppedSubstitutions() {
        return diagnostics.stream()
                .filter(d -> d.type() == DiagnosticType.UNRESOLVED_PLAYER
                        || d.type() == DiagnosticType.UNPARSEABLE_SUBSTITUTION
                        || d.type() == DiagnosticType.UNKNOWN_TEAM)
                .count();
    }
}
