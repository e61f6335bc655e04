package com.asad.lineup_tracker.model;

import java.util.List;

/**
 * Players on court for both teams from {@code elapsedSeconds} until the next state.
 */
public record LineupState(
        String gameId,
        int period,
        String clock,
        int elapsedSeconds,
        long homeTeamId,
        long awayTeamId,
        List<Long> homePlayers,
        List<Long> awayPlayers) {

    public LineupState {
        homePlayers = List.copyOf(homePlayers);
        awayPlayers = List.copyOf(awayPlayers);
    }
}
