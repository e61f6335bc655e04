package com.asad.lineup_tracker.model;

import java.util.List;

/** Answer to "who was on court at (period, clock)". */
public record OnCourtLineup(
        String gameId,
        int period,
        String clock,
        long homeTeamId,
        long awayTeamId,
        List<Long> homePlayers,
        List<Long> awayPlayers,
        List<String> homePlayerNames,
        List<String> awayPlayerNames) {}
