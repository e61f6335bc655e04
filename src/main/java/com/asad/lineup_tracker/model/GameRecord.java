package com.asad.lineup_tracker.model;

import java.util.List;

/**
 * Decoded input for a single game: both box-score rosters plus the raw action log, in log order.
 */
public record GameRecord(String gameId, TeamRecord homeTeam, TeamRecord awayTeam, List<Action> actions) {
    public GameRecord {
        actions = List.copyOf(actions);
    }

    public long homeTeamId() { return homeTeam.teamId(); }
    public long awayTeamId() { return awayTeam.teamId(); }
}
