package com.asad.lineup_tracker.model;

import java.util.List;

public record TeamRecord(long teamId, String tricode, List<PlayerRecord> players) {
    public TeamRecord {
        players = List.copyOf(players);
    }
}
