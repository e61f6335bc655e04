package com.asad.lineup_tracker.model;

public record SubstitutionEvent(
        String gameId,
        int actionNumber,
        int period,
        String clock,
        int elapsedSeconds,
        long teamId,
        long playerOutId,
        String playerOutName,
        long playerInId,
        String playerInName,
        String description) {}
