package com.asad.lineup_tracker.model;

import java.util.List;

/** Substitutions made in quick succession (same dead ball, or back-to-back swaps). */
public record SubstitutionChain(int period, List<SubstitutionEvent> events) {
    public SubstitutionChain {
        events = List.copyOf(events);
    }

    public int startElapsedSeconds() { return events.get(0).elapsedSeconds(); }
    public int endElapsedSeconds() { return events.get(events.size() - 1).elapsedSeconds(); }
    public int size() { return events.size(); }
}
