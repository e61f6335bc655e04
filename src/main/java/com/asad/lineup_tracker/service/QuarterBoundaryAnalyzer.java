package com.asad.lineup_tracker.service;

import com.asad.lineup_tracker.model.Action;
import com.asad.lineup_tracker.model.QuarterBoundary;

import java.util.Collections;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

/** One pass over the log: first and last action number of every period seen. */
public final class QuarterBoundaryAnalyzer {

    public NavigableMap<Integer, QuarterBoundary> analyze(List<Action> actions) {
        NavigableMap<Integer, QuarterBoundary> out = new TreeMap<>();

        for (Action a : actions) {
            QuarterBoundary b = out.get(a.period());
            if (b == null) {
                out.put(a.period(), new QuarterBoundary(a.period(), a.actionNumber(), a.actionNumber()));
            } else {
                out.put(a.period(), new QuarterBoundary(
                        a.period(),
                        Math.min(b.firstActionNumber(), a.actionNumber()),
                        Math.max(b.lastActionNumber(), a.actionNumber())
                ));
            }
        }

        return Collections.unmodifiableNavigableMap(out);
    }
}
