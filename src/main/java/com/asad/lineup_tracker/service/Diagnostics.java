package com.asad.lineup_tracker.service;

import com.asad.lineup_tracker.model.Diagnostic;
import com.asad.lineup_tracker.model.DiagnosticType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-game collector for data-quality problems. Every entry is also logged, WARN when a
 * substitution was lost and DEBUG otherwise.
 */
public final class Diagnostics {

    private static final Logger log = LoggerFactory.getLogger(Diagnostics.class);

    private final String gameId;
    private final List<Diagnostic> entries = new ArrayList<>();

    public Diagnostics(String gameId) {
        this.gameId = gameId;
    }

    public void add(Diagnostic d) {
        entries.add(d);
        if (d.type().isDataLoss()) {
            log.warn("Game {} action #{}: {} - {}", gameId, d.actionNumber(), d.type(), d.message());
        } else {
            log.debug("Game {} action #{}: {} - {}", gameId, d.actionNumber(), d.type(), d.message());
        }
    }

    public void add(DiagnosticType type, String message) {
        add(Diagnostic.of(type, message));
    }

    public void add(DiagnosticType type, int actionNumber, String message) {
        add(Diagnostic.at(type, actionNumber, message));
    }

    public List<Diagnostic> list() {
        return List.copyOf(entries);
    }

    public List<Diagnostic> dataLoss() {
        return entries.stream().filter(d -> d.type().isDataLoss()).toList();
    }
}
