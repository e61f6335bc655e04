package com.asad.lineup_tracker.exception;

import com.asad.lineup_tracker.model.Diagnostic;

import java.util.List;

/**
 * Raised in strict mode when substitutions were dropped or could not be applied.
 */
public class LineupDataException extends RuntimeException {

    private final String gameId;
    private final List<Diagnostic> diagnostics;

    public LineupDataException(String gameId, List<Diagnostic> diagnostics) {
        super("Game " + gameId + " has " + diagnostics.size() + " lossy substitution(s)");
        this.gameId = gameId;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public String getGameId() {
        return gameId;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
