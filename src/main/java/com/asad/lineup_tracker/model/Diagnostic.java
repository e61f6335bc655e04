package com.asad.lineup_tracker.model;

/**
 * A recoverable data-quality problem found while processing a game.
 * {@code actionNumber} is null for problems not tied to one action (roster, lineup fallbacks).
 */
public record Diagnostic(DiagnosticType type, Integer actionNumber, String message) {

    public static Diagnostic of(DiagnosticType type, String message) {
        return new Diagnostic(type, null, message);
    }

    public static Diagnostic at(DiagnosticType type, int actionNumber, String message) {
        return new Diagnostic(type, actionNumber, message);
    }
}
