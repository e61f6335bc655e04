package com.asad.lineup_tracker.exception;

/**
 * The game record is missing something the tracker cannot do without (team ids, rosters,
 * action log, a usable starting five). The caller should skip the game.
 */
public class StructuralException extends RuntimeException {

    public StructuralException(String message) {
        super(message);
    }

    public StructuralException(String message, Throwable cause) {
        super(message, cause);
    }
}
