package com.asad.lineup_tracker.exception;

/** A lineup state that breaks the five-distinct-players-per-team rules. Always a bug. */
public class InvariantViolationException extends IllegalStateException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
