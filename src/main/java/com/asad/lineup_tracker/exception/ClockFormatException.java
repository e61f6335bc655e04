package com.asad.lineup_tracker.exception;

/** A clock string that does not match {@code PT{mm}M{ss.ss}S}. */
public class ClockFormatException extends IllegalArgumentException {

    public ClockFormatException(String clock) {
        super("Invalid clock format: " + clock);
    }
}
