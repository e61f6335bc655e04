package com.asad.lineup_tracker.model;

/**
 * One entry of the play-by-play log.
 *
 * <p>{@code clock} is the raw PT string (time REMAINING in the period). {@code teamId} and
 * {@code personId} are null for game-level actions such as period start/end.
 */
public record Action(
        int actionNumber,
        int period,
        String clock,
        Long teamId,
        Long personId,
        String playerName,
        String actionType,
        String description) {

    public boolean isType(String type) {
        return actionType != null && actionType.equalsIgnoreCase(type);
    }
}
