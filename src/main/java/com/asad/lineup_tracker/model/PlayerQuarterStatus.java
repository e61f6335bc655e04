package com.asad.lineup_tracker.model;

/**
 * How one player's period started, as read from substitution direction and on-court activity.
 * {@code firstSubDirection} and {@code firstSubActionNumber} are null when the player had no
 * substitution in the period.
 */
public record PlayerQuarterStatus(
        long playerId,
        long teamId,
        int period,
        SubDirection firstSubDirection,
        Integer firstSubActionNumber,
        int onCourtActionCount,
        QuarterStatus status) {}
