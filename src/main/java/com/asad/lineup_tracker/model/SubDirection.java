package com.asad.lineup_tracker.model;

/** Direction of a player's first substitution in a period. */
public enum SubDirection {
    IN,
    OUT
}
