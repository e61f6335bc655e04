package com.asad.lineup_tracker.model;

/**
 * A player entry as decoded from the box score, before the roster is built.
 * {@code minutes} is kept raw ("MM:SS" or "PT25M01.00S"); it is parsed by the roster builder.
 */
public record PlayerRecord(
        long personId,
        String firstName,
        String familyName,
        String nameI,
        String jerseyNum,
        String position,
        String minutes) {}
