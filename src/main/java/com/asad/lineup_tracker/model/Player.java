package com.asad.lineup_tracker.model;

/**
 * A roster entry in the per-game player directory.
 *
 * @param displayName the box-score short name ("J. Brunson"), or "first family" when absent
 * @param starter nominal starter flag (top 5 by minutes among players with a position)
 * @param minutesSeconds total game minutes, in seconds
 */
public record Player(
        long id,
        String firstName,
        String familyName,
        String displayName,
        String jerseyNum,
        String position,
        long teamId,
        boolean starter,
        int minutesSeconds) {

    public String fullName() {
        return (firstName + " " + familyName).trim();
    }

    /** "J. Brunson" style; falls back to the family name when there is no first name. */
    public String shortName() {
        if (firstName == null || firstName.isEmpty()) return familyName;
        return firstName.charAt(0) + ". " + familyName;
    }
}
