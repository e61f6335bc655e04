package com.asad.lineup_tracker.service;

import com.asad.lineup_tracker.exception.StructuralException;
import com.asad.lineup_tracker.model.DiagnosticType;
import com.asad.lineup_tracker.model.Player;
import com.asad.lineup_tracker.model.PlayerRecord;
import com.asad.lineup_tracker.model.TeamRecord;

import java.util.*;

/**
 * Builds the per-game player directory from both box-score rosters.
 *
 * Nominal starters are the top 5 by minutes among players that have a position and a minutes
 * value. The feed's own starter flag is not trusted.
 */
public final class RosterBuilder {

    static final int STARTERS_PER_TEAM = 5;

    private final Diagnostics diagnostics;

    public RosterBuilder(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * @return directory keyed by person id, home players first then away, each in feed order
     * @throws StructuralException if a person id appears twice
     */
    public Map<Long, Player> build(TeamRecord home, TeamRecord away) {
        Map<Long, Player> roster = new LinkedHashMap<>();
        addTeam(roster, home);
        addTeam(roster, away);
        return Collections.unmodifiableMap(roster);
    }

    private void addTeam(Map<Long, Player> roster, TeamRecord team) {
        Map<Long, Integer> seconds = new HashMap<>();
        for (PlayerRecord p : team.players()) {
            seconds.put(p.personId(), minutesToSeconds(p));
        }

        Set<Long> starters = identifyStarters(team.players(), seconds);

        for (PlayerRecord p : team.players()) {
            if (roster.containsKey(p.personId())) {
                throw new StructuralException("Player id " + p.personId() + " appears more than once"
                        + " (team " + team.teamId() + ")");
            }

            String first = nullToEmpty(p.firstName());
            String family = nullToEmpty(p.familyName());
            String displayName = (p.nameI() != null && !p.nameI().isBlank())
                    ? p.nameI().trim()
                    : (first + " " + family).trim();

            roster.put(p.personId(), new Player(
                    p.personId(),
                    first,
                    family,
                    displayName,
                    nullToEmpty(p.jerseyNum()),
                    nullToEmpty(p.position()),
                    team.teamId(),
                    starters.contains(p.personId()),
                    seconds.get(p.personId())
            ));
        }
    }

    private Set<Long> identifyStarters(List<PlayerRecord> players, Map<Long, Integer> seconds) {
        List<PlayerRecord> eligible = new ArrayList<>();
        for (PlayerRecord p : players) {
            boolean hasPosition = p.position() != null && !p.position().isBlank();
            boolean hasMinutes = p.minutes() != null && !p.minutes().isBlank();
            if (hasPosition && hasMinutes) eligible.add(p);
        }

        // stable sort: ties keep feed order
        eligible.sort((a, b) -> Integer.compare(seconds.get(b.personId()), seconds.get(a.personId())));

        Set<Long> out = new LinkedHashSet<>();
        for (int i = 0; i < eligible.size() && i < STARTERS_PER_TEAM; i++) {
            out.add(eligible.get(i).personId());
        }
        return out;
    }

    private int minutesToSeconds(PlayerRecord p) {
        Integer parsed = GameClock.parseMinutes(p.minutes());
        if (parsed != null) return parsed;

        if (p.minutes() != null && !p.minutes().isBlank()) {
            diagnostics.add(DiagnosticType.MINUTES_FORMAT,
                    "Unparseable minutes '" + p.minutes() + "' for player " + p.personId() + ", using 0");
        }
        return 0;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
