package com.asad.lineup_tracker.service;

import com.asad.lineup_tracker.model.Player;
import com.asad.lineup_tracker.model.PlayerQuarterStatus;
import com.asad.lineup_tracker.model.SubDirection;

import java.util.*;

/**
 * Picks each team's five at the start of a period from the quarter classifications.
 *
 * <p>Rank first: players classified STARTED or PLAYED_FULL, most on-court actions first. Backfill
 * second: when fewer than five are found (blowouts, sparse substitution data), fill from the
 * roster by total game minutes, players above the minutes threshold first. Players known to have
 * entered the period off the bench are never used as backfill.
 */
public final class LineupInferencer {

    static final int LINEUP_SIZE = 5;

    private final Map<Long, Player> roster;
    private final long homeTeamId;
    private final long awayTeamId;
    private final int backfillMinSeconds;

    public LineupInferencer(Map<Long, Player> roster, long homeTeamId, long awayTeamId, int backfillMinSeconds) {
        this.roster = roster;
        this.homeTeamId = homeTeamId;
        this.awayTeamId = awayTeamId;
        this.backfillMinSeconds = backfillMinSeconds;
    }

    /**
     * @param statuses classifications for a single period
     * @return home then away team id mapped to at most five player ids; fewer only when the
     *     roster itself runs out
     */
    public Map<Long, List<Long>> infer(List<PlayerQuarterStatus> statuses) {
        Map<Long, List<Long>> out = new LinkedHashMap<>();
        out.put(homeTeamId, inferTeam(homeTeamId, statuses));
        out.put(awayTeamId, inferTeam(awayTeamId, statuses));
        return out;
    }

    private List<Long> inferTeam(long teamId, List<PlayerQuarterStatus> statuses) {
        List<PlayerQuarterStatus> candidates = new ArrayList<>();
        Set<Long> enteredLater = new HashSet<>();

        for (PlayerQuarterStatus s : statuses) {
            if (s.teamId() != teamId) continue;
            if (s.status().onCourtAtStart()) candidates.add(s);
            if (s.firstSubDirection() == SubDirection.IN) enteredLater.add(s.playerId());
        }

        // stable: equal counts keep roster order
        candidates.sort((a, b) -> Integer.compare(b.onCourtActionCount(), a.onCourtActionCount()));

        List<Long> lineup = new ArrayList<>();
        for (PlayerQuarterStatus s : candidates) {
            if (lineup.size() >= LINEUP_SIZE) break;
            lineup.add(s.playerId());
        }

        if (lineup.size() < LINEUP_SIZE) {
            backfill(lineup, teamId, enteredLater);
        }

        return lineup.size() > LINEUP_SIZE ? new ArrayList<>(lineup.subList(0, LINEUP_SIZE)) : lineup;
    }

    private void backfill(List<Long> lineup, long teamId, Set<Long> enteredLater) {
        List<Player> regulars = new ArrayList<>();
        List<Player> others = new ArrayList<>();

        for (Player p : roster.values()) {
            if (p.teamId() != teamId) continue;
            if (lineup.contains(p.id()) || enteredLater.contains(p.id())) continue;

            if (p.minutesSeconds() > backfillMinSeconds) regulars.add(p);
            else others.add(p);
        }

        Comparator<Player> byMinutes = (a, b) -> Integer.compare(b.minutesSeconds(), a.minutesSeconds());
        regulars.sort(byMinutes);
        others.sort(byMinutes);

        for (Player p : regulars) {
            if (lineup.size() >= LINEUP_SIZE) return;
            lineup.add(p.id());
        }
        for (Player p : others) {
            if (lineup.size() >= LINEUP_SIZE) return;
            lineup.add(p.id());
        }
    }
}
