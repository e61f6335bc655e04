package com.asad.lineup_tracker.service;

import com.asad.lineup_tracker.model.*;

import java.util.*;

/**
 * Classifies every (player, regulation period) as STARTED, BENCHED or PLAYED_FULL.
 *
 * <p>There is no per-quarter lineup in the feed, so the direction of a player's first
 * substitution in a period is the signal: subbed OUT first means the player was on court at the start,
 * subbed IN first means the player started on the bench. Players with no substitution are on court the
 * whole period if they show up in on-court actions, otherwise they never left the bench.
 */
public final class QuarterPatternAnalyzer {

    static final Set<String> ON_COURT_ACTION_TYPES = Set.of(
            "made shot", "missed shot", "rebound", "foul", "free throw",
            "turnover", "jump ball", "assist", "block", "steal"
    );

    private final Collection<Player> players;
    private final long homeTeamId;
    private final long awayTeamId;

    public QuarterPatternAnalyzer(Collection<Player> players, long homeTeamId, long awayTeamId) {
        this.players = players;
        this.homeTeamId = homeTeamId;
        this.awayTeamId = awayTeamId;
    }

    /**
     * @param boundaries periods seen in the log; only regulation periods among them are classified
     * @param substitutions resolved substitutions (any order)
     * @return statuses per period, players in roster order
     */
    public NavigableMap<Integer, List<PlayerQuarterStatus>> analyze(List<Action> actions,
                                                                   NavigableMap<Integer, QuarterBoundary> boundaries,
                                                                   List<SubstitutionEvent> substitutions) {

        Map<Integer, Map<Long, Integer>> onCourtCounts = countOnCourtActions(actions);

        NavigableMap<Integer, List<PlayerQuarterStatus>> out = new TreeMap<>();

        for (int period = 1; period <= GameClock.REGULATION_PERIODS; period++) {
            if (!boundaries.containsKey(period)) continue;

            List<SubstitutionEvent> periodSubs = new ArrayList<>();
            for (SubstitutionEvent s : substitutions) {
                if (s.period() == period) periodSubs.add(s);
            }

            Map<Long, Integer> counts = onCourtCounts.getOrDefault(period, Map.of());
            List<PlayerQuarterStatus> statuses = new ArrayList<>();

            for (Player p : players) {
                statuses.add(classify(p, period, periodSubs, counts.getOrDefault(p.id(), 0)));
            }

            out.put(period, Collections.unmodifiableList(statuses));
        }

        return Collections.unmodifiableNavigableMap(out);
    }

    PlayerQuarterStatus classify(Player p, int period, List<SubstitutionEvent> periodSubs, int onCourtCount) {
        SubstitutionEvent firstIn = null;
        SubstitutionEvent firstOut = null;

        for (SubstitutionEvent s : periodSubs) {
            if (s.playerInId() == p.id() && (firstIn == null || s.actionNumber() < firstIn.actionNumber())) {
                firstIn = s;
            }
            if (s.playerOutId() == p.id() && (firstOut == null || s.actionNumber() < firstOut.actionNumber())) {
                firstOut = s;
            }
        }

        SubstitutionEvent first;
        SubDirection direction;
        if (firstIn != null && firstOut != null) {
            boolean outFirst = firstOut.actionNumber() < firstIn.actionNumber();
            first = outFirst ? firstOut : firstIn;
            direction = outFirst ? SubDirection.OUT : SubDirection.IN;
        } else if (firstOut != null) {
            first = firstOut;
            direction = SubDirection.OUT;
        } else if (firstIn != null) {
            first = firstIn;
            direction = SubDirection.IN;
        } else {
            QuarterStatus status = onCourtCount > 0 ? QuarterStatus.PLAYED_FULL : QuarterStatus.BENCHED;
            return new PlayerQuarterStatus(p.id(), p.teamId(), period, null, null, onCourtCount, status);
        }

        QuarterStatus status = direction == SubDirection.OUT ? QuarterStatus.STARTED : QuarterStatus.BENCHED;
        return new PlayerQuarterStatus(p.id(), p.teamId(), period, direction, first.actionNumber(), onCourtCount, status);
    }

    private Map<Integer, Map<Long, Integer>> countOnCourtActions(List<Action> actions) {
        Map<Integer, Map<Long, Integer>> out = new HashMap<>();

        for (Action a : actions) {
            if (a.personId() == null || a.actionType() == null) continue;
            if (isTeamId(a.personId())) continue;
            if (!ON_COURT_ACTION_TYPES.contains(a.actionType().toLowerCase(Locale.ROOT))) continue;

            out.computeIfAbsent(a.period(), k -> new HashMap<>())
                    .merge(a.personId(), 1, Integer::sum);
        }
        return out;
    }

    /** Team rebounds, team turnovers etc. carry the team id (1610612xxx) as personId. */
    boolean isTeamId(long personId) {
        if (personId == homeTeamId || personId == awayTeamId) return true;
        String s = Long.toString(personId);
        return s.length() == 10 && s.startsWith("1610612");
    }
}
