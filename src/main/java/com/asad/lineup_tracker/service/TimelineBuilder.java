package com.asad.lineup_tracker.service;

import com.asad.lineup_tracker.exception.InvariantViolationException;
import com.asad.lineup_tracker.exception.StructuralException;
import com.asad.lineup_tracker.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Replays substitutions on top of each period's inferred starting five.
 *
 * <p>Emits one state at tip-off, one at the start of every later period, and one per distinct
 * substitution instant (several substitutions at the same dead ball share a snapshot). A
 * substitution that cannot be applied leaves the lineup unchanged and is reported as a
 * diagnostic; the snapshot is still emitted.
 */
public final class TimelineBuilder {

    private static final Logger log = LoggerFactory.getLogger(TimelineBuilder.class);

    private final String gameId;
    private final long homeTeamId;
    private final long awayTeamId;
    private final Map<Long, Player> roster;
    private final LineupInferencer inferencer;
    private final Diagnostics diagnostics;

    // current five per team; slots are replaced in place
    private List<Long> home;
    private List<Long> away;
    private List<LineupState> timeline;

    public TimelineBuilder(String gameId, long homeTeamId, long awayTeamId, Map<Long, Player> roster,
                           LineupInferencer inferencer, Diagnostics diagnostics) {
        this.gameId = gameId;
        this.homeTeamId = homeTeamId;
        this.awayTeamId = awayTeamId;
        this.roster = roster;
        this.inferencer = inferencer;
        this.diagnostics = diagnostics;
    }

    /**
     * Substitutions sharing a (period, elapsed) instant produce one state, not one state each.
     *
     * @param boundaries periods present in the action log
     * @param patterns quarter classifications (regulation periods only)
     * @param substitutions resolved substitutions sorted by (period, elapsed seconds)
     * @param nominalStarters box-score starters by team id, used when period 1 cannot be inferred
     * @throws StructuralException if a team has no usable starting five at all
     * @throws InvariantViolationException if a produced state is malformed
     */
    public List<LineupState> build(NavigableMap<Integer, QuarterBoundary> boundaries,
                                   NavigableMap<Integer, List<PlayerQuarterStatus>> patterns,
                                   List<SubstitutionEvent> substitutions,
                                   Map<Long, List<Long>> nominalStarters) {
        timeline = new ArrayList<>();

        Map<Long, List<Long>> inferred = patterns.containsKey(1)
                ? inferencer.infer(patterns.get(1))
                : Map.of();

        home = initialFive(homeTeamId, inferred, nominalStarters);
        away = initialFive(awayTeamId, inferred, nominalStarters);
        emit(1, GameClock.periodStartClock(1), 0);
        logLineups(1);

        Map<Integer, List<SubstitutionEvent>> subsByPeriod = new TreeMap<>();
        for (SubstitutionEvent s : substitutions) {
            subsByPeriod.computeIfAbsent(s.period(), k -> new ArrayList<>()).add(s);
        }

        SortedSet<Integer> periods = new TreeSet<>(boundaries.keySet());
        periods.addAll(subsByPeriod.keySet());

        for (int period : periods) {
            if (period < 1) continue;

            if (period > 1) {
                startPeriod(period, patterns.get(period));
            }

            applySubstitutions(period, subsByPeriod.getOrDefault(period, List.of()));
        }

        return Collections.unmodifiableList(timeline);
    }

    private List<Long> initialFive(long teamId, Map<Long, List<Long>> inferred, Map<Long, List<Long>> nominalStarters) {
        List<Long> five = inferred.get(teamId);
        if (five != null && five.size() == LineupInferencer.LINEUP_SIZE) return new ArrayList<>(five);

        diagnostics.add(DiagnosticType.LINEUP_FALLBACK,
                "Period 1 lineup for team " + teamId + " could not be inferred, using box-score starters");

        List<Long> nominal = nominalStarters.getOrDefault(teamId, List.of());
        if (nominal.size() != LineupInferencer.LINEUP_SIZE) {
            throw new StructuralException("Team " + teamId + " has " + nominal.size()
                    + " box-score starters, expected " + LineupInferencer.LINEUP_SIZE);
        }
        return new ArrayList<>(nominal);
    }

    private void startPeriod(int period, List<PlayerQuarterStatus> statuses) {
        if (statuses != null) {
            Map<Long, List<Long>> inferred = inferencer.infer(statuses);

            // teams are updated independently
            List<Long> h = inferred.get(homeTeamId);
            if (h != null && h.size() == LineupInferencer.LINEUP_SIZE) home = new ArrayList<>(h);
            else keepPrevious(period, homeTeamId);

            List<Long> a = inferred.get(awayTeamId);
            if (a != null && a.size() == LineupInferencer.LINEUP_SIZE) away = new ArrayList<>(a);
            else keepPrevious(period, awayTeamId);
        }

        emit(period, GameClock.periodStartClock(period), GameClock.periodStartElapsed(period));
        logLineups(period);
    }

    private void keepPrevious(int period, long teamId) {
        diagnostics.add(DiagnosticType.LINEUP_FALLBACK,
                "Period " + period + " lineup for team " + teamId + " could not be inferred, keeping previous five");
    }

    private void applySubstitutions(int period, List<SubstitutionEvent> subs) {
        int periodStart = GameClock.periodStartElapsed(period);

        int i = 0;
        while (i < subs.size()) {
            int at = Math.max(periodStart, subs.get(i).elapsedSeconds());

            SubstitutionEvent last = subs.get(i);
            while (i < subs.size() && Math.max(periodStart, subs.get(i).elapsedSeconds()) == at) {
                last = subs.get(i);
                apply(last);
                i++;
            }

            emit(period, last.clock(), at);
        }
    }

    private void apply(SubstitutionEvent sub) {
        List<Long> five;
        if (sub.teamId() == homeTeamId) five = home;
        else if (sub.teamId() == awayTeamId) five = away;
        else {
            diagnostics.add(DiagnosticType.UNKNOWN_TEAM, sub.actionNumber(),
                    "Substitution for team " + sub.teamId() + " which is not playing");
            return;
        }

        int slot = five.indexOf(sub.playerOutId());
        if (slot < 0) {
            diagnostics.add(DiagnosticType.PLAYER_NOT_ON_COURT, sub.actionNumber(),
                    sub.playerOutName() + " (" + sub.playerOutId() + ") not in current lineup " + names(five)
                            + ", ignoring: " + sub.description());
            return;
        }
        if (five.contains(sub.playerInId())) {
            diagnostics.add(DiagnosticType.PLAYER_ALREADY_ON_COURT, sub.actionNumber(),
                    sub.playerInName() + " (" + sub.playerInId() + ") already in lineup " + names(five)
                            + ", ignoring: " + sub.description());
            return;
        }

        five.set(slot, sub.playerInId());
    }

    private void emit(int period, String clock, int elapsedSeconds) {
        LineupState state = new LineupState(gameId, period, clock, elapsedSeconds, homeTeamId, awayTeamId, home, away);
        validate(state);
        timeline.add(state);
    }

    void validate(LineupState state) {
        checkFive(state, state.homePlayers(), homeTeamId);
        checkFive(state, state.awayPlayers(), awayTeamId);

        Set<Long> overlap = new HashSet<>(state.homePlayers());
        overlap.retainAll(state.awayPlayers());
        if (!overlap.isEmpty()) {
            throw new InvariantViolationException("Players " + overlap + " on both teams at " + describe(state));
        }

        if (timeline != null && !timeline.isEmpty()) {
            LineupState prev = timeline.get(timeline.size() - 1);
            if (state.elapsedSeconds() < prev.elapsedSeconds()) {
                throw new InvariantViolationException("Timeline went backwards from " + prev.elapsedSeconds()
                        + "s to " + describe(state));
            }
        }
    }

    private void checkFive(LineupState state, List<Long> five, long teamId) {
        if (five.size() != LineupInferencer.LINEUP_SIZE || new HashSet<>(five).size() != LineupInferencer.LINEUP_SIZE) {
            throw new InvariantViolationException("Team " + teamId + " lineup " + five + " is not five distinct players at "
                    + describe(state));
        }
        for (Long id : five) {
            Player p = roster.get(id);
            if (p == null || p.teamId() != teamId) {
                throw new InvariantViolationException("Player " + id + " is not on team " + teamId + " at " + describe(state));
            }
        }
    }

    private String describe(LineupState state) {
        return "period " + state.period() + " " + state.clock() + " (" + state.elapsedSeconds() + "s)";
    }

    private List<String> names(List<Long> five) {
        List<String> out = new ArrayList<>();
        for (Long id : five) {
            Player p = roster.get(id);
            out.add(p != null ? p.displayName() : "ID:" + id);
        }
        return out;
    }

    private void logLineups(int period) {
        if (!log.isDebugEnabled()) return;
        log.debug("Game {} period {} starting lineups: home {} away {}", gameId, period, names(home), names(away));
    }
}
