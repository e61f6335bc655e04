package com.asad.lineup_tracker.service;

import com.asad.lineup_tracker.config.LineupProperties;
import com.asad.lineup_tracker.exception.LineupDataException;
import com.asad.lineup_tracker.exception.StructuralException;
import com.asad.lineup_tracker.model.*;

import java.util.*;

/**
 * Lineup tracking for ONE game.
 *
 * <p>Build a new tracker per game and throw it away afterwards; instances are not shared
 * between threads and keep no state beyond the game they were built for. Each stage is computed
 * on first use and memoized, so repeated calls return the same lists and do not re-record
 * diagnostics.
 */
public final class LineupTracker {

    private final GameRecord game;
    private final LineupProperties props;
    private final Diagnostics diagnostics;
    private final Map<Long, Player> roster;
    private final PlayerNameResolver resolver;

    private List<SubstitutionEvent> substitutions;
    private NavigableMap<Integer, QuarterBoundary> boundaries;
    private NavigableMap<Integer, List<PlayerQuarterStatus>> patterns;
    private List<LineupState> timeline;
    private List<SubstitutionChain> chains;

    public LineupTracker(GameRecord game) {
        this(game, LineupProperties.defaults());
    }

    public LineupTracker(GameRecord game, LineupProperties props) {
        this.game = game;
        this.props = props;
        this.diagnostics = new Diagnostics(game.gameId());
        this.roster = new RosterBuilder(diagnostics).build(game.homeTeam(), game.awayTeam());
        this.resolver = new PlayerNameResolver(roster.values());
    }

    public String gameId() { return game.gameId(); }
    public long homeTeamId() { return game.homeTeamId(); }
    public long awayTeamId() { return game.awayTeamId(); }

    /** Player directory keyed by person id, home roster first. */
    public Map<Long, Player> roster() {
        return roster;
    }

    /**
     * Box-score starters (top 5 by minutes) per team.
     *
     * @return home team id then away team id, each mapped to exactly five ids
     * @throws StructuralException if a team does not have exactly five
     */
    public Map<Long, List<Long>> startingLineups() {
        Map<Long, List<Long>> out = nominalStarters();
        for (Map.Entry<Long, List<Long>> e : out.entrySet()) {
            if (e.getValue().size() != LineupInferencer.LINEUP_SIZE) {
                throw new StructuralException("Team " + e.getKey() + " has " + e.getValue().size()
                        + " starters, expected " + LineupInferencer.LINEUP_SIZE);
            }
        }
        return out;
    }

    public List<SubstitutionEvent> substitutions() {
        if (substitutions == null) {
            substitutions = List.copyOf(new SubstitutionParser(
                    game.gameId(), game.homeTeamId(), game.awayTeamId(), resolver, diagnostics
            ).parse(game.actions()));
        }
        return substitutions;
    }

    public NavigableMap<Integer, QuarterBoundary> quarterBoundaries() {
        if (boundaries == null) {
            boundaries = new QuarterBoundaryAnalyzer().analyze(game.actions());
        }
        return boundaries;
    }

    public NavigableMap<Integer, List<PlayerQuarterStatus>> quarterPatterns() {
        if (patterns == null) {
            patterns = new QuarterPatternAnalyzer(roster.values(), game.homeTeamId(), game.awayTeamId())
                    .analyze(game.actions(), quarterBoundaries(), substitutions());
        }
        return patterns;
    }

    public List<LineupState> timeline() {
        if (timeline == null) {
            LineupInferencer inferencer = new LineupInferencer(
                    roster, game.homeTeamId(), game.awayTeamId(), props.backfillMinSeconds());

            timeline = new TimelineBuilder(
                    game.gameId(), game.homeTeamId(), game.awayTeamId(), roster, inferencer, diagnostics
            ).build(quarterBoundaries(), quarterPatterns(), substitutions(), nominalStarters());
        }
        return timeline;
    }

    /** The five each team started every period with, as replayed in the timeline. */
    public NavigableMap<Integer, LineupState> periodStartingLineups() {
        NavigableMap<Integer, LineupState> out = new TreeMap<>();
        for (LineupState s : timeline()) {
            out.putIfAbsent(s.period(), s);
        }
        return out;
    }

    public List<SubstitutionChain> substitutionChains() {
        if (chains == null) {
            chains = List.copyOf(new SubstitutionChainDetector(props.chainWindowSeconds()).detect(substitutions()));
        }
        return chains;
    }

    /**
     * Players on court at a moment of the game: the latest state at or before that moment, or
     * the tip-off state when the moment is earlier than everything.
     *
     * @throws com.asad.lineup_tracker.exception.ClockFormatException if {@code clock} is not PT format
     */
    public OnCourtLineup playersOnCourt(int period, String clock) {
        int target = GameClock.elapsedSeconds(period, clock);
        List<LineupState> states = timeline();

        LineupState current = states.get(0);
        for (LineupState s : states) {
            if (s.elapsedSeconds() <= target) current = s;
            else break;
        }

        return new OnCourtLineup(
                game.gameId(),
                period,
                clock,
                current.homeTeamId(),
                current.awayTeamId(),
                current.homePlayers(),
                current.awayPlayers(),
                displayNames(current.homePlayers()),
                displayNames(current.awayPlayers())
        );
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics.list();
    }

    /**
     * Runs the whole pipeline.
     *
     * @throws LineupDataException in strict mode, if any substitution was dropped or not applied
     */
    public LineupTrackingResult track() {
        List<LineupState> states = timeline();
        List<SubstitutionChain> subChains = substitutionChains();

        List<Diagnostic> lost = diagnostics.dataLoss();
        if (props.strictSubstitutions() && !lost.isEmpty()) {
            throw new LineupDataException(game.gameId(), lost);
        }

        return new LineupTrackingResult(
                game.gameId(),
                game.homeTeamId(),
                game.awayTeamId(),
                states,
                substitutions(),
                subChains,
                diagnostics.list()
        );
    }

    private Map<Long, List<Long>> nominalStarters() {
        Map<Long, List<Long>> out = new LinkedHashMap<>();
        out.put(game.homeTeamId(), new ArrayList<>());
        out.put(game.awayTeamId(), new ArrayList<>());

        for (Player p : roster.values()) {
            if (p.starter()) out.get(p.teamId()).add(p.id());
        }
        return out;
    }

    private List<String> displayNames(List<Long> ids) {
        List<String> out = new ArrayList<>();
        for (Long id : ids) out.add(roster.get(id).displayName());
        return out;
    }
}
