package com.asad.lineup_tracker.service;

import com.asad.lineup_tracker.exception.ClockFormatException;
import com.asad.lineup_tracker.model.Action;
import com.asad.lineup_tracker.model.DiagnosticType;
import com.asad.lineup_tracker.model.SubstitutionEvent;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts typed substitution events from the action log.
 *
 * <p>The outgoing player comes straight from the action ({@code personId}); the incoming one only
 * exists as text in the description and has to be resolved against the roster. A substitution
 * whose incoming player cannot be resolved is dropped and reported as a diagnostic.
 */
public final class SubstitutionParser {

    static final String SUBSTITUTION = "Substitution";

    // "SUB: Brooks FOR Ward"
    private static final Pattern SUB_FOR_PATTERN =
            Pattern.compile("SUB:\\s*(.+?)\\s+FOR\\s+(.+)");

    // "SUB: A. Edwards enters the game for M. Conley" / "A. Edwards enters the game for M. Conley"
    private static final Pattern ENTERS_PATTERN =
            Pattern.compile("(?:SUB:\\s*)?(.+?)\\s+enters the game for\\s+(.+)", Pattern.CASE_INSENSITIVE);

    private final String gameId;
    private final long homeTeamId;
    private final long awayTeamId;
    private final PlayerNameResolver resolver;
    private final Diagnostics diagnostics;

    public SubstitutionParser(String gameId, long homeTeamId, long awayTeamId,
                              PlayerNameResolver resolver, Diagnostics diagnostics) {
        this.gameId = gameId;
        this.homeTeamId = homeTeamId;
        this.awayTeamId = awayTeamId;
        this.resolver = resolver;
        this.diagnostics = diagnostics;
    }

    /** @return resolved substitutions ordered by (period, elapsed seconds), ties in log order */
    public List<SubstitutionEvent> parse(List<Action> actions) {
        List<SubstitutionEvent> out = new ArrayList<>();

        for (Action a : actions) {
            if (!a.isType(SUBSTITUTION)) continue;

            if (a.teamId() == null || a.personId() == null) {
                diagnostics.add(DiagnosticType.UNPARSEABLE_SUBSTITUTION, a.actionNumber(),
                        "Substitution without team or player id: " + a.description());
                continue;
            }

            long teamId = a.teamId();
            if (teamId != homeTeamId && teamId != awayTeamId) {
                diagnostics.add(DiagnosticType.UNKNOWN_TEAM, a.actionNumber(),
                        "Substitution for team " + teamId + " which is not playing: " + a.description());
                continue;
            }

            SubNames names = parseDescription(a.description());
            if (names == null) {
                diagnostics.add(DiagnosticType.UNPARSEABLE_SUBSTITUTION, a.actionNumber(),
                        "Could not parse substitution description: " + a.description());
                continue;
            }

            Optional<Long> playerInId = resolver.resolve(names.in(), teamId, true);
            if (playerInId.isEmpty()) {
                diagnostics.add(DiagnosticType.UNRESOLVED_PLAYER, a.actionNumber(),
                        "Could not find player '" + names.in() + "' on team " + teamId);
                continue;
            }

            String playerOutName = (a.playerName() != null && !a.playerName().isBlank())
                    ? a.playerName()
                    : names.out();

            out.add(new SubstitutionEvent(
                    gameId,
                    a.actionNumber(),
                    a.period(),
                    a.clock(),
                    elapsedSeconds(a),
                    teamId,
                    a.personId(),
                    playerOutName,
                    playerInId.get(),
                    names.in(),
                    a.description()
            ));
        }

        // List.sort is stable, so same-instant substitutions stay in log order
        out.sort(Comparator.comparingInt(SubstitutionEvent::period)
                .thenComparingInt(SubstitutionEvent::elapsedSeconds));
        return out;
    }

    /** @return incoming/outgoing names, or null if the description is not a substitution line */
    static SubNames parseDescription(String description) {
        if (description == null) return null;
        String d = description.trim();

        Matcher m = SUB_FOR_PATTERN.matcher(d);
        if (!m.lookingAt()) {
            m = ENTERS_PATTERN.matcher(d);
            if (!m.lookingAt()) return null;
        }

        String in = m.group(1).trim();
        String out = m.group(2).trim();
        if (in.isEmpty()) return null;
        return new SubNames(in, out);
    }

    private int elapsedSeconds(Action a) {
        try {
            return GameClock.elapsedSeconds(a.period(), a.clock());
        } catch (ClockFormatException e) {
            diagnostics.add(DiagnosticType.CLOCK_FORMAT, a.actionNumber(),
                    "Unparseable clock '" + a.clock() + "', treating as end of period " + a.period());
            return GameClock.elapsedSeconds(a.period(), 0);
        }
    }

    record SubNames(String in, String out) {}
}
