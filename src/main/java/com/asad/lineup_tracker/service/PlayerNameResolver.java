package com.asad.lineup_tracker.service;

import com.asad.lineup_tracker.model.Player;
import com.asad.lineup_tracker.service.matching.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Resolves free-text player names from play-by-play descriptions to roster entries.
 *
 * <p>Matchers run in order and the first hit wins: exact identity checks come before fuzzy
 * ones so that a teammate with a similar surname is never picked over the real player.
 * Resolution is always scoped to one team.
 */
public final class PlayerNameResolver {

    private static final Logger log = LoggerFactory.getLogger(PlayerNameResolver.class);

    private final List<NameMatcher> matchers;
    private final Map<Long, List<Player>> playersByTeam = new HashMap<>();

    public PlayerNameResolver(Collection<Player> players) {
        this(players, defaultMatchers());
    }

    public PlayerNameResolver(Collection<Player> players, List<NameMatcher> matchers) {
        this.matchers = List.copyOf(matchers);
        for (Player p : players) {
            playersByTeam.computeIfAbsent(p.teamId(), k -> new ArrayList<>()).add(p);
        }
    }

    public static List<NameMatcher> defaultMatchers() {
        return List.of(
                new AbbreviationMatcher(),
                new ExactNameMatcher(),
                new FamilyNameMatcher(),
                new PartialNameMatcher()
        );
    }

    /** @return the matched player's id */
    public Optional<Long> resolve(String name, long teamId, boolean suppressWarnings) {
        return resolvePlayer(name, teamId, suppressWarnings).map(Player::id);
    }

    public Optional<Player> resolvePlayer(String name, long teamId, boolean suppressWarnings) {
        String normalized = NameNormalizer.normalize(name);
        List<Player> teamPlayers = playersByTeam.getOrDefault(teamId, List.of());

        if (!normalized.isEmpty()) {
            for (NameMatcher matcher : matchers) {
                Optional<Player> hit = matcher.match(normalized, teamPlayers);
                if (hit.isPresent()) return hit;
            }
        }

        if (!suppressWarnings) {
            log.warn("Could not find player '{}' on team {}", name, teamId);
        }
        return Optional.empty();
    }
}
