package com.asad.lineup_tracker.service.matching;

import com.asad.lineup_tracker.model.Player;

import java.util.List;
import java.util.Optional;

/**
 * Last resort: the search text appears inside the full name, or equals its last token
 * (catches suffixes such as "Jr." and nicknames that are a substring of the real name).
 */
public final class PartialNameMatcher implements NameMatcher {

    @Override
    public Optional<Player> match(String normalizedName, List<Player> teamPlayers) {
        for (Player p : teamPlayers) {
            String full = NameNormalizer.normalize(p.fullName());
            if (full.isEmpty()) continue;

            String[] tokens = full.split("\\s+");
            if (full.contains(normalizedName) || tokens[tokens.length - 1].equals(normalizedName)) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }
}
