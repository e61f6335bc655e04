package com.asad.lineup_tracker.service.matching;

import com.asad.lineup_tracker.model.Player;

import java.util.List;
import java.util.Optional;

/** Exact match on "First Family", "F. Family" or the box-score display name. */
public final class ExactNameMatcher implements NameMatcher {

    @Override
    public Optional<Player> match(String normalizedName, List<Player> teamPlayers) {
        for (Player p : teamPlayers) {
            if (normalizedName.equals(NameNormalizer.normalize(p.fullName()))
                    || normalizedName.equals(NameNormalizer.normalize(p.shortName()))
                    || normalizedName.equals(NameNormalizer.normalize(p.displayName()))) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }
}
