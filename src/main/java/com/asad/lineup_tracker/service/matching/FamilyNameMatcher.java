package com.asad.lineup_tracker.service.matching;

import com.asad.lineup_tracker.model.Player;

import java.util.List;
import java.util.Optional;

/** "SUB: Brooks FOR Ward" - older feeds only print the family name. */
public final class FamilyNameMatcher implements NameMatcher {

    @Override
    public Optional<Player> match(String normalizedName, List<Player> teamPlayers) {
        for (Player p : teamPlayers) {
            String family = NameNormalizer.normalize(p.familyName());
            if (!family.isEmpty() && normalizedName.equals(family)) return Optional.of(p);
        }
        return Optional.empty();
    }
}
