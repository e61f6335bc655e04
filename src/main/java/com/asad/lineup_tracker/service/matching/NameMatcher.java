package com.asad.lineup_tracker.service.matching;

import com.asad.lineup_tracker.model.Player;

import java.util.List;
import java.util.Optional;

/**
 * One step of the name-resolution cascade.
 *
 * @see com.asad.lineup_tracker.service.PlayerNameResolver
 */
public interface NameMatcher {

    /**
     * @param normalizedName search text, already passed through {@link NameNormalizer#normalize}
     * @param teamPlayers candidates, all on the acting team, in roster order
     * @return the first candidate this strategy accepts
     */
    Optional<Player> match(String normalizedName, List<Player> teamPlayers);
}
