package com.asad.lineup_tracker.service.matching;

import com.asad.lineup_tracker.model.Player;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Play-by-play descriptions shorten first names to a prefix when teammates share a surname
 * ("Jal. Williams" / "Jay. Williams" on the same roster). A single initial is ambiguous there,
 * so these are looked up by full name before anything else.
 */
public final class AbbreviationMatcher implements NameMatcher {

    // keys and values are normalized
    private static final Map<String, List<String>> KNOWN_ABBREVIATIONS = Map.of(
            "jal. williams", List.of("jalen williams"),
            "jay. williams", List.of("jaylin williams", "jay williams"),
            "jr. holiday", List.of("jrue holiday"),
            "ju. holiday", List.of("justin holiday"),
            "ja. green", List.of("jalen green", "javonte green", "jamychal green"),
            "je. green", List.of("jeff green")
    );

    @Override
    public Optional<Player> match(String normalizedName, List<Player> teamPlayers) {
        List<String> candidates = KNOWN_ABBREVIATIONS.get(normalizedName);
        if (candidates == null) return Optional.empty();

        for (String candidate : candidates) {
            for (Player p : teamPlayers) {
                if (candidate.equals(NameNormalizer.normalize(p.fullName()))) return Optional.of(p);
            }
        }
        return Optional.empty();
    }
}
