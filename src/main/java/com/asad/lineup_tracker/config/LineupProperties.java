package com.asad.lineup_tracker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tuning knobs for lineup inference, bound from {@code lineup.*}.
 *
 * @param backfillMinSeconds players above this many game seconds are preferred when a period's
 *     inferred five has to be backfilled from the roster
 * @param chainWindowSeconds max gap between two substitutions of the same chain
 * @param strictSubstitutions fail the game instead of degrading when substitutions are lost
 */
@ConfigurationProperties(prefix = "lineup")
public record LineupProperties(Integer backfillMinSeconds, Integer chainWindowSeconds, boolean strictSubstitutions) {

    public static final int DEFAULT_BACKFILL_MIN_SECONDS = 5 * 60;
    public static final int DEFAULT_CHAIN_WINDOW_SECONDS = 15;

    public LineupProperties {
        if (backfillMinSeconds == null) backfillMinSeconds = DEFAULT_BACKFILL_MIN_SECONDS;
        if (chainWindowSeconds == null) chainWindowSeconds = DEFAULT_CHAIN_WINDOW_SECONDS;
    }

    public static LineupProperties defaults() {
        return new LineupProperties(null, null, false);
    }

    public LineupProperties withStrictSubstitutions(boolean strict) {
        return new LineupProperties(backfillMinSeconds, chainWindowSeconds, strict);
    }
}
