package com.asad.lineup_tracker.service;

import com.asad.lineup_tracker.model.SubstitutionChain;
import com.asad.lineup_tracker.model.SubstitutionEvent;

import java.util.ArrayList;
import java.util.List;

/**
 * Groups substitutions made in quick succession.
 *
 * A substitution joins the running chain when it is in the same period, within the time window
 * of the previous one, and either same team, shares a player with it (in for out) or is within
 * a few action numbers of it.
 */
public final class SubstitutionChainDetector {

    static final int MAX_ACTION_GAP = 5;

    private final int windowSeconds;

    public SubstitutionChainDetector(int windowSeconds) {
        this.windowSeconds = windowSeconds;
    }

    /** @param substitutions sorted by (period, elapsed seconds) */
    public List<SubstitutionChain> detect(List<SubstitutionEvent> substitutions) {
        List<SubstitutionChain> chains = new ArrayList<>();
        if (substitutions.isEmpty()) return chains;

        List<SubstitutionEvent> current = new ArrayList<>();
        current.add(substitutions.get(0));

        for (int i = 1; i < substitutions.size(); i++) {
            SubstitutionEvent prev = substitutions.get(i - 1);
            SubstitutionEvent cur = substitutions.get(i);

            if (belongsToChain(prev, cur)) {
                current.add(cur);
            } else {
                chains.add(new SubstitutionChain(current.get(0).period(), current));
                current = new ArrayList<>();
                current.add(cur);
            }
        }
        chains.add(new SubstitutionChain(current.get(0).period(), current));

        return chains;
    }

    boolean belongsToChain(SubstitutionEvent prev, SubstitutionEvent cur) {
        if (prev.period() != cur.period()) return false;
        if (cur.elapsedSeconds() - prev.elapsedSeconds() > windowSeconds) return false;

        boolean sameTeam = prev.teamId() == cur.teamId();
        boolean playerOverlap = cur.playerOutId() == prev.playerInId() || cur.playerInId() == prev.playerOutId();
        boolean consecutiveActions = Math.abs(cur.actionNumber() - prev.actionNumber()) <= MAX_ACTION_GAP;

        return sameTeam || playerOverlap || consecutiveActions;
    }
}
