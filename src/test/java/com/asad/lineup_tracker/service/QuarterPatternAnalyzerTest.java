package com.asad.lineup_tracker.service;

import com.asad.lineup_tracker.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.asad.lineup_tracker.service.GameFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class QuarterPatternAnalyzerTest {

    private Map<Long, Player> roster;
    private QuarterPatternAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        roster = new RosterBuilder(new Diagnostics(GAME_ID)).build(homeTeam(), awayTeam());
        analyzer = new QuarterPatternAnalyzer(roster.values(), HOME, AWAY);
    }

    @Test
    void classifiesFromFirstSubstitutionAndActivity() {
        NavigableMap<Integer, List<PlayerQuarterStatus>> patterns = analyze(sampleActions());

        Map<Long, PlayerQuarterStatus> p1 = byPlayer(patterns.get(1));
        assertThat(p1.get(105L).status()).isEqualTo(QuarterStatus.STARTED);
        assertThat(p1.get(105L).firstSubDirection()).isEqualTo(SubDirection.OUT);
        assertThat(p1.get(105L).firstSubActionNumber()).isEqualTo(5);
        assertThat(p1.get(106L).status()).isEqualTo(QuarterStatus.BENCHED);
        assertThat(p1.get(106L).firstSubDirection()).isEqualTo(SubDirection.IN);
        assertThat(p1.get(101L).status()).isEqualTo(QuarterStatus.PLAYED_FULL);
        assertThat(p1.get(101L).onCourtActionCount()).isEqualTo(1);
        assertThat(p1.get(102L).status()).isEqualTo(QuarterStatus.BENCHED);
        assertThat(p1.get(102L).firstSubDirection()).isNull();

        Map<Long, PlayerQuarterStatus> p2 = byPlayer(patterns.get(2));
        assertThat(p2.get(103L).status()).isEqualTo(QuarterStatus.STARTED);
        assertThat(p2.get(105L).status()).isEqualTo(QuarterStatus.BENCHED);
        assertThat(p2.get(106L).status()).isEqualTo(QuarterStatus.PLAYED_FULL);
    }

    @Test
    void everyRosterPlayerIsClassifiedInRosterOrder() {
        List<PlayerQuarterStatus> p1 = analyze(sampleActions()).get(1);

        assertThat(p1).extracting(PlayerQuarterStatus::playerId).containsExactlyElementsOf(roster.keySet());
        assertThat(p1).allSatisfy(s -> assertThat(s.period()).isEqualTo(1));
    }

    @Test
    void teamIdsPostedAsPersonIdsAreNotCounted() {
        // the sample log has a team rebound credited to personId 1610612738
        assertThat(analyzer.isTeamId(AWAY)).isTrue();
        assertThat(analyzer.isTeamId(1610612747L)).isTrue();
        assertThat(analyzer.isTeamId(203L)).isFalse();

        List<PlayerQuarterStatus> p1 = analyze(sampleActions()).get(1);
        assertThat(p1).noneMatch(s -> s.playerId() == AWAY);
        assertThat(byPlayer(p1).get(203L).onCourtActionCount()).isEqualTo(1);
    }

    @Test
    void subbedOutAfterSubbedInIsBenched() {
        List<Action> actions = List.of(
                periodStart(1, 1),
                sub(2, 1, "PT10M00.00S", HOME, 105, "Robinson", "SUB: McBride FOR Robinson"),
                sub(3, 1, "PT05M00.00S", HOME, 106, "McBride", "SUB: Robinson FOR McBride"));

        Map<Long, PlayerQuarterStatus> p1 = byPlayer(analyze(actions).get(1));

        assertThat(p1.get(106L).status()).isEqualTo(QuarterStatus.BENCHED);
        assertThat(p1.get(105L).status()).isEqualTo(QuarterStatus.STARTED);
    }

    @Test
    void overtimeIsNotClassified() {
        List<Action> actions = List.of(periodStart(1, 1), periodStart(2, 5), shot(3, 5, "PT04M00.00S", HOME, 101));

        assertThat(analyze(actions)).containsOnlyKeys(1);
    }

    private NavigableMap<Integer, List<PlayerQuarterStatus>> analyze(List<Action> actions) {
        Diagnostics diagnostics = new Diagnostics(GAME_ID);
        List<SubstitutionEvent> subs = new SubstitutionParser(
                GAME_ID, HOME, AWAY, new PlayerNameResolver(roster.values()), diagnostics).parse(actions);
        return analyzer.analyze(actions, new QuarterBoundaryAnalyzer().analyze(actions), subs);
    }

    private static Map<Long, PlayerQuarterStatus> byPlayer(List<PlayerQuarterStatus> statuses) {
        return statuses.stream().collect(Collectors.toMap(PlayerQuarterStatus::playerId, Function.identity()));
    }
}
