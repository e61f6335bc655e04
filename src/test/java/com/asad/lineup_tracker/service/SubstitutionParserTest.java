package com.asad.lineup_tracker.service;

import com.asad.lineup_tracker.model.Action;
import com.asad.lineup_tracker.model.DiagnosticType;
import com.asad.lineup_tracker.model.Player;
import com.asad.lineup_tracker.model.SubstitutionEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.asad.lineup_tracker.service.GameFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class SubstitutionParserTest {

    private Diagnostics diagnostics;
    private SubstitutionParser parser;

    @BeforeEach
    void setUp() {
        diagnostics = new Diagnostics(GAME_ID);
        Map<Long, Player> roster = new RosterBuilder(diagnostics).build(homeTeam(), awayTeam());
        parser = new SubstitutionParser(GAME_ID, HOME, AWAY, new PlayerNameResolver(roster.values()), diagnostics);
    }

    @Test
    void resolvesIncomingPlayerFromDescription() {
        List<SubstitutionEvent> subs = parser.parse(List.of(
                sub(5, 1, "PT07M00.00S", HOME, 105, "Robinson", "SUB: McBride FOR Robinson")));

        assertThat(subs).singleElement().satisfies(s -> {
            assertThat(s.playerOutId()).isEqualTo(105L);
            assertThat(s.playerInId()).isEqualTo(106L);
            assertThat(s.playerInName()).isEqualTo("McBride");
            assertThat(s.playerOutName()).isEqualTo("Robinson");
            assertThat(s.elapsedSeconds()).isEqualTo(300);
            assertThat(s.teamId()).isEqualTo(HOME);
            assertThat(s.gameId()).isEqualTo(GAME_ID);
        });
    }

    @Test
    void acceptsEntersTheGameGrammar() {
        List<SubstitutionEvent> subs = parser.parse(List.of(
                sub(5, 2, "PT03M10.00S", AWAY, 204, null, "Al Horford enters the game for Jayson Tatum")));

        assertThat(subs).singleElement().satisfies(s -> {
            assertThat(s.playerInId()).isEqualTo(207L);
            // no playerName on the action, so the out name comes from the description
            assertThat(s.playerOutName()).isEqualTo("Jayson Tatum");
            assertThat(s.elapsedSeconds()).isEqualTo(720 + 530);
        });
    }

    @Test
    void unknownIncomingNameIsDroppedWithDiagnostic() {
        List<SubstitutionEvent> subs = parser.parse(List.of(
                sub(5, 1, "PT07M00.00S", HOME, 105, "Robinson", "SUB: Wembanyama FOR Robinson")));

        assertThat(subs).isEmpty();
        assertThat(diagnostics.dataLoss()).singleElement().satisfies(d -> {
            assertThat(d.type()).isEqualTo(DiagnosticType.UNRESOLVED_PLAYER);
            assertThat(d.actionNumber()).isEqualTo(5);
        });
    }

    @Test
    void malformedSubstitutionsAreReported() {
        List<SubstitutionEvent> subs = parser.parse(List.of(
                sub(5, 1, "PT07M00.00S", HOME, 105, "Robinson", "Robinson checks out"),
                new Action(6, 1, "PT07M00.00S", null, 105L, null, "Substitution", "SUB: McBride FOR Robinson"),
                sub(7, 1, "PT07M00.00S", 1610612747L, 105, "Robinson", "SUB: McBride FOR Robinson")));

        assertThat(subs).isEmpty();
        assertThat(diagnostics.list()).extracting(d -> d.type()).containsExactly(
                DiagnosticType.MINUTES_FORMAT,
                DiagnosticType.UNPARSEABLE_SUBSTITUTION,
                DiagnosticType.UNPARSEABLE_SUBSTITUTION,
                DiagnosticType.UNKNOWN_TEAM);
    }

    @Test
    void badClockIsTreatedAsEndOfPeriod() {
        List<SubstitutionEvent> subs = parser.parse(List.of(
                sub(5, 2, "7:00", HOME, 105, "Robinson", "SUB: McBride FOR Robinson")));

        assertThat(subs).singleElement().extracting(SubstitutionEvent::elapsedSeconds).isEqualTo(1440);
        assertThat(diagnostics.list()).extracting(d -> d.type()).contains(DiagnosticType.CLOCK_FORMAT);
    }

    @Test
    void clockTooLargeForAnIntIsTreatedAsEndOfPeriod() {
        List<SubstitutionEvent> subs = parser.parse(List.of(
                sub(12, 2, "PT99999999999M00.00S", HOME, 102, "Hart", "SUB: Achiuwa FOR Hart")));

        assertThat(subs).singleElement().satisfies(s -> {
            assertThat(s.playerInId()).isEqualTo(107L);
            assertThat(s.elapsedSeconds()).isEqualTo(1440);
        });
        assertThat(diagnostics.list()).extracting(d -> d.type()).contains(DiagnosticType.CLOCK_FORMAT);
    }

    @Test
    void ordersByPeriodThenElapsedKeepingLogOrderForTies() {
        List<SubstitutionEvent> subs = parser.parse(List.of(
                sub(30, 2, "PT10M00.00S", HOME, 101, "Brunson", "SUB: McBride FOR Brunson"),
                sub(12, 1, "PT05M00.00S", AWAY, 205, "Porzingis", "SUB: Horford FOR Porzingis"),
                sub(10, 1, "PT05M00.00S", HOME, 105, "Robinson", "SUB: Achiuwa FOR Robinson"),
                sub(8, 1, "PT08M00.00S", HOME, 104, "Anunoby", "SUB: McBride FOR Anunoby")));

        assertThat(subs).extracting(SubstitutionEvent::actionNumber).containsExactly(8, 12, 10, 30);
    }

    @Test
    void ignoresOtherActionTypes() {
        assertThat(parser.parse(List.of(shot(2, 1, "PT11M00.00S", HOME, 101), periodStart(1, 1)))).isEmpty();
    }

    @Test
    void descriptionGrammar() {
        assertThat(SubstitutionParser.parseDescription("SUB: Brooks FOR Ward"))
                .isEqualTo(new SubstitutionParser.SubNames("Brooks", "Ward"));
        assertThat(SubstitutionParser.parseDescription("SUB: A. Edwards enters the game for M. Conley"))
                .isEqualTo(new SubstitutionParser.SubNames("A. Edwards", "M. Conley"));
        assertThat(SubstitutionParser.parseDescription("Jump Shot")).isNull();
        assertThat(SubstitutionParser.parseDescription(null)).isNull();
    }
}
