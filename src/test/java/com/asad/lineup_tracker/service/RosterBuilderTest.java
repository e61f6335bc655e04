package com.asad.lineup_tracker.service;

import com.asad.lineup_tracker.exception.StructuralException;
import com.asad.lineup_tracker.model.DiagnosticType;
import com.asad.lineup_tracker.model.Player;
import com.asad.lineup_tracker.model.PlayerRecord;
import com.asad.lineup_tracker.model.TeamRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.asad.lineup_tracker.service.GameFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RosterBuilderTest {

    private final Diagnostics diagnostics = new Diagnostics(GAME_ID);

    @Test
    void homePlayersComeFirstInFeedOrder() {
        Map<Long, Player> roster = new RosterBuilder(diagnostics).build(homeTeam(), awayTeam());

        assertThat(roster).hasSize(16);
        assertThat(roster.keySet()).startsWith(101L, 102L, 103L).endsWith(207L, 208L);
        assertThat(roster.get(101L).teamId()).isEqualTo(HOME);
        assertThat(roster.get(205L).teamId()).isEqualTo(AWAY);
    }

    @Test
    void startersAreTopFiveByMinutesAmongPlayersWithPosition() {
        Map<Long, Player> roster = new RosterBuilder(diagnostics).build(homeTeam(), awayTeam());

        assertThat(roster.values().stream().filter(Player::starter).map(Player::id))
                .containsExactlyInAnyOrder(101L, 102L, 103L, 104L, 105L, 201L, 202L, 203L, 204L, 205L);
        assertThat(roster.get(101L).minutesSeconds()).isEqualTo(35 * 60);
        assertThat(roster.get(102L).minutesSeconds()).isEqualTo(34 * 60);
    }

    @Test
    void positionlessHeavyMinutesPlayerIsNotAStarter() {
        TeamRecord home = new TeamRecord(HOME, "NYK", List.of(
                player(1, "A", "One", "G", "10:00"),
                player(2, "B", "Two", "", "48:00"),
                player(3, "C", "Three", "F", "9:00"),
                player(4, "D", "Four", "F", "8:00"),
                player(5, "E", "Five", "C", "7:00"),
                player(6, "F", "Six", "G", "6:00"),
                player(7, "G", "Seven", "G", "")
        ));

        Map<Long, Player> roster = new RosterBuilder(diagnostics).build(home, awayTeam());

        assertThat(roster.get(2L).starter()).isFalse();
        assertThat(roster.get(7L).starter()).isFalse();
        assertThat(roster.get(6L).starter()).isTrue();
    }

    @Test
    void unparseableMinutesCountAsZeroWithDiagnostic() {
        Map<Long, Player> roster = new RosterBuilder(diagnostics).build(homeTeam(), awayTeam());

        assertThat(roster.get(208L).minutesSeconds()).isZero();
        assertThat(roster.get(108L).minutesSeconds()).isZero();
        // blank minutes are normal for DNPs; only the garbage value is reported
        assertThat(diagnostics.list())
                .singleElement()
                .satisfies(d -> {
                    assertThat(d.type()).isEqualTo(DiagnosticType.MINUTES_FORMAT);
                    assertThat(d.message()).contains("208");
                });
    }

    @Test
    void minutesTooLargeForAnIntCountAsZero() {
        TeamRecord home = new TeamRecord(HOME, "NYK", List.of(
                player(1, "Jalen", "Brunson", "G", "PT99999999999M00.00S"),
                player(2, "Josh", "Hart", "G", "30:00")));

        Map<Long, Player> roster = new RosterBuilder(diagnostics).build(home, awayTeam());

        assertThat(roster.get(1L).minutesSeconds()).isZero();
        assertThat(diagnostics.list()).extracting(d -> d.type())
                .containsExactly(DiagnosticType.MINUTES_FORMAT, DiagnosticType.MINUTES_FORMAT);
        assertThat(diagnostics.list().get(0).message()).contains("PT99999999999M00.00S");
    }

    @Test
    void displayNameFallsBackToFullName() {
        TeamRecord home = new TeamRecord(HOME, "NYK", List.of(
                new PlayerRecord(1, "Jalen", "Brunson", null, "11", "G", "30:00")));

        Player p = new RosterBuilder(diagnostics).build(home, awayTeam()).get(1L);

        assertThat(p.displayName()).isEqualTo("Jalen Brunson");
        assertThat(p.shortName()).isEqualTo("J. Brunson");
    }

    @Test
    void duplicatePersonIdIsStructural() {
        TeamRecord away = new TeamRecord(AWAY, "BOS", List.of(player(101, "Jalen", "Brunson", "G", "30:00")));

        assertThatThrownBy(() -> new RosterBuilder(diagnostics).build(homeTeam(), away))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("101");
    }
}
