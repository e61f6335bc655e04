package com.asad.lineup_tracker.service;

import com.asad.lineup_tracker.model.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Knicks (home) vs Celtics (away), two periods. Mirrors games/sample_game.json.
 *
 * Home: 101 Brunson, 102 Hart, 103 Bridges, 104 Anunoby, 105 Robinson start; 106 McBride,
 * 107 Achiuwa come off the bench. Away: 201 Holiday, 202 White, 203 Brown, 204 Tatum,
 * 205 Porzingis start; 206 Pritchard, 207 Horford, 208 Hauser.
 */
public final class GameFixtures {

    public static final String GAME_ID = "0022400001";
    public static final long HOME = 1610612752L;
    public static final long AWAY = 1610612738L;

    private GameFixtures() {}

    public static TeamRecord homeTeam() {
        return new TeamRecord(HOME, "NYK", List.of(
                player(101, "Jalen", "Brunson", "G", "PT35M00.00S"),
                player(102, "Josh", "Hart", "G", "34:00"),
                player(103, "Mikal", "Bridges", "F", "33:00"),
                player(104, "OG", "Anunoby", "F", "32:00"),
                player(105, "Mitchell", "Robinson", "C", "30:00"),
                player(106, "Miles", "McBride", "", "20:00"),
                player(107, "Precious", "Achiuwa", "", "10:00"),
                player(108, "Tyler", "Kolek", "", "")
        ));
    }

    public static TeamRecord awayTeam() {
        return new TeamRecord(AWAY, "BOS", List.of(
                player(201, "Jrue", "Holiday", "G", "36:00"),
                player(202, "Derrick", "White", "G", "35:00"),
                player(203, "Jaylen", "Brown", "F", "34:00"),
                player(204, "Jayson", "Tatum", "F", "33:00"),
                player(205, "Kristaps", "Porzingis", "C", "30:00"),
                player(206, "Payton", "Pritchard", "", "22:00"),
                player(207, "Al", "Horford", "", "18:00"),
                player(208, "Sam", "Hauser", "", "DNP")
        ));
    }

    public static PlayerRecord player(long id, String first, String family, String position, String minutes) {
        return new PlayerRecord(id, first, family, first.charAt(0) + ". " + family, "0", position, minutes);
    }

    public static GameRecord sampleGame() {
        return game(sampleActions());
    }

    public static GameRecord game(List<Action> actions) {
        return new GameRecord(GAME_ID, homeTeam(), awayTeam(), actions);
    }

    public static List<Action> sampleActions() {
        List<Action> a = new ArrayList<>();
        a.add(periodStart(1, 1));
        a.add(shot(2, 1, "PT11M40.00S", HOME, 101));
        a.add(shot(3, 1, "PT11M20.00S", AWAY, 203));
        a.add(new Action(4, 1, "PT10M00.00S", AWAY, AWAY, null, "Rebound", "Celtics Rebound"));
        a.add(sub(5, 1, "PT07M00.00S", HOME, 105, "Robinson", "SUB: McBride FOR Robinson"));
        a.add(sub(6, 1, "PT07M00.00S", AWAY, 205, "Porzingis", "SUB: Horford FOR Porzingis"));
        a.add(periodEnd(7, 1));
        a.add(periodStart(8, 2));
        a.add(shot(9, 2, "PT11M00.00S", HOME, 106));
        a.add(sub(10, 2, "PT06M00.00S", HOME, 103, "Bridges", "SUB: Robinson FOR Bridges"));
        a.add(periodEnd(11, 2));
        return a;
    }

    public static Action periodStart(int n, int period) {
        return new Action(n, period, GameClock.periodStartClock(period), null, null, null, "period", "Start of period " + period);
    }

    public static Action periodEnd(int n, int period) {
        return new Action(n, period, "PT00M00.00S", null, null, null, "period", "End of period " + period);
    }

    public static Action shot(int n, int period, String clock, long teamId, long personId) {
        return new Action(n, period, clock, teamId, personId, null, "Made Shot", "Jump Shot (2 PTS)");
    }

    public static Action sub(int n, int period, String clock, long teamId, long outId, String outName, String description) {
        return new Action(n, period, clock, teamId, outId, outName, "Substitution", description);
    }

    public static Player rosterPlayer(long id, String first, String family, long teamId, int minutesSeconds) {
        return new Player(id, first, family, first.charAt(0) + ". " + family, "0", "G", teamId, false, minutesSeconds);
    }
}
