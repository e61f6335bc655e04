package com.asad.lineup_tracker.service;

import com.asad.lineup_tracker.model.LineupState;
import com.asad.lineup_tracker.model.SubstitutionEvent;
import com.opencsv.CSVWriter;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

/**
 * CSV export of the tracker output, in the row layout of the lineup_states and
 * substitution_events tables.
 */
@Service
public class CsvService {

    static final String[] LINEUP_HEADER = {
            "game_id", "period", "clock_time", "seconds_elapsed", "team_id",
            "player_1_id", "player_2_id", "player_3_id", "player_4_id", "player_5_id",
            "lineup_hash"
    };

    static final String[] SUBSTITUTION_HEADER = {
            "game_id", "action_number", "period", "clock_time", "seconds_elapsed", "team_id",
            "player_out_id", "player_out_name", "player_in_id", "player_in_name", "description"
    };

    /** Two rows per state (home, then away), player ids sorted ascending. */
    public void writeLineupStates(List<LineupState> states, Writer out) {
        CSVWriter writer = new CSVWriter(out);
        writer.writeNext(LINEUP_HEADER);

        for (LineupState s : states) {
            writer.writeNext(lineupRow(s, s.homeTeamId(), s.homePlayers(), "home"));
            writer.writeNext(lineupRow(s, s.awayTeamId(), s.awayPlayers(), "away"));
        }

        flush(writer);
    }

    public void writeSubstitutions(List<SubstitutionEvent> subs, Writer out) {
        CSVWriter writer = new CSVWriter(out);
        writer.writeNext(SUBSTITUTION_HEADER);

        for (SubstitutionEvent e : subs) {
            writer.writeNext(new String[] {
                    e.gameId(),
                    String.valueOf(e.actionNumber()),
                    String.valueOf(e.period()),
                    e.clock(),
                    String.valueOf(e.elapsedSeconds()),
                    String.valueOf(e.teamId()),
                    String.valueOf(e.playerOutId()),
                    e.playerOutName(),
                    String.valueOf(e.playerInId()),
                    e.playerInName(),
                    e.description()
            });
        }

        flush(writer);
    }

    private String[] lineupRow(LineupState s, long teamId, List<Long> players, String side) {
        List<Long> sorted = new ArrayList<>(players);
        sorted.sort(null);

        String[] row = new String[LINEUP_HEADER.length];
        row[0] = s.gameId();
        row[1] = String.valueOf(s.period());
        row[2] = s.clock();
        row[3] = String.valueOf(s.elapsedSeconds());
        row[4] = String.valueOf(teamId);
        for (int i = 0; i < 5; i++) {
            row[5 + i] = String.valueOf(sorted.get(i));
        }
        row[10] = s.gameId() + "_" + s.period() + "_" + s.elapsedSeconds() + "_" + side;
        return row;
    }

    // the caller owns the underlying writer, so flush rather than close
    private void flush(CSVWriter writer) {
        try {
            writer.flush();
        } catch (IOException ex) {
            throw new UncheckedIOException("CSV export failed: " + ex.getMessage(), ex);
        }
    }
}
