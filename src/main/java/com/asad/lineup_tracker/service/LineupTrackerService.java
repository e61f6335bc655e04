package com.asad.lineup_tracker.service;

import com.asad.lineup_tracker.config.LineupProperties;
import com.asad.lineup_tracker.model.GameRecord;
import com.asad.lineup_tracker.model.LineupTrackingResult;
import com.asad.lineup_tracker.model.OnCourtLineup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.InputStream;

/**
 * Entry point for callers holding raw game JSON. Stateless: every call decodes the game and
 * builds a fresh {@link LineupTracker}, so concurrent requests never share anything.
 */
@Service
public class LineupTrackerService {

    private static final Logger log = LoggerFactory.getLogger(LineupTrackerService.class);

    private final GameDataParser parser;
    private final LineupProperties props;

    public LineupTrackerService(GameDataParser parser, LineupProperties props) {
        this.parser = parser;
        this.props = props;
    }

    public LineupTracker newTracker(InputStream gameJson) {
        return newTracker(parser.parse(gameJson));
    }

    public LineupTracker newTracker(GameRecord game) {
        return new LineupTracker(game, props);
    }

    public LineupTrackingResult track(InputStream gameJson) {
        return track(parser.parse(gameJson));
    }

    public LineupTrackingResult track(GameRecord game) {
        LineupTrackingResult result = newTracker(game).track();

        log.info("Game {}: {} lineup states, {} substitutions ({} dropped), {} diagnostics",
                result.gameId(),
                result.states().size(),
                result.substitutions().size(),
                result.droppedSubstitutions(),
                result.diagnostics().size());

        return result;
    }

    public OnCourtLineup playersOnCourt(InputStream gameJson, int period, String clock) {
        return newTracker(gameJson).playersOnCourt(period, clock);
    }
}
