package com.asad.lineup_tracker.web;

import com.asad.lineup_tracker.exception.ClockFormatException;
import com.asad.lineup_tracker.exception.LineupDataException;
import com.asad.lineup_tracker.exception.StructuralException;
import com.asad.lineup_tracker.model.LineupTrackingResult;
import com.asad.lineup_tracker.model.OnCourtLineup;
import com.asad.lineup_tracker.service.CsvService;
import com.asad.lineup_tracker.service.LineupTracker;
import com.asad.lineup_tracker.service.LineupTrackerService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.Locale;

/**
 * Upload a game JSON (box score + play-by-play), get lineups back.
 */
@RestController
@RequestMapping("/nba/lineups")
public class LineupController {

    private final LineupTrackerService lineupTrackerService;
    private final CsvService csvService;

    public LineupController(LineupTrackerService lineupTrackerService, CsvService csvService) {
        this.lineupTrackerService = lineupTrackerService;
        this.csvService = csvService;
    }

    @PostMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public LineupTrackingResult track(@RequestParam("file") MultipartFile file) {
        try (InputStream in = file.getInputStream()) {
            return lineupTrackerService.track(in);
        } catch (IOException ex) {
            throw new UncheckedIOException("Upload could not be read: " + ex.getMessage(), ex);
        }
    }

    @PostMapping(value = "/on-court", produces = MediaType.APPLICATION_JSON_VALUE)
    public OnCourtLineup onCourt(@RequestParam("file") MultipartFile file,
                                 @RequestParam int period,
                                 @RequestParam String clock) {
        if (period < 1) throw new IllegalArgumentException("period must be >= 1");

        try (InputStream in = file.getInputStream()) {
            return lineupTrackerService.playersOnCourt(in, period, clock);
        } catch (IOException ex) {
            throw new UncheckedIOException("Upload could not be read: " + ex.getMessage(), ex);
        }
    }

    @PostMapping(value = "/export", produces = "text/csv")
    public ResponseEntity<String> export(@RequestParam("file") MultipartFile file,
                                         @RequestParam(defaultValue = "states") String kind) {
        String k = kind.trim().toLowerCase(Locale.ROOT);
        if (!k.equals("states") && !k.equals("substitutions")) {
            throw new IllegalArgumentException("kind must be 'states' or 'substitutions'");
        }

        LineupTracker tracker;
        try (InputStream in = file.getInputStream()) {
            tracker = lineupTrackerService.newTracker(in);
        } catch (IOException ex) {
            throw new UncheckedIOException("Upload could not be read: " + ex.getMessage(), ex);
        }

        LineupTrackingResult result = tracker.track();
        StringWriter out = new StringWriter();
        if (k.equals("states")) csvService.writeLineupStates(result.states(), out);
        else csvService.writeSubstitutions(result.substitutions(), out);

        return ResponseEntity.ok()
                .contentType(new MediaType("text", "csv"))
                .header("Content-Disposition",
                        "attachment; filename=\"" + result.gameId() + "_" + k + ".csv\"")
                .body(out.toString());
    }

    // ---------------- errors ----------------

    @ExceptionHandler(StructuralException.class)
    public ResponseEntity<ErrorBody> structural(StructuralException ex) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "structural", ex.getMessage());
    }

    @ExceptionHandler(LineupDataException.class)
    public ResponseEntity<ErrorBody> lossy(LineupDataException ex) {
        return error(HttpStatus.CONFLICT, "lossy_substitutions", ex.getMessage());
    }

    @ExceptionHandler(ClockFormatException.class)
    public ResponseEntity<ErrorBody> clock(ClockFormatException ex) {
        return error(HttpStatus.BAD_REQUEST, "clock_format", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorBody> badRequest(IllegalArgumentException ex) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
    }

    private ResponseEntity<ErrorBody> error(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorBody(error, message));
    }

    public record ErrorBody(String error, String message) {}
}
