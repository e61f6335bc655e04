package com.asad.lineup_tracker.service;

import com.asad.lineup_tracker.exception.ClockFormatException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Game clock arithmetic.
 *
 * NBA clocks count DOWN ("PT07M30.00S" = 7:30 left in the period). Everything downstream works on
 * elapsed seconds since tip-off, which only ever goes up.
 */
public final class GameClock {

    public static final int REGULATION_PERIODS = 4;
    public static final int REGULATION_PERIOD_SECONDS = 12 * 60;
    public static final int OVERTIME_PERIOD_SECONDS = 5 * 60;

    private static final Pattern PT_CLOCK =
            Pattern.compile("PT(?:(\\d+)M)?(?:(\\d+(?:\\.\\d+)?)S)?");

    private GameClock() {}

    /**
     * Seconds elapsed since the start of the game.
     *
     * @param period 1-4 for regulation, 5+ for overtime
     * @param clock time remaining in the period, PT format
     * @throws ClockFormatException if the clock is not PT format
     */
    public static int elapsedSeconds(int period, String clock) {
        return elapsedSeconds(period, remainingSeconds(clock));
    }

    public static int elapsedSeconds(int period, double remainingSeconds) {
        if (period < 1) throw new IllegalArgumentException("Period must be >= 1, got " + period);

        double total;
        if (period <= REGULATION_PERIODS) {
            total = (period - 1) * REGULATION_PERIOD_SECONDS + (REGULATION_PERIOD_SECONDS - remainingSeconds);
        } else {
            total = REGULATION_PERIODS * REGULATION_PERIOD_SECONDS
                    + (period - REGULATION_PERIODS - 1) * OVERTIME_PERIOD_SECONDS
                    + (OVERTIME_PERIOD_SECONDS - remainingSeconds);
        }
        return (int) total;
    }

    /** Parses a PT clock into seconds remaining. Absent minutes/seconds count as zero. */
    public static double remainingSeconds(String clock) {
        if (clock == null) throw new ClockFormatException(null);

        Matcher m = PT_CLOCK.matcher(clock.trim());
        if (!m.matches()) throw new ClockFormatException(clock);

        try {
            int minutes = m.group(1) != null ? Integer.parseInt(m.group(1)) : 0;
            double seconds = m.group(2) != null ? Double.parseDouble(m.group(2)) : 0;
            return minutes * 60.0 + seconds;
        } catch (NumberFormatException e) {
            // digits fit the grammar but not an int
            throw new ClockFormatException(clock);
        }
    }

    public static int periodLengthSeconds(int period) {
        if (period >= 1 && period <= REGULATION_PERIODS) return REGULATION_PERIOD_SECONDS;
        return OVERTIME_PERIOD_SECONDS; // OT
    }

    /** Elapsed seconds at the opening tip / inbound of a period. */
    public static int periodStartElapsed(int period) {
        return elapsedSeconds(period, periodLengthSeconds(period));
    }

    /** Full clock for a period, as the feed prints it. */
    public static String periodStartClock(int period) {
        return String.format("PT%02dM00.00S", periodLengthSeconds(period) / 60);
    }

    /**
     * Parses box-score minutes. Accepts "MM:SS" and the live-data "PT25M01.00S" form.
     *
     * @return seconds played, or null when blank or unparseable
     */
    public static Integer parseMinutes(String minutes) {
        if (minutes == null || minutes.isBlank()) return null;

        String c = minutes.trim();

        if (c.contains(":")) {
            String[] t = c.split(":");
            if (t.length != 2) return null;
            try {
                int mm = Integer.parseInt(t[0].trim());
                int ss = Integer.parseInt(t[1].trim());
                return mm * 60 + ss;
            } catch (NumberFormatException e) {
                return null;
            }
        }

        if (c.startsWith("PT")) {
            try {
                return (int) remainingSeconds(c);
            } catch (ClockFormatException e) {
                return null;
            }
        }

        return null;
    }
}
