package com.phillippitts.streamwatch.domain;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A daily monitoring window: a start time of day plus a duration in hours.
 *
 * <p>Windows may wrap past midnight (e.g. 22:00 for 4 hours ends at 02:00). A window of 24 hours or
 * more covers the whole day. Both ends are inclusive.
 *
 * @param start         time of day the window opens
 * @param durationHours length of the window in hours (fractions allowed)
 */
public record ScheduleWindow(LocalTime start, double durationHours) {

    private static final Logger LOG = LogManager.getLogger(ScheduleWindow.class);

    /** Hours applied when a legacy record lists more start times than durations. */
    public static final double DEFAULT_DURATION_HOURS = 5.0;

    public ScheduleWindow {
        Objects.requireNonNull(start, "start must not be null");
        if (durationHours <= 0 || Double.isNaN(durationHours)) {
            throw new IllegalArgumentException("durationHours must be positive, got: " + durationHours);
        }
    }

    public LocalTime end() {
        long minutes = Math.round(durationHours * 60);
        return start.plusMinutes(minutes);
    }

    /**
     * Returns true if the given time of day falls inside this window.
     */
    public boolean contains(LocalTime now) {
        if (durationHours >= 24) {
            return true;
        }
        LocalTime end = end();
        if (!end.isBefore(start)) {
            return !now.isBefore(start) && !now.isAfter(end);
        }
        // wraps midnight
        return !now.isBefore(start) || !now.isAfter(end);
    }

    /**
     * Parses the comma-separated format used by older channel records, e.g.
     * {@code startTimes="18:30:00,22:00"} and {@code hours="3,4.5"}. Entries that fail to parse are skipped.
     *
     * @param startTimes comma-separated times of day (nullable)
     * @param hours      comma-separated durations aligned by index (nullable, missing entries default to 5)
     * @return parsed windows in declaration order
     */
    public static List<ScheduleWindow> parseAll(String startTimes, String hours) {
        List<ScheduleWindow> windows = new ArrayList<>();
        if (startTimes == null || startTimes.isBlank()) {
            return windows;
        }
        String[] starts = startTimes.split(",");
        String[] durations = hours == null ? new String[0] : hours.split(",");
        for (int i = 0; i < starts.length; i++) {
            String startText = starts[i].trim();
            if (startText.isEmpty()) {
                continue;
            }
            String durationText = i < durations.length ? durations[i].trim() : "";
            try {
                double duration = durationText.isEmpty() ? DEFAULT_DURATION_HOURS : Double.parseDouble(durationText);
                windows.add(new ScheduleWindow(LocalTime.parse(startText), duration));
            } catch (DateTimeParseException | IllegalArgumentException e) {
                LOG.warn("Skipping malformed schedule entry start='{}', hours='{}': {}",
                        startText, durationText, e.getMessage());
            }
        }
        return windows;
    }
}
