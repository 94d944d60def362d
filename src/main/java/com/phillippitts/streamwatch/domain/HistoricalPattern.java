package com.phillippitts.streamwatch.domain;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Learned on-air pattern of a channel: for each weekday, the hours of day at which the channel was last
 * observed live.
 *
 * <p>Weekdays are indexed 0..6 starting at Sunday. Each day keeps at most {@value #MAX_HOURS_PER_DAY} hours in
 * insertion order; recording a new hour beyond the cap evicts the oldest one. Re-recording an hour that is
 * already present leaves the order unchanged.
 *
 * <p>Thread-safe.
 */
public final class HistoricalPattern {

    public static final int MAX_HOURS_PER_DAY = 5;

    private final Map<Integer, LinkedHashSet<Integer>> hoursByDay = new TreeMap<>();

    public static int dayIndex(DayOfWeek day) {
        return day.getValue() % 7;
    }

    /**
     * Records that the channel was live at the given weekday and hour.
     */
    public synchronized void record(int dayIndex, int hour) {
        checkDay(dayIndex);
        checkHour(hour);
        LinkedHashSet<Integer> hours = hoursByDay.computeIfAbsent(dayIndex, d -> new LinkedHashSet<>());
        if (hours.add(hour) && hours.size() > MAX_HOURS_PER_DAY) {
            hours.remove(hours.iterator().next());
        }
    }

    public synchronized boolean isEmpty() {
        return hoursByDay.isEmpty();
    }

    public synchronized boolean hasDay(int dayIndex) {
        return hoursByDay.containsKey(dayIndex);
    }

    public synchronized boolean contains(int dayIndex, int hour) {
        Set<Integer> hours = hoursByDay.get(dayIndex);
        return hours != null && hours.contains(hour);
    }

    /** Hours recorded for the day in insertion order; empty if the day is absent. */
    public synchronized List<Integer> hours(int dayIndex) {
        Set<Integer> hours = hoursByDay.get(dayIndex);
        return hours == null ? List.of() : List.copyOf(hours);
    }

    public synchronized int totalSlots() {
        return hoursByDay.values().stream().mapToInt(Set::size).sum();
    }

    public synchronized int activeDays() {
        return hoursByDay.size();
    }

    /**
     * Density of the learned schedule: recorded slots over the maximum possible for the active days.
     * Returns 0 when nothing has been recorded.
     */
    public synchronized double consistency() {
        if (hoursByDay.isEmpty()) {
            return 0.0;
        }
        return totalSlots() / (hoursByDay.size() * (double) MAX_HOURS_PER_DAY);
    }

    /** Immutable copy keyed by day index, used for persistence and views. */
    public synchronized Map<Integer, List<Integer>> asMap() {
        Map<Integer, List<Integer>> copy = new TreeMap<>();
        hoursByDay.forEach((day, hours) -> copy.put(day, List.copyOf(hours)));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Rebuilds a pattern from persisted data. Out-of-range entries are dropped and over-long days are trimmed
     * to their most recent entries.
     */
    public static HistoricalPattern fromMap(Map<Integer, ? extends List<Integer>> source) {
        HistoricalPattern pattern = new HistoricalPattern();
        if (source == null) {
            return pattern;
        }
        source.forEach((day, hours) -> {
            if (day == null || day < 0 || day > 6 || hours == null) {
                return;
            }
            for (Integer hour : new ArrayList<>(hours)) {
                if (hour != null && hour >= 0 && hour <= 23) {
                    pattern.record(day, hour);
                }
            }
        });
        return pattern;
    }

    @Override
    public synchronized String toString() {
        return hoursByDay.toString();
    }

    private static void checkDay(int dayIndex) {
        if (dayIndex < 0 || dayIndex > 6) {
            throw new IllegalArgumentException("dayIndex must be 0..6, got: " + dayIndex);
        }
    }

    private static void checkHour(int hour) {
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException("hour must be 0..23, got: " + hour);
        }
    }
}
