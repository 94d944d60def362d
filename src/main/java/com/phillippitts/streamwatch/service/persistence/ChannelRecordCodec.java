package com.phillippitts.streamwatch.service.persistence;

import com.phillippitts.streamwatch.domain.ChannelConfig;
import com.phillippitts.streamwatch.domain.ChannelState;
import com.phillippitts.streamwatch.domain.LearnedStatistics;
import com.phillippitts.streamwatch.domain.ScheduleWindow;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Converts channels to and from their stored JSON documents.
 *
 * <p>Keys are snake_case. Reading also accepts the older layout: {@code rec_id}/{@code streamer_name} names,
 * comma-separated {@code scheduled_start_time}/{@code monitor_hours} schedules, local date-time strings for
 * timestamps, and a missing {@code priority_score} seeded from the legacy counters.
 */
final class ChannelRecordCodec {

    private static final Logger LOG = LogManager.getLogger(ChannelRecordCodec.class);

    private final ZoneId zone;

    ChannelRecordCodec(ZoneId zone) {
        this.zone = zone;
    }

    JSONObject encode(ChannelState channel) {
        ChannelConfig config = channel.getConfig();
        LearnedStatistics stats = channel.learnedStatistics();

        JSONObject json = new JSONObject();
        json.put("id", channel.getId());
        json.put("url", channel.getUrl());
        json.put("platform_key", channel.getPlatformKey() == null ? JSONObject.NULL : channel.getPlatformKey());
        json.put("added_at", channel.getAddedAt() == null ? JSONObject.NULL : channel.getAddedAt().toString());

        json.put("display_name", config.displayName());
        json.put("quality", config.quality());
        json.put("record_format", config.recordFormat());
        json.put("monitor_status", config.monitoringEnabled());
        json.put("scheduled_recording", config.scheduledRecording());
        JSONArray schedule = new JSONArray();
        for (ScheduleWindow window : config.scheduleWindows()) {
            schedule.put(new JSONObject().put("start", window.start().toString()).put("hours", window.durationHours()));
        }
        json.put("schedule", schedule);
        json.put("segment_record", config.segmentRecord());
        json.put("segment_time", config.segmentTimeSeconds());
        json.put("recording_dir", config.recordingDir() == null ? JSONObject.NULL : config.recordingDir());
        json.put("enabled_message_push", config.messagePushEnabled());
        json.put("only_notify_no_record", config.notifyOnly());

        json.put("priority_score", stats.priorityScore());
        JSONObject intervals = new JSONObject();
        stats.historicalIntervals().forEach((day, hours) -> intervals.put(String.valueOf(day), new JSONArray(hours)));
        json.put("historical_intervals", intervals);
        json.put("last_seen_live", stats.lastSeenLiveAt() == null ? JSONObject.NULL : stats.lastSeenLiveAt().toString());
        json.put("consistency_score", stats.consistencyScore());
        json.put("live_check_count", stats.liveCheckCount());
        json.put("live_found_count", stats.liveFoundCount());
        json.put("last_duration", channel.getLastDuration().toSeconds());
        return json;
    }

    /**
     * Decodes one stored record.
     *
     * @param json           the record
     * @param mondayFirstDays true when weekday keys count from Monday (records written by older versions)
     * @throws IllegalArgumentException if the record has no id or url
     */
    ChannelState decode(JSONObject json, boolean mondayFirstDays) {
        String id = firstText(json, "id", "rec_id");
        String url = json.optString("url", "").trim();
        if (id == null || url.isEmpty()) {
            throw new IllegalArgumentException("record is missing id or url");
        }

        List<ScheduleWindow> windows;
        JSONArray schedule = json.optJSONArray("schedule");
        if (schedule != null) {
            windows = decodeSchedule(schedule);
        } else {
            windows = ScheduleWindow.parseAll(optText(json, "scheduled_start_time"), optText(json, "monitor_hours"));
        }

        ChannelConfig config = new ChannelConfig(
                firstText(json, "display_name", "streamer_name"),
                optText(json, "quality"),
                optText(json, "record_format"),
                json.optBoolean("monitor_status", true),
                json.optBoolean("scheduled_recording", false),
                windows,
                json.optBoolean("segment_record", false),
                Math.max(0, json.optInt("segment_time", 1800)),
                optText(json, "recording_dir"),
                json.optBoolean("enabled_message_push", false),
                json.optBoolean("only_notify_no_record", false));

        int checks = Math.max(0, json.optInt("live_check_count", 0));
        int found = Math.max(0, json.optInt("live_found_count", 0));
        double score = json.optDouble("priority_score", 0.0);
        if (Double.isNaN(score) || score == 0.0) {
            score = checks > 0 ? (double) found / checks : 0.0;
        }

        LearnedStatistics stats = new LearnedStatistics(
                score,
                decodeIntervals(json.optJSONObject("historical_intervals"), mondayFirstDays),
                parseInstant(optText(json, "last_seen_live")),
                json.optDouble("consistency_score", 0.0),
                checks,
                found);

        double lastDurationSeconds = json.optDouble("last_duration", 0.0);
        Duration lastDuration = Double.isNaN(lastDurationSeconds) || lastDurationSeconds < 0
                ? Duration.ZERO
                : Duration.ofMillis(Math.round(lastDurationSeconds * 1000));

        Instant addedAt = parseInstant(optText(json, "added_at"));
        return ChannelState.restore(id, url, optText(json, "platform_key"), config, addedAt, stats, lastDuration);
    }

    private static List<ScheduleWindow> decodeSchedule(JSONArray schedule) {
        List<ScheduleWindow> windows = new ArrayList<>();
        for (int i = 0; i < schedule.length(); i++) {
            JSONObject entry = schedule.optJSONObject(i);
            if (entry == null) {
                continue;
            }
            try {
                windows.add(new ScheduleWindow(LocalTime.parse(entry.getString("start")),
                        entry.optDouble("hours", ScheduleWindow.DEFAULT_DURATION_HOURS)));
            } catch (RuntimeException e) {
                LOG.warn("Dropping malformed schedule window {}: {}", entry, e.getMessage());
            }
        }
        return windows;
    }

    private static Map<Integer, List<Integer>> decodeIntervals(JSONObject intervals, boolean mondayFirstDays) {
        Map<Integer, List<Integer>> result = new TreeMap<>();
        if (intervals == null) {
            return result;
        }
        for (String key : intervals.keySet()) {
            int day;
            try {
                day = Integer.parseInt(key.trim());
            } catch (NumberFormatException e) {
                LOG.warn("Ignoring historical interval with non-numeric day '{}'", key);
                continue;
            }
            if (day < 0 || day > 6) {
                continue;
            }
            if (mondayFirstDays) {
                day = (day + 1) % 7;
            }
            JSONArray hours = intervals.optJSONArray(key);
            if (hours == null) {
                continue;
            }
            List<Integer> parsed = new ArrayList<>();
            for (int i = 0; i < hours.length(); i++) {
                int hour = hours.optInt(i, -1);
                if (hour >= 0 && hour <= 23) {
                    parsed.add(hour);
                }
            }
            result.put(day, parsed);
        }
        return result;
    }

    private Instant parseInstant(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException notAnInstant) {
            try {
                return LocalDateTime.parse(text.trim().replace(' ', 'T')).atZone(zone).toInstant();
            } catch (DateTimeParseException e) {
                LOG.warn("Ignoring unparseable timestamp '{}'", text);
                return null;
            }
        }
    }

    private static String firstText(JSONObject json, String key, String fallbackKey) {
        String value = optText(json, key);
        return value != null ? value : optText(json, fallbackKey);
    }

    private static String optText(JSONObject json, String key) {
        if (!json.has(key) || json.isNull(key)) {
            return null;
        }
        String value = String.valueOf(json.get(key)).trim();
        return value.isEmpty() ? null : value;
    }
}
