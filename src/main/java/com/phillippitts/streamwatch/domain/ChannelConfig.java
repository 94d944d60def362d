package com.phillippitts.streamwatch.domain;

import java.util.List;
import java.util.Objects;

/**
 * Externally supplied configuration of a channel. Immutable; changes are applied by replacing the
 * whole record on the owning {@link ChannelState} (see {@link ChannelPatch}).
 *
 * @param displayName        streamer or room name shown to the user
 * @param quality            desired stream quality (e.g. "OD", "UHD", "HD")
 * @param recordFormat       container format for recordings (e.g. "ts", "mp4")
 * @param monitoringEnabled  whether the scheduler polls this channel
 * @param scheduledRecording whether probing is limited to {@code scheduleWindows}
 * @param scheduleWindows    daily windows used when {@code scheduledRecording} is on
 * @param segmentRecord      whether recordings are split into segments
 * @param segmentTimeSeconds segment length when {@code segmentRecord} is on
 * @param recordingDir       per-channel output directory override (nullable)
 * @param messagePushEnabled whether push messages are sent for this channel
 * @param notifyOnly         notify when live but never start a recording session
 */
public record ChannelConfig(
        String displayName,
        String quality,
        String recordFormat,
        boolean monitoringEnabled,
        boolean scheduledRecording,
        List<ScheduleWindow> scheduleWindows,
        boolean segmentRecord,
        int segmentTimeSeconds,
        String recordingDir,
        boolean messagePushEnabled,
        boolean notifyOnly
) {

    /** Placeholder name given to channels whose streamer name is not known yet. */
    public static final String PLACEHOLDER_NAME = "Live Room";

    public ChannelConfig {
        displayName = displayName == null ? PLACEHOLDER_NAME : displayName;
        quality = quality == null ? "OD" : quality;
        recordFormat = recordFormat == null ? "ts" : recordFormat;
        scheduleWindows = scheduleWindows == null ? List.of() : List.copyOf(scheduleWindows);
        if (segmentTimeSeconds < 0) {
            throw new IllegalArgumentException("segmentTimeSeconds must not be negative");
        }
    }

    /**
     * Configuration for a newly added channel: monitored, unscheduled, recording enabled.
     */
    public static ChannelConfig defaults(String displayName) {
        return new ChannelConfig(displayName, "OD", "ts", true, false, List.of(),
                false, 1800, null, false, false);
    }

    public ChannelConfig withMonitoringEnabled(boolean enabled) {
        return new ChannelConfig(displayName, quality, recordFormat, enabled, scheduledRecording,
                scheduleWindows, segmentRecord, segmentTimeSeconds, recordingDir, messagePushEnabled, notifyOnly);
    }

    public ChannelConfig withDisplayName(String name) {
        return new ChannelConfig(Objects.requireNonNull(name, "name"), quality, recordFormat, monitoringEnabled,
                scheduledRecording, scheduleWindows, segmentRecord, segmentTimeSeconds, recordingDir,
                messagePushEnabled, notifyOnly);
    }

    public boolean hasPlaceholderName() {
        return displayName.isBlank() || PLACEHOLDER_NAME.equals(displayName.trim());
    }
}
