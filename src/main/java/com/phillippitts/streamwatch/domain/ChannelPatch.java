package com.phillippitts.streamwatch.domain;

import com.phillippitts.streamwatch.exception.InvalidChannelPatchException;

import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Explicit, enumerated set of configuration changes for a channel.
 *
 * <p>Only the fields listed in {@link #FIELDS} can be patched. {@link #fromMap(Map)} rejects any other key
 * instead of silently setting arbitrary attributes. Monitoring on/off is not part of a patch; it goes
 * through the monitoring commands so that an active recording is stopped properly.
 */
public final class ChannelPatch {

    public static final Set<String> FIELDS = Set.of(
            "displayName", "quality", "recordFormat", "scheduledRecording", "scheduleWindows",
            "segmentRecord", "segmentTimeSeconds", "recordingDir", "messagePushEnabled", "notifyOnly");

    private String displayName;
    private String quality;
    private String recordFormat;
    private Boolean scheduledRecording;
    private List<ScheduleWindow> scheduleWindows;
    private Boolean segmentRecord;
    private Integer segmentTimeSeconds;
    private String recordingDir;
    private boolean recordingDirSet;
    private Boolean messagePushEnabled;
    private Boolean notifyOnly;

    private ChannelPatch() {
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a patch from a loosely typed document such as a decoded JSON body.
     *
     * <p>{@code scheduleWindows} is a list of objects with {@code start} ("HH:mm[:ss]") and {@code hours}.
     *
     * @throws InvalidChannelPatchException if a key is unknown or a value has the wrong type
     */
    public static ChannelPatch fromMap(Map<String, ?> values) {
        Builder builder = builder();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            switch (key) {
                case "displayName" -> builder.displayName(requireText(key, value));
                case "quality" -> builder.quality(requireText(key, value));
                case "recordFormat" -> builder.recordFormat(requireText(key, value));
                case "scheduledRecording" -> builder.scheduledRecording(requireBoolean(key, value));
                case "scheduleWindows" -> builder.scheduleWindows(parseWindows(key, value));
                case "segmentRecord" -> builder.segmentRecord(requireBoolean(key, value));
                case "segmentTimeSeconds" -> builder.segmentTimeSeconds(requireNonNegativeInt(key, value));
                case "recordingDir" -> builder.recordingDir(value == null ? null : requireText(key, value));
                case "messagePushEnabled" -> builder.messagePushEnabled(requireBoolean(key, value));
                case "notifyOnly" -> builder.notifyOnly(requireBoolean(key, value));
                case "monitoringEnabled" -> throw new InvalidChannelPatchException(key,
                        "use the start/stop monitoring commands instead");
                default -> throw new InvalidChannelPatchException(key, "unknown field");
            }
        }
        return builder.build();
    }

    /**
     * Returns a copy of {@code config} with this patch applied. Fields absent from the patch keep their value.
     */
    public ChannelConfig applyTo(ChannelConfig config) {
        return new ChannelConfig(
                Optional.ofNullable(displayName).orElse(config.displayName()),
                Optional.ofNullable(quality).orElse(config.quality()),
                Optional.ofNullable(recordFormat).orElse(config.recordFormat()),
                config.monitoringEnabled(),
                Optional.ofNullable(scheduledRecording).orElse(config.scheduledRecording()),
                Optional.ofNullable(scheduleWindows).orElse(config.scheduleWindows()),
                Optional.ofNullable(segmentRecord).orElse(config.segmentRecord()),
                Optional.ofNullable(segmentTimeSeconds).orElse(config.segmentTimeSeconds()),
                recordingDirSet ? recordingDir : config.recordingDir(),
                Optional.ofNullable(messagePushEnabled).orElse(config.messagePushEnabled()),
                Optional.ofNullable(notifyOnly).orElse(config.notifyOnly()));
    }

    public boolean isEmpty() {
        return displayName == null && quality == null && recordFormat == null && scheduledRecording == null
                && scheduleWindows == null && segmentRecord == null && segmentTimeSeconds == null
                && !recordingDirSet && messagePushEnabled == null && notifyOnly == null;
    }

    private static String requireText(String key, Object value) {
        if (!(value instanceof String text)) {
            throw new InvalidChannelPatchException(key, "expected a string");
        }
        return text;
    }

    private static boolean requireBoolean(String key, Object value) {
        if (!(value instanceof Boolean flag)) {
            throw new InvalidChannelPatchException(key, "expected a boolean");
        }
        return flag;
    }

    private static int requireNonNegativeInt(String key, Object value) {
        if (!(value instanceof Number number) || number.doubleValue() != Math.rint(number.doubleValue())) {
            throw new InvalidChannelPatchException(key, "expected an integer");
        }
        if (number.intValue() < 0) {
            throw new InvalidChannelPatchException(key, "must not be negative");
        }
        return number.intValue();
    }

    private static List<ScheduleWindow> parseWindows(String key, Object value) {
        if (!(value instanceof List<?> items)) {
            throw new InvalidChannelPatchException(key, "expected a list of {start, hours} objects");
        }
        List<ScheduleWindow> windows = new ArrayList<>();
        for (Object item : items) {
            if (!(item instanceof Map<?, ?> window)) {
                throw new InvalidChannelPatchException(key, "expected a list of {start, hours} objects");
            }
            Object start = window.get("start");
            Object hours = window.get("hours");
            if (!(start instanceof String startText) || !(hours instanceof Number duration)) {
                throw new InvalidChannelPatchException(key, "each window needs a string start and numeric hours");
            }
            try {
                windows.add(new ScheduleWindow(LocalTime.parse(startText), duration.doubleValue()));
            } catch (DateTimeParseException | IllegalArgumentException e) {
                throw new InvalidChannelPatchException(key, e.getMessage());
            }
        }
        return Collections.unmodifiableList(windows);
    }

    /**
     * Fluent builder for patches assembled in code.
     */
    public static final class Builder {
        private final ChannelPatch patch = new ChannelPatch();

        public Builder displayName(String displayName) {
            patch.displayName = displayName;
            return this;
        }

        public Builder quality(String quality) {
            patch.quality = quality;
            return this;
        }

        public Builder recordFormat(String recordFormat) {
            patch.recordFormat = recordFormat;
            return this;
        }

        public Builder scheduledRecording(boolean scheduledRecording) {
            patch.scheduledRecording = scheduledRecording;
            return this;
        }

        public Builder scheduleWindows(List<ScheduleWindow> scheduleWindows) {
            patch.scheduleWindows = List.copyOf(scheduleWindows);
            return this;
        }

        public Builder segmentRecord(boolean segmentRecord) {
            patch.segmentRecord = segmentRecord;
            return this;
        }

        public Builder segmentTimeSeconds(int segmentTimeSeconds) {
            patch.segmentTimeSeconds = segmentTimeSeconds;
            return this;
        }

        public Builder recordingDir(String recordingDir) {
            patch.recordingDir = recordingDir;
            patch.recordingDirSet = true;
            return this;
        }

        public Builder messagePushEnabled(boolean messagePushEnabled) {
            patch.messagePushEnabled = messagePushEnabled;
            return this;
        }

        public Builder notifyOnly(boolean notifyOnly) {
            patch.notifyOnly = notifyOnly;
            return this;
        }

        public ChannelPatch build() {
            return patch;
        }
    }
}
