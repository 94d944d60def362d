package com.phillippitts.streamwatch.service.probe;

import java.util.Locale;

/**
 * How a single liveness check ended.
 */
public enum ProbeOutcome {
    /** Another probe already owned the channel. */
    BUSY,
    SKIPPED_RECORDING,
    /** A recorder for the channel is still running and has not been asked to stop. */
    SKIPPED_RECORDER_ACTIVE,
    SKIPPED_NOT_MONITORED,
    OUT_OF_WINDOW,
    ERROR,
    OFFLINE,
    LIVE_RECORDING,
    LIVE_RECORDING_FAILED,
    LIVE_NOTIFY_ONLY,
    LIVE_NO_DISK_SPACE;

    /** Tag value used for metrics. */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
