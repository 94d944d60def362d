package com.phillippitts.streamwatch.domain;

/**
 * User-visible status of a monitored channel.
 */
public enum ChannelStatus {
    /** Monitoring is on and the channel was found offline (or not yet probed). */
    MONITORING,
    /** A probe is in flight. */
    CHECKING,
    /** Monitoring was turned off. */
    STOPPED_MONITORING,
    /** A scheduled-recording window is configured and "now" is outside all of its windows. */
    NOT_IN_SCHEDULE,
    /** The last probe failed or the resolver returned incomplete data. */
    CHECK_ERROR,
    /** Live and a recording session is being started. */
    PREPARING_RECORDING,
    /** A recording session is running. */
    RECORDING,
    /** Live, notify-only channel: no session is started. */
    LIVE_BROADCASTING,
    /** Live but new recordings are suspended because disk space is below the threshold. */
    NO_DISK_SPACE,
    /** The recorder refused to start a session. */
    RECORDING_ERROR,
    /** A recording session was stopped. */
    NOT_RECORDING
}
