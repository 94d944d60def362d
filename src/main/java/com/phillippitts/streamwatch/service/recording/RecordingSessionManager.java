package com.phillippitts.streamwatch.service.recording;

import com.phillippitts.streamwatch.domain.ChannelState;
import com.phillippitts.streamwatch.domain.ChannelStatus;
import com.phillippitts.streamwatch.service.recording.event.RecordingEndedEvent;
import com.phillippitts.streamwatch.service.registry.ChannelRegistry;
import com.phillippitts.streamwatch.service.resolver.StreamInfo;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Owns recording sessions: starts recorders for live channels, stops them on request and closes sessions when
 * a recorder exits on its own.
 *
 * <p>Active recorders are tracked by channel id. A handle stays registered until its recorder exits, so a
 * stopping recorder can be told apart from a running one ({@link #hasBlockingRecorder(String)}).
 */
public class RecordingSessionManager {

    private static final Logger LOG = LogManager.getLogger(RecordingSessionManager.class);

    private final StreamRecorder recorder;
    private final ChannelRegistry registry;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;
    private final ConcurrentMap<String, RecorderHandle> activeRecorders = new ConcurrentHashMap<>();

    public RecordingSessionManager(StreamRecorder recorder, ChannelRegistry registry,
                                   ApplicationEventPublisher publisher, Clock clock) {
        this.recorder = recorder;
        this.registry = registry;
        this.publisher = publisher;
        this.clock = clock;
    }

    /**
     * True if a recorder for the channel is registered and has not been asked to stop.
     */
    public boolean hasBlockingRecorder(String channelId) {
        RecorderHandle handle = activeRecorders.get(channelId);
        return handle != null && !handle.shouldStop();
    }

    public Optional<RecorderHandle> activeRecorder(String channelId) {
        return Optional.ofNullable(activeRecorders.get(channelId));
    }

    public Map<String, RecorderHandle> activeRecorders() {
        return Map.copyOf(activeRecorders);
    }

    /**
     * Opens a session for a live channel and starts its recorder.
     *
     * <p>The monitoring and live flags are checked and the session opened under the channel's monitor, the same
     * monitor {@link #stopRecording} and the monitoring commands hold, so a concurrent stop either sees the open
     * session or prevents it.
     *
     * @return true if the recorder started; false if monitoring is off, the channel is no longer live, a session
     *         was already open or the recorder failed, in which case the channel is left in
     *         {@link ChannelStatus#RECORDING_ERROR}
     */
    public boolean startSession(ChannelState channel, StreamInfo info) {
        synchronized (channel) {
            if (!channel.isMonitoringEnabled() || !channel.isLive()) {
                LOG.info("Not starting recording for {}: monitoring={} live={}", channel.getId(),
                        channel.isMonitoringEnabled(), channel.isLive());
                return false;
            }
            if (!channel.beginRecordingSession(clock.instant())) {
                return false;
            }
            channel.setForceStop(false);
            channel.setStoppingInProgress(false);
        }
        LOG.info("Started recording for {}", channel.getConfig().displayName());

        RecorderHandle handle;
        try {
            handle = recorder.start(channel, info);
        } catch (RuntimeException e) {
            LOG.error("Recorder failed to start for channel {}", channel.getId(), e);
            channel.endRecordingSession(clock.instant());
            channel.setStatus(ChannelStatus.RECORDING_ERROR);
            registry.requestPersist();
            return false;
        }

        activeRecorders.put(channel.getId(), handle);
        channel.setStatus(ChannelStatus.RECORDING);
        handle.completion().whenComplete((ignored, error) -> onRecorderFinished(channel, handle, error));
        return true;
    }

    /**
     * Stops the channel's recording session.
     *
     * <p>Asks the active recorder to stop, or sets the channel's force-stop flag when no recorder is registered.
     * The elapsed time is folded into the channel's durations, the channel is marked offline and a save is
     * requested. With no session open the channel is only marked offline, and not even that while a check owns
     * it: the checking thread is the writer of the live flag until it finishes.
     *
     * @param manuallyStopped true when the user asked for the stop
     * @return true if a session was open
     */
    public boolean stopRecording(ChannelState channel, boolean manuallyStopped) {
        Duration duration;
        synchronized (channel) {
            if (!channel.isRecording()) {
                if (!channel.isChecking()) {
                    channel.setLive(false);
                }
                return false;
            }
            channel.setStoppingInProgress(true);
            channel.setDetectionTime(null);

            RecorderHandle handle = activeRecorders.get(channel.getId());
            if (handle != null) {
                handle.requestStop().whenComplete((ignored, error) -> {
                    channel.setStoppingInProgress(false);
                    LOG.debug("Recorder for {} acknowledged stop", channel.getId());
                });
                LOG.info("Requested stop for recorder: {}", channel.getId());
            } else {
                LOG.warn("No active recorder found for {}; setting force stop", channel.getId());
                channel.setForceStop(true);
                channel.setStoppingInProgress(false);
            }

            Instant now = clock.instant();
            channel.endRecordingSession(now);
            channel.setLive(false);
            channel.setManuallyStopped(manuallyStopped);
            channel.setStatus(ChannelStatus.NOT_RECORDING);
            duration = channel.getLastDuration();
        }
        LOG.info("Stopped recording for {} after {}s", channel.getConfig().displayName(), duration.toSeconds());
        registry.requestPersist();
        publisher.publishEvent(new RecordingEndedEvent(channel.getId(), manuallyStopped, duration, clock.instant()));
        return true;
    }

    /** Cumulative plus running time while recording, otherwise the last session's duration. */
    public Duration durationOf(ChannelState channel) {
        return channel.durationAt(clock.instant());
    }

    void onRecorderFinished(ChannelState channel, RecorderHandle handle, Throwable error) {
        if (!activeRecorders.remove(channel.getId(), handle)) {
            return;
        }
        channel.setStoppingInProgress(false);
        if (error != null) {
            LOG.warn("Recorder for {} exited with error: {}", channel.getId(), error.getMessage());
        }
        Duration duration;
        synchronized (channel) {
            if (!channel.isRecording()) {
                return;
            }
            channel.endRecordingSession(clock.instant());
            channel.setLive(false);
            channel.setManuallyStopped(false);
            channel.setDetectionTime(null);
            channel.setStatus(ChannelStatus.NOT_RECORDING);
            duration = channel.getLastDuration();
        }
        LOG.info("Recorder for {} finished on its own after {}s", channel.getId(), duration.toSeconds());
        registry.requestPersist();
        publisher.publishEvent(new RecordingEndedEvent(channel.getId(), false, duration, clock.instant()));
    }
}
