package com.phillippitts.streamwatch.service.probe;

import com.phillippitts.streamwatch.config.properties.ProbeProperties;
import com.phillippitts.streamwatch.config.properties.SchedulerProperties;
import com.phillippitts.streamwatch.domain.ChannelConfig;
import com.phillippitts.streamwatch.domain.ChannelState;
import com.phillippitts.streamwatch.domain.ChannelStatus;
import com.phillippitts.streamwatch.domain.ScheduleWindow;
import com.phillippitts.streamwatch.exception.ResolutionException;
import com.phillippitts.streamwatch.service.disk.RecordingGate;
import com.phillippitts.streamwatch.service.metrics.SchedulerMetrics;
import com.phillippitts.streamwatch.service.notify.LiveNotificationService;
import com.phillippitts.streamwatch.service.probe.event.ChannelUpdatedEvent;
import com.phillippitts.streamwatch.service.probe.event.ProbeFailedEvent;
import com.phillippitts.streamwatch.service.recording.RecordingSessionManager;
import com.phillippitts.streamwatch.service.registry.ChannelRegistry;
import com.phillippitts.streamwatch.service.resolver.StreamInfo;
import com.phillippitts.streamwatch.service.resolver.StreamResolver;
import com.phillippitts.streamwatch.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalTime;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Performs one liveness check for a channel and applies its side effects.
 *
 * <p>Flow of {@link #probe(ChannelState)}:
 * <ol>
 *   <li>skip if the channel is recording, its recorder is still running, or monitoring is off; monitoring is
 *       checked again after the resolver returns and right before a recording starts</li>
 *   <li>skip without a network call when a schedule is configured and now is outside every window</li>
 *   <li>acquire the platform permit, sleep a random jitter, call the resolver, release the permit</li>
 *   <li>on failure or an incomplete result mark {@link ChannelStatus#CHECK_ERROR} and stop</li>
 *   <li>fold the observation into the channel's learned statistics</li>
 *   <li>live: notify on a new transition, then record (or just broadcast for notify-only channels, or wait when
 *       disk space is low)</li>
 *   <li>offline after live: send the stream-end push</li>
 * </ol>
 * The in-flight flag is always cleared and a {@link ChannelUpdatedEvent} published, whichever branch ran.
 *
 * <p>Retries are not attempted inside a probe; {@link #checkWithRetry(ChannelState)} is the outer retry policy
 * for streams that may have dropped briefly.
 */
public class LivenessProber {

    private static final Logger LOG = LogManager.getLogger(LivenessProber.class);

    private final StreamResolver resolver;
    private final PlatformPermits permits;
    private final RecordingSessionManager sessions;
    private final LiveNotificationService notifications;
    private final RecordingGate recordingGate;
    private final ChannelRegistry registry;
    private final ApplicationEventPublisher publisher;
    private final SchedulerMetrics metrics;
    private final SchedulerProperties schedulerProperties;
    private final ProbeProperties probeProperties;
    private final Clock clock;
    private final Sleeper sleeper;

    public LivenessProber(StreamResolver resolver,
                          PlatformPermits permits,
                          RecordingSessionManager sessions,
                          LiveNotificationService notifications,
                          RecordingGate recordingGate,
                          ChannelRegistry registry,
                          ApplicationEventPublisher publisher,
                          SchedulerMetrics metrics,
                          SchedulerProperties schedulerProperties,
                          ProbeProperties probeProperties,
                          Clock clock,
                          Sleeper sleeper) {
        this.resolver = resolver;
        this.permits = permits;
        this.sessions = sessions;
        this.notifications = notifications;
        this.recordingGate = recordingGate;
        this.registry = registry;
        this.publisher = publisher;
        this.metrics = metrics;
        this.schedulerProperties = schedulerProperties;
        this.probeProperties = probeProperties;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Claims the channel and probes it.
     *
     * @return {@link ProbeOutcome#BUSY} if another probe already owns the channel
     */
    public ProbeOutcome checkNow(ChannelState channel) {
        if (!channel.tryBeginCheck()) {
            LOG.debug("Skip check for {}: probe already in flight", channel.getId());
            return ProbeOutcome.BUSY;
        }
        return probe(channel);
    }

    /**
     * Probes a channel that the caller has already claimed with {@link ChannelState#tryBeginCheck()}. The claim is
     * released before returning.
     */
    public ProbeOutcome probe(ChannelState channel) {
        long startNanos = System.nanoTime();
        ThreadContext.put("channelId", channel.getId());
        ProbeOutcome outcome = ProbeOutcome.ERROR;
        try {
            outcome = runProbe(channel);
            return outcome;
        } catch (RuntimeException e) {
            LOG.error("Unexpected error while checking {}", LogSanitizer.url(channel.getUrl()), e);
            channel.setStatus(ChannelStatus.CHECK_ERROR);
            publisher.publishEvent(new ProbeFailedEvent(channel.getId(), channel.getPlatformKey(),
                    e.getClass().getSimpleName(), clock.instant()));
            return ProbeOutcome.ERROR;
        } finally {
            channel.clearChecking();
            metrics.recordProbe(outcome, System.nanoTime() - startNanos);
            publisher.publishEvent(new ChannelUpdatedEvent(channel.getId(), channel.getStatus(), channel.isLive(),
                    channel.isRecording(), clock.instant()));
            ThreadContext.remove("channelId");
            ThreadContext.remove("platform");
        }
    }

    /**
     * Re-checks a channel whose stream may have dropped briefly.
     *
     * <p>Probes up to {@code retry-attempts} times with {@code retry-delay-seconds} between attempts, stopping as
     * soon as the channel is recording again or monitoring is turned off.
     *
     * @return outcome of the last attempt, or {@code null} if no attempt was made
     */
    public ProbeOutcome checkWithRetry(ChannelState channel) {
        int attempts = probeProperties.getRetryAttempts();
        ProbeOutcome last = null;
        for (int i = 0; i < attempts; i++) {
            if (channel.isRecording() || !channel.isMonitoringEnabled()) {
                break;
            }
            LOG.info("Performing extra live check ({}/{}) for: {}", i + 1, attempts,
                    LogSanitizer.url(channel.getUrl()));
            last = checkNow(channel);
            if (channel.isRecording()) {
                LOG.info("Stream resumed and recording started for: {}", LogSanitizer.url(channel.getUrl()));
                break;
            }
            if (i < attempts - 1) {
                try {
                    sleeper.sleep(Duration.ofSeconds(probeProperties.getRetryDelaySeconds()));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    LOG.debug("Retry loop for {} interrupted", channel.getId());
                    break;
                }
            }
        }
        return last;
    }

    private ProbeOutcome runProbe(ChannelState channel) {
        channel.setManuallyStopped(false);
        if (channel.isRecording()) {
            LOG.debug("Skip check because recording is busy: {}", LogSanitizer.url(channel.getUrl()));
            return ProbeOutcome.SKIPPED_RECORDING;
        }
        if (sessions.hasBlockingRecorder(channel.getId())) {
            LOG.debug("Skip check because recorder is active: {}", LogSanitizer.url(channel.getUrl()));
            return ProbeOutcome.SKIPPED_RECORDER_ACTIVE;
        }
        if (!channel.isMonitoringEnabled()) {
            return monitoringStopped(channel);
        }

        channel.setDetectionTime(clock.instant());
        channel.setStatus(ChannelStatus.CHECKING);

        ChannelConfig config = channel.getConfig();
        if (config.scheduledRecording() && !inSchedule(config)) {
            channel.setStatus(ChannelStatus.NOT_IN_SCHEDULE);
            channel.setLive(false);
            LOG.info("Skip detection: {} not in scheduled check range {}",
                    LogSanitizer.url(channel.getUrl()), config.scheduleWindows());
            return ProbeOutcome.OUT_OF_WINDOW;
        }

        String platformKey = ensurePlatformKey(channel);
        ThreadContext.put("platform", platformKey);

        StreamInfo info;
        try {
            info = resolveWithPermit(channel.getUrl(), platformKey);
        } catch (ResolutionException e) {
            return failed(channel, platformKey, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failed(channel, platformKey, "interrupted during probe jitter");
        }
        if (info == null || !info.isComplete()) {
            String reason = info == null ? "no result" : (info.error() != null ? info.error() : "incomplete result");
            return failed(channel, platformKey, reason);
        }
        LOG.info("Stream data: {} live={}", info.anchorName(), info.live());
        if (!channel.isMonitoringEnabled()) {
            return monitoringStopped(channel);
        }

        channel.recordObservation(info.live(), schedulerProperties.getEmaAlphaActive(),
                schedulerProperties.getEmaAlphaOffline(), clock);

        return info.live() ? onLive(channel, info) : onOffline(channel);
    }

    private ProbeOutcome onLive(ChannelState channel, StreamInfo info) {
        channel.setLiveTitle(info.title());
        if (channel.adoptAnchorName(info.anchorName())) {
            registry.requestPersist();
        }

        boolean wentLive;
        synchronized (channel) {
            wentLive = !channel.isLive();
            if (wentLive) {
                channel.setLive(true);
                channel.markLiveTransition();
            }
        }
        if (wentLive) {
            LOG.info("Channel {} went live", channel.getConfig().displayName());
            notifications.notifyLiveStart(channel);
        }
        notifications.pushLiveStart(channel);

        long baseInterval = schedulerProperties.getLoopTimeSeconds();
        if (channel.getConfig().notifyOnly()) {
            channel.setLoopIntervalSeconds(channel.isNotifiedLiveStart()
                    ? schedulerProperties.getNotifyLoopTimeSeconds()
                    : baseInterval);
            channel.setStatus(ChannelStatus.LIVE_BROADCASTING);
            return ProbeOutcome.LIVE_NOTIFY_ONLY;
        }

        if (!recordingGate.isOpen()) {
            channel.setStatus(ChannelStatus.NO_DISK_SPACE);
            LOG.warn("Channel {} is live but recording is suspended: low disk space", channel.getId());
            return ProbeOutcome.LIVE_NO_DISK_SPACE;
        }

        if (!channel.isMonitoringEnabled()) {
            return monitoringStopped(channel);
        }
        channel.setStatus(ChannelStatus.PREPARING_RECORDING);
        channel.setLoopIntervalSeconds(baseInterval);
        if (sessions.startSession(channel, info)) {
            return ProbeOutcome.LIVE_RECORDING;
        }
        // monitoring may have been stopped between the check above and the session start
        return channel.isMonitoringEnabled() ? ProbeOutcome.LIVE_RECORDING_FAILED : monitoringStopped(channel);
    }

    private ProbeOutcome monitoringStopped(ChannelState channel) {
        LOG.debug("Monitoring stopped for {}; check abandoned", channel.getId());
        channel.setStatus(ChannelStatus.STOPPED_MONITORING);
        return ProbeOutcome.SKIPPED_NOT_MONITORED;
    }

    private ProbeOutcome onOffline(ChannelState channel) {
        if (channel.isLive()) {
            channel.setLive(false);
            LOG.info("Channel {} went offline", channel.getConfig().displayName());
            notifications.pushLiveEnd(channel);
        }
        channel.setStatus(ChannelStatus.MONITORING);
        return ProbeOutcome.OFFLINE;
    }

    private StreamInfo resolveWithPermit(String url, String platformKey) throws InterruptedException {
        permits.acquire(platformKey);
        try {
            sleeper.sleep(jitter());
            return resolver.resolve(url, platformKey);
        } catch (ResolutionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ResolutionException("Resolver failed: " + e.getMessage(), platformKey, e);
        } finally {
            permits.release(platformKey);
        }
    }

    private ProbeOutcome failed(ChannelState channel, String platformKey, String reason) {
        LOG.error("Fetch stream data failed: {} ({})", LogSanitizer.url(channel.getUrl()), reason);
        channel.setStatus(ChannelStatus.CHECK_ERROR);
        publisher.publishEvent(new ProbeFailedEvent(channel.getId(), platformKey, reason, clock.instant()));
        return ProbeOutcome.ERROR;
    }

    private String ensurePlatformKey(ChannelState channel) {
        String key = channel.getPlatformKey();
        if (key == null || key.isBlank()) {
            key = PlatformKeys.fromUrl(channel.getUrl());
            channel.setPlatformKey(key);
            registry.requestPersist();
        }
        return key;
    }

    private boolean inSchedule(ChannelConfig config) {
        LocalTime now = LocalTime.now(clock);
        for (ScheduleWindow window : config.scheduleWindows()) {
            if (window.contains(now)) {
                return true;
            }
        }
        return false;
    }

    private Duration jitter() {
        long min = probeProperties.getJitterMinMs();
        long max = probeProperties.getJitterMaxMs();
        long millis = max > min ? ThreadLocalRandom.current().nextLong(min, max + 1) : min;
        return Duration.ofMillis(millis);
    }
}
