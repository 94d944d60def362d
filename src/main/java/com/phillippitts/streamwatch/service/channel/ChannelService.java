package com.phillippitts.streamwatch.service.channel;

import com.phillippitts.streamwatch.config.properties.SchedulerProperties;
import com.phillippitts.streamwatch.domain.ChannelConfig;
import com.phillippitts.streamwatch.domain.ChannelPatch;
import com.phillippitts.streamwatch.domain.ChannelState;
import com.phillippitts.streamwatch.domain.ChannelStatus;
import com.phillippitts.streamwatch.exception.ChannelNotFoundException;
import com.phillippitts.streamwatch.service.predict.LivenessPredictor;
import com.phillippitts.streamwatch.service.probe.LivenessProber;
import com.phillippitts.streamwatch.service.recording.RecordingSessionManager;
import com.phillippitts.streamwatch.service.registry.ChannelRegistry;
import com.phillippitts.streamwatch.util.LogSanitizer;
import com.phillippitts.streamwatch.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * User-facing channel commands: add, remove, patch and start/stop monitoring.
 *
 * <p>Batch commands apply every change first and persist once. Starting monitoring triggers an immediate
 * probe on the event executor instead of waiting for the next dispatch cycle.
 */
public class ChannelService {

    private static final Logger LOG = LogManager.getLogger(ChannelService.class);

    private final ChannelRegistry registry;
    private final LivenessProber prober;
    private final RecordingSessionManager sessions;
    private final LivenessPredictor predictor;
    private final SchedulerProperties schedulerProperties;
    private final Executor executor;
    private final Clock clock;

    public ChannelService(ChannelRegistry registry,
                          LivenessProber prober,
                          RecordingSessionManager sessions,
                          LivenessPredictor predictor,
                          SchedulerProperties schedulerProperties,
                          Executor executor,
                          Clock clock) {
        this.registry = registry;
        this.prober = prober;
        this.sessions = sessions;
        this.predictor = predictor;
        this.schedulerProperties = schedulerProperties;
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * Registers a new monitored channel.
     *
     * @param patch optional configuration overrides applied on top of the defaults
     * @throws IllegalArgumentException if the url is blank or already registered
     */
    public ChannelState addChannel(String url, String displayName, ChannelPatch patch) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must not be blank");
        }
        String trimmed = url.trim();
        ChannelConfig config = ChannelConfig.defaults(displayName);
        if (patch != null) {
            config = patch.applyTo(config);
        }
        ChannelState channel = new ChannelState(UUID.randomUUID().toString(), trimmed, config, clock.instant());
        channel.setLoopIntervalSeconds(schedulerProperties.getLoopTimeSeconds());
        // url uniqueness is enforced by the registry under its mutation lock
        registry.add(channel);
        LOG.info("Added channel {} ({})", channel.getId(), LogSanitizer.url(trimmed));
        return channel;
    }

    /**
     * Removes channels by id, stopping any recording first. Unknown ids are ignored.
     *
     * @return number of channels removed
     */
    public int removeChannels(Collection<String> ids) {
        int removed = 0;
        for (String id : ids) {
            ChannelState channel = registry.findById(id).orElse(null);
            if (channel == null) {
                continue;
            }
            if (channel.isRecording()) {
                sessions.stopRecording(channel, true);
            }
            if (registry.remove(channel)) {
                removed++;
            }
        }
        return removed;
    }

    /**
     * Turns monitoring on, resets the live flag and queues an immediate probe.
     *
     * @throws ChannelNotFoundException if the id is not registered
     */
    public ChannelState startMonitoring(String id) {
        ChannelState channel = require(id);
        enableMonitoring(channel);
        registry.requestPersist();
        triggerCheck(channel);
        return channel;
    }

    /**
     * Turns monitoring off and stops any recording session as a manual stop.
     *
     * @throws ChannelNotFoundException if the id is not registered
     */
    public ChannelState stopMonitoring(String id) {
        ChannelState channel = require(id);
        disableMonitoring(channel);
        registry.requestPersist();
        return channel;
    }

    /** Starts monitoring for the given ids; unknown ids are skipped. Returns the channels affected. */
    public List<ChannelState> startMonitoring(Collection<String> ids) {
        List<ChannelState> started = new ArrayList<>();
        for (String id : ids) {
            registry.findById(id).ifPresent(channel -> {
                enableMonitoring(channel);
                started.add(channel);
            });
        }
        registry.requestPersist();
        started.forEach(this::triggerCheck);
        return started;
    }

    /** Stops monitoring for the given ids; unknown ids are skipped. Returns the channels affected. */
    public List<ChannelState> stopMonitoring(Collection<String> ids) {
        List<ChannelState> stopped = new ArrayList<>();
        for (String id : ids) {
            registry.findById(id).ifPresent(channel -> {
                disableMonitoring(channel);
                stopped.add(channel);
            });
        }
        registry.requestPersist();
        return stopped;
    }

    public List<ChannelState> startAll() {
        return startMonitoring(ids(registry.all()));
    }

    public List<ChannelState> stopAll() {
        return stopMonitoring(ids(registry.all()));
    }

    /**
     * Applies a configuration patch.
     *
     * @throws ChannelNotFoundException if the id is not registered
     */
    public ChannelState updateChannel(String id, ChannelPatch patch) {
        ChannelState channel = require(id);
        if (patch.isEmpty()) {
            return channel;
        }
        channel.setConfig(patch.applyTo(channel.getConfig()));
        LOG.info("Updated configuration of channel {}", id);
        registry.requestPersist();
        return channel;
    }

    /**
     * Stops the channel's recording session as a manual stop. Monitoring stays on.
     *
     * @return true if a session was open
     */
    public boolean stopRecording(String id) {
        return sessions.stopRecording(require(id), true);
    }

    public List<ChannelView> views() {
        return registry.all().stream().map(this::view).toList();
    }

    public ChannelView view(String id) {
        return view(require(id));
    }

    ChannelView view(ChannelState channel) {
        ChannelConfig config = channel.getConfig();
        return new ChannelView(
                channel.getId(),
                channel.getUrl(),
                channel.getPlatformKey(),
                config.displayName(),
                channel.getStatus(),
                config.monitoringEnabled(),
                channel.isLive(),
                channel.isRecording(),
                config.notifyOnly(),
                channel.getLiveTitle(),
                channel.getPriorityScore(),
                channel.getConsistencyScore(),
                predictor.likelihood(channel),
                predictor.adjustedInterval(channel, schedulerProperties.getLoopTimeSeconds()),
                channel.getLastSeenLiveAt(),
                TimeUtils.formatDuration(sessions.durationOf(channel)));
    }

    private void enableMonitoring(ChannelState channel) {
        synchronized (channel) {
            channel.setConfig(channel.getConfig().withMonitoringEnabled(true));
            channel.setManuallyStopped(false);
            // An in-flight check owns the live flag until it finishes.
            if (!channel.isRecording() && !channel.isChecking()) {
                channel.setLive(false);
                channel.setStatus(ChannelStatus.CHECKING);
            }
        }
        LOG.info("Monitoring started for {}", channel.getId());
    }

    private void disableMonitoring(ChannelState channel) {
        synchronized (channel) {
            channel.setConfig(channel.getConfig().withMonitoringEnabled(false));
            if (channel.isRecording()) {
                sessions.stopRecording(channel, true);
            }
            channel.setStatus(ChannelStatus.STOPPED_MONITORING);
        }
        LOG.info("Monitoring stopped for {}", channel.getId());
    }

    private void triggerCheck(ChannelState channel) {
        try {
            executor.execute(() -> prober.checkNow(channel));
        } catch (RejectedExecutionException e) {
            LOG.warn("Immediate check for {} rejected; next dispatch cycle will pick it up", channel.getId());
        }
    }

    private ChannelState require(String id) {
        return registry.findById(id).orElseThrow(() -> new ChannelNotFoundException(id));
    }

    private static List<String> ids(List<ChannelState> channels) {
        return channels.stream().map(ChannelState::getId).toList();
    }
}
