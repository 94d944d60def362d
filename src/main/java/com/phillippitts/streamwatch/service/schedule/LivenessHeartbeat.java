package com.phillippitts.streamwatch.service.schedule;

import com.phillippitts.streamwatch.config.properties.SchedulerProperties;
import com.phillippitts.streamwatch.service.disk.RecordingGate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.SmartLifecycle;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Drives the dispatch cycle at a fixed heartbeat. Each beat re-checks disk space and then runs one
 * {@link LivenessDispatcher#runCycle()}. With {@code check-on-startup} the first beat runs immediately.
 */
public class LivenessHeartbeat implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(LivenessHeartbeat.class);

    private final LivenessDispatcher dispatcher;
    private final RecordingGate recordingGate;
    private final SchedulerProperties properties;
    private final Clock clock;
    private ScheduledExecutorService scheduler;
    private volatile boolean running;
    private volatile Instant lastBeat;

    public LivenessHeartbeat(LivenessDispatcher dispatcher, RecordingGate recordingGate,
                             SchedulerProperties properties, Clock clock) {
        this.dispatcher = dispatcher;
        this.recordingGate = recordingGate;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        if (!properties.isEnabled()) {
            LOG.info("Liveness scheduler disabled (streamwatch.scheduler.enabled=false)");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "liveness-heartbeat");
            t.setDaemon(true);
            return t;
        });
        long period = properties.getHeartbeatSeconds();
        long initialDelay = properties.isCheckOnStartup() ? 0 : period;
        scheduler.scheduleWithFixedDelay(this::beat, initialDelay, period, TimeUnit.SECONDS);
        running = true;
        LOG.info("Initializing periodic live check task with interval: {}s", period);
    }

    @Override
    public synchronized void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return DEFAULT_PHASE - 1;
    }

    /** Runs one beat. Failures are logged so that the schedule keeps running. */
    public void beat() {
        try {
            recordingGate.refresh();
            dispatcher.runCycle();
            lastBeat = clock.instant();
        } catch (RuntimeException e) {
            LOG.error("Dispatch cycle failed", e);
        }
    }

    public Instant getLastBeat() {
        return lastBeat;
    }
}
