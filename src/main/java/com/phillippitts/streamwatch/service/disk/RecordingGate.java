package com.phillippitts.streamwatch.service.disk;

import com.phillippitts.streamwatch.service.disk.event.DiskSpaceLowEvent;
import com.phillippitts.streamwatch.service.disk.event.DiskSpaceRecoveredEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Global switch that suspends new recording sessions while disk space is low.
 *
 * <p>{@link #refresh()} is called before every dispatch cycle. Liveness checks keep running while the gate is
 * closed; only session starts are refused. Sessions already running may finish.
 */
public class RecordingGate {

    private static final Logger LOG = LogManager.getLogger(RecordingGate.class);

    private final DiskSpaceGuard guard;
    private final String outputDir;
    private final double thresholdGb;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;
    private final AtomicBoolean open = new AtomicBoolean(true);

    public RecordingGate(DiskSpaceGuard guard, String outputDir, double thresholdGb,
                         ApplicationEventPublisher publisher, Clock clock) {
        this.guard = guard;
        this.outputDir = outputDir;
        this.thresholdGb = thresholdGb;
        this.publisher = publisher;
        this.clock = clock;
    }

    /**
     * Re-evaluates free space and publishes an event on every open/closed transition.
     *
     * @return true if recording may start
     */
    public boolean refresh() {
        boolean low = thresholdGb > 0 && guard.freeSpaceBelow(thresholdGb, outputDir);
        boolean wasOpen = open.getAndSet(!low);
        if (low && wasOpen) {
            LOG.error("Disk space remaining under {} is below {} GB. Recording disabled", outputDir, thresholdGb);
            publisher.publishEvent(new DiskSpaceLowEvent(outputDir, thresholdGb, clock.instant()));
        } else if (!low && !wasOpen) {
            LOG.info("Disk space under {} recovered. Recording enabled", outputDir);
            publisher.publishEvent(new DiskSpaceRecoveredEvent(outputDir, clock.instant()));
        }
        return !low;
    }

    public boolean isOpen() {
        return open.get();
    }

    public String getOutputDir() {
        return outputDir;
    }
}
