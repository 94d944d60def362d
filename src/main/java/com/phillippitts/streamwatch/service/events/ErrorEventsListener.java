package com.phillippitts.streamwatch.service.events;

import com.phillippitts.streamwatch.service.disk.event.DiskSpaceLowEvent;
import com.phillippitts.streamwatch.service.disk.event.DiskSpaceRecoveredEvent;
import com.phillippitts.streamwatch.service.probe.event.ProbeFailedEvent;
import com.phillippitts.streamwatch.service.registry.event.PersistenceFailedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for operator-facing failure events. Throttled per key to avoid log spam when a platform
 * or the disk stays unhealthy for a while.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final Clock clock;

    ErrorEventsListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    void onProbeFailed(ProbeFailedEvent e) {
        String key = "probe-" + e.platformKey();
        if (shouldLog(key)) {
            LOG.warn("Liveness checks failing for platform {} (latest channel {}): {}",
                    e.platformKey(), e.channelId(), e.reason());
        }
    }

    @EventListener
    void onDiskSpaceLow(DiskSpaceLowEvent e) {
        if (shouldLog("disk-" + e.outputDir())) {
            LOG.warn("Free space under {} is below {} GB. New recordings are suspended until space is freed.",
                    e.outputDir(), e.thresholdGb());
        }
    }

    @EventListener
    void onDiskSpaceRecovered(DiskSpaceRecoveredEvent e) {
        lastLog.remove("disk-" + e.outputDir());
    }

    @EventListener
    void onPersistenceFailed(PersistenceFailedEvent e) {
        if (shouldLog("persist-" + e.path())) {
            LOG.warn("Channel store {} not writable: {}. Changes are kept in memory and retried.",
                    e.path(), e.reason());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
