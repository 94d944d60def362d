package com.phillippitts.streamwatch.service.health;

import com.phillippitts.streamwatch.config.properties.SchedulerProperties;
import com.phillippitts.streamwatch.service.disk.RecordingGate;
import com.phillippitts.streamwatch.service.registry.ChannelRegistry;
import com.phillippitts.streamwatch.service.schedule.LaneWorkerPool;
import com.phillippitts.streamwatch.service.schedule.LivenessHeartbeat;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the liveness scheduler.
 *
 * <ul>
 *   <li>UP: all lane workers running, recording allowed, last save succeeded</li>
 *   <li>DEGRADED: recording suspended by low disk space, or the channel store is not writable</li>
 *   <li>DOWN: a lane worker has died, so its lane is no longer drained</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class SchedulerHealthIndicator implements HealthIndicator {

    private final LaneWorkerPool workerPool;
    private final LivenessHeartbeat heartbeat;
    private final RecordingGate recordingGate;
    private final ChannelRegistry registry;
    private final SchedulerProperties schedulerProperties;

    public SchedulerHealthIndicator(LaneWorkerPool workerPool,
                                    LivenessHeartbeat heartbeat,
                                    RecordingGate recordingGate,
                                    ChannelRegistry registry,
                                    SchedulerProperties schedulerProperties) {
        this.workerPool = workerPool;
        this.heartbeat = heartbeat;
        this.recordingGate = recordingGate;
        this.registry = registry;
        this.schedulerProperties = schedulerProperties;
    }

    @Override
    public Health health() {
        int alive = workerPool.aliveWorkers();
        int expected = workerPool.expectedWorkers();
        boolean workersOk = !workerPool.isRunning() || alive >= expected;
        boolean recordingAllowed = recordingGate.isOpen();
        boolean storeWritable = !registry.isLastSaveFailed();

        Health.Builder builder = new Health.Builder();
        if (!workersOk) {
            builder.down().withDetail("status", "Lane worker stopped; its lane is not drained");
        } else if (!recordingAllowed || !storeWritable) {
            builder.status("DEGRADED").withDetail("status",
                    !recordingAllowed ? "Recording suspended: low disk space" : "Channel store not writable");
        } else {
            builder.up().withDetail("status", "Scheduler operational");
        }

        return builder
                .withDetail("scheduler", schedulerProperties.isEnabled() ? "enabled" : "disabled")
                .withDetail("workers", alive + "/" + expected)
                .withDetail("channels", registry.size())
                .withDetail("recording", recordingAllowed ? "allowed" : "suspended")
                .withDetail("lastBeat", String.valueOf(heartbeat.getLastBeat()))
                .build();
    }
}
