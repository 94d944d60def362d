package com.phillippitts.streamwatch.service.health;

import com.phillippitts.streamwatch.config.properties.SchedulerProperties;
import com.phillippitts.streamwatch.service.disk.RecordingGate;
import com.phillippitts.streamwatch.service.registry.ChannelRegistry;
import com.phillippitts.streamwatch.service.schedule.LaneWorkerPool;
import com.phillippitts.streamwatch.service.schedule.LivenessHeartbeat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SchedulerHealthIndicatorTest {

    private LaneWorkerPool pool;
    private LivenessHeartbeat heartbeat;
    private RecordingGate gate;
    private ChannelRegistry registry;
    private SchedulerHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        pool = mock(LaneWorkerPool.class);
        heartbeat = mock(LivenessHeartbeat.class);
        gate = mock(RecordingGate.class);
        registry = mock(ChannelRegistry.class);
        indicator = new SchedulerHealthIndicator(pool, heartbeat, gate, registry, new SchedulerProperties());

        when(pool.isRunning()).thenReturn(true);
        when(pool.aliveWorkers()).thenReturn(4);
        when(pool.expectedWorkers()).thenReturn(4);
        when(gate.isOpen()).thenReturn(true);
        when(registry.isLastSaveFailed()).thenReturn(false);
        when(registry.size()).thenReturn(3);
        when(heartbeat.getLastBeat()).thenReturn(Instant.parse("2024-01-02T20:15:00Z"));
    }

    @Test
    void shouldReportUpWhenAllWorkersRunning() {
        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("status", "Scheduler operational")
                .containsEntry("workers", "4/4")
                .containsEntry("channels", 3)
                .containsEntry("recording", "allowed")
                .containsEntry("lastBeat", "2024-01-02T20:15:00Z");
    }

    @Test
    void shouldReportDownWhenAWorkerDied() {
        when(pool.aliveWorkers()).thenReturn(3);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("workers", "3/4");
    }

    @Test
    void shouldIgnoreWorkerCountBeforePoolStarts() {
        when(pool.isRunning()).thenReturn(false);
        when(pool.aliveWorkers()).thenReturn(0);

        assertThat(indicator.health().getStatus()).isEqualTo(Status.UP);
    }

    @Test
    void shouldReportDegradedWhenDiskSpaceLow() {
        when(gate.isOpen()).thenReturn(false);

        Health health = indicator.health();

        assertThat(health.getStatus().getCode()).isEqualTo("DEGRADED");
        assertThat(health.getDetails())
                .containsEntry("status", "Recording suspended: low disk space")
                .containsEntry("recording", "suspended");
    }

    @Test
    void shouldReportDegradedWhenStoreNotWritable() {
        when(registry.isLastSaveFailed()).thenReturn(true);

        Health health = indicator.health();

        assertThat(health.getStatus().getCode()).isEqualTo("DEGRADED");
        assertThat(health.getDetails()).containsEntry("status", "Channel store not writable");
    }
}
