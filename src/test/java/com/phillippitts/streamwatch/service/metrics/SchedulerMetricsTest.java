package com.phillippitts.streamwatch.service.metrics;

import com.phillippitts.streamwatch.service.probe.ProbeOutcome;
import com.phillippitts.streamwatch.service.schedule.PriorityLane;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class SchedulerMetricsTest {

    private MeterRegistry registry;
    private SchedulerMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new SchedulerMetrics(registry);
    }

    @Test
    void shouldCountDispatchesPerLane() {
        metrics.recordDispatch(PriorityLane.FAST);
        metrics.recordDispatch(PriorityLane.FAST);
        metrics.recordDispatch(PriorityLane.SLOW);

        Counter fast = registry.find("streamwatch.dispatch").tag("lane", "fast").counter();
        Counter slow = registry.find("streamwatch.dispatch").tag("lane", "slow").counter();
        assertThat(fast).isNotNull();
        assertThat(fast.count()).isEqualTo(2.0);
        assertThat(slow.count()).isEqualTo(1.0);
        assertThat(registry.find("streamwatch.dispatch").tag("lane", "medium").counter()).isNull();
    }

    @Test
    void shouldCountBusySkips() {
        metrics.recordBusy(PriorityLane.MEDIUM);

        Counter busy = registry.find("streamwatch.dispatch.busy").tag("lane", "medium").counter();
        assertThat(busy).isNotNull();
        assertThat(busy.count()).isEqualTo(1.0);
    }

    @Test
    void shouldRecordProbeLatencyPerOutcome() {
        long durationNanos = TimeUnit.MILLISECONDS.toNanos(250);

        metrics.recordProbe(ProbeOutcome.OFFLINE, durationNanos);

        Timer timer = registry.find("streamwatch.probe").tag("outcome", ProbeOutcome.OFFLINE.tag()).timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.NANOSECONDS)).isEqualTo(durationNanos);
    }
}
