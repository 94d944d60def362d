package com.phillippitts.streamwatch.service.metrics;

import com.phillippitts.streamwatch.service.probe.ProbeOutcome;
import com.phillippitts.streamwatch.service.schedule.PriorityLane;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the liveness scheduler.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>channels dispatched per lane</li>
 *   <li>due channels skipped because a probe was still in flight</li>
 *   <li>probe latency per outcome</li>
 * </ul>
 */
public class SchedulerMetrics {

    private static final String METRIC_PREFIX = "streamwatch";

    private final MeterRegistry registry;

    public SchedulerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDispatch(PriorityLane lane) {
        Counter.builder(METRIC_PREFIX + ".dispatch")
                .description("Channels dispatched to a probe lane")
                .tag("lane", lane.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void recordBusy(PriorityLane lane) {
        Counter.builder(METRIC_PREFIX + ".dispatch.busy")
                .description("Due channels skipped because a probe was still in flight")
                .tag("lane", lane.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    /**
     * @param outcome       how the probe ended
     * @param durationNanos time spent in the probe
     */
    public void recordProbe(ProbeOutcome outcome, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".probe")
                .description("Time taken by a liveness probe")
                .tag("outcome", outcome.tag())
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }
}
