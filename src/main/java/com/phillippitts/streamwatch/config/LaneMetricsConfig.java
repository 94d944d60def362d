package com.phillippitts.streamwatch.config;

import com.phillippitts.streamwatch.service.schedule.LaneQueues;
import com.phillippitts.streamwatch.service.schedule.LaneWorkerPool;
import com.phillippitts.streamwatch.service.schedule.PriorityLane;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.Locale;

/**
 * Exposes lane queue depth and worker liveness via Micrometer:
 * <ul>
 *   <li>streamwatch.lane.queued{lane=fast|medium|slow} - channels waiting in each lane</li>
 *   <li>streamwatch.lane.workers.alive - lane workers whose loop is running</li>
 * </ul>
 *
 * <p>Also logs a queue summary every 5 minutes.
 */
@Configuration
public class LaneMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(LaneMetricsConfig.class);

    private final ObjectProvider<LaneQueues> queuesProvider;
    private final ObjectProvider<LaneWorkerPool> workerPoolProvider;

    public LaneMetricsConfig(ObjectProvider<LaneQueues> queuesProvider,
                             ObjectProvider<LaneWorkerPool> workerPoolProvider) {
        this.queuesProvider = queuesProvider;
        this.workerPoolProvider = workerPoolProvider;
    }

    @Bean
    public MeterBinder laneQueueMetrics() {
        return registry -> {
            LaneQueues queues = queuesProvider.getObject();
            for (PriorityLane lane : PriorityLane.values()) {
                Gauge.builder("streamwatch.lane.queued", queues, q -> q.size(lane))
                        .description("Channels waiting in the lane queue")
                        .tag("lane", lane.name().toLowerCase(Locale.ROOT))
                        .register(registry);
            }
            LaneWorkerPool pool = workerPoolProvider.getObject();
            Gauge.builder("streamwatch.lane.workers.alive", pool, LaneWorkerPool::aliveWorkers)
                    .description("Lane workers whose loop is running")
                    .register(registry);
            LOG.info("Lane metrics registered: streamwatch.lane.* available via /actuator/metrics");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logLaneHealth() {
        LaneQueues queues = queuesProvider.getObject();
        LaneWorkerPool pool = workerPoolProvider.getObject();
        LOG.info("Lane health: queued fast={}, medium={}, slow={}, workers alive={}/{}",
                queues.size(PriorityLane.FAST),
                queues.size(PriorityLane.MEDIUM),
                queues.size(PriorityLane.SLOW),
                pool.aliveWorkers(),
                pool.expectedWorkers());
    }
}
