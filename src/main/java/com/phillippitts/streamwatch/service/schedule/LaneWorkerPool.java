package com.phillippitts.streamwatch.service.schedule;

import com.phillippitts.streamwatch.service.probe.LivenessProber;
import com.phillippitts.streamwatch.service.registry.ChannelRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.task.AsyncTaskExecutor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed pool of lane workers: {@link PriorityLane#workers()} consumers per lane, each running for the lifetime
 * of the application context.
 */
public class LaneWorkerPool implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(LaneWorkerPool.class);

    private final LaneQueues queues;
    private final LivenessProber prober;
    private final ChannelRegistry registry;
    private final AsyncTaskExecutor executor;
    private final AtomicInteger aliveWorkers = new AtomicInteger();
    private final List<Future<?>> workers = new ArrayList<>();
    private volatile boolean running;

    public LaneWorkerPool(LaneQueues queues, LivenessProber prober, ChannelRegistry registry,
                          AsyncTaskExecutor executor) {
        this.queues = queues;
        this.prober = prober;
        this.registry = registry;
        this.executor = executor;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        for (PriorityLane lane : PriorityLane.values()) {
            for (int i = 1; i <= lane.workers(); i++) {
                String name = lane.name().toLowerCase(Locale.ROOT) + "-" + i;
                LaneWorker worker = new LaneWorker(name, lane, queues, prober, registry);
                workers.add(executor.submit(() -> {
                    aliveWorkers.incrementAndGet();
                    try {
                        worker.run();
                    } finally {
                        aliveWorkers.decrementAndGet();
                    }
                }));
            }
        }
        running = true;
        LOG.info("Started {} lane workers", workers.size());
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        workers.forEach(f -> f.cancel(true));
        workers.clear();
        running = false;
        LOG.info("Lane workers stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return DEFAULT_PHASE - 2;
    }

    /** Workers whose loop is currently running. */
    public int aliveWorkers() {
        return aliveWorkers.get();
    }

    public int expectedWorkers() {
        return PriorityLane.totalWorkers();
    }
}
