package com.phillippitts.streamwatch.service.schedule;

import com.phillippitts.streamwatch.domain.ChannelState;
import com.phillippitts.streamwatch.service.probe.LivenessProber;
import com.phillippitts.streamwatch.service.registry.ChannelRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Long-lived consumer of one lane queue. Runs until interrupted; a failing probe is logged and never ends the
 * loop.
 */
class LaneWorker implements Runnable {

    private static final Logger LOG = LogManager.getLogger(LaneWorker.class);

    private final String name;
    private final PriorityLane lane;
    private final LaneQueues queues;
    private final LivenessProber prober;
    private final ChannelRegistry registry;

    LaneWorker(String name, PriorityLane lane, LaneQueues queues, LivenessProber prober, ChannelRegistry registry) {
        this.name = name;
        this.lane = lane;
        this.queues = queues;
        this.prober = prober;
        this.registry = registry;
    }

    @Override
    public void run() {
        LOG.debug("Worker {} started", name);
        while (!Thread.currentThread().isInterrupted()) {
            ChannelState channel;
            try {
                channel = queues.take(lane);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            processOne(channel);
        }
        LOG.debug("Worker {} stopped", name);
    }

    /**
     * Probes the channel if it is still registered, monitored and not recording. The dispatcher's in-flight claim
     * is released here when no probe runs; otherwise the prober releases it.
     *
     * <p>Nothing short of a {@link VirtualMachineError} escapes, so one bad channel never ends the worker.
     */
    void processOne(ChannelState channel) {
        boolean probed = false;
        try {
            boolean registered = registry.findById(channel.getId()).filter(c -> c == channel).isPresent();
            if (registered && channel.isMonitoringEnabled() && !channel.isRecording()) {
                probed = true;
                prober.probe(channel);
            } else {
                LOG.debug("Worker {} dropped {}: no longer eligible for a probe", name, channel.getId());
            }
        } catch (RuntimeException e) {
            LOG.error("Error in {} queue worker while checking {}", lane, channel.getId(), e);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Error e) {
            // linkage or assertion errors from resolver and recorder plugins; the lane must keep draining
            LOG.error("Error in {} queue worker while checking {}", lane, channel.getId(), e);
        } finally {
            if (!probed) {
                channel.clearChecking();
            }
        }
    }

    String getName() {
        return name;
    }
}
