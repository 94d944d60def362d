package com.phillippitts.streamwatch.service.probe;

import com.phillippitts.streamwatch.service.recording.event.RecordingEndedEvent;
import com.phillippitts.streamwatch.service.registry.ChannelRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Re-checks a channel with retries when its recording ended without a user stop, so a stream that dropped
 * briefly is picked up again without waiting for the next dispatch cycle.
 */
public class ResumeCheckListener {

    private static final Logger LOG = LogManager.getLogger(ResumeCheckListener.class);

    private final ChannelRegistry registry;
    private final LivenessProber prober;
    private final Executor executor;

    public ResumeCheckListener(ChannelRegistry registry, LivenessProber prober, Executor executor) {
        this.registry = registry;
        this.prober = prober;
        this.executor = executor;
    }

    @EventListener
    public void onRecordingEnded(RecordingEndedEvent event) {
        if (event.manual()) {
            return;
        }
        registry.findById(event.channelId())
                .filter(channel -> channel.isMonitoringEnabled())
                .ifPresent(channel -> {
                    try {
                        executor.execute(() -> prober.checkWithRetry(channel));
                    } catch (RejectedExecutionException e) {
                        LOG.warn("Resume check for {} rejected; next dispatch cycle will pick it up",
                                event.channelId());
                    }
                });
    }
}
