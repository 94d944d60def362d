package com.phillippitts.streamwatch.service.schedule;

import com.phillippitts.streamwatch.config.properties.SchedulerProperties;
import com.phillippitts.streamwatch.domain.ChannelState;
import com.phillippitts.streamwatch.service.metrics.SchedulerMetrics;
import com.phillippitts.streamwatch.service.predict.LivenessPredictor;
import com.phillippitts.streamwatch.service.registry.ChannelRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Periodic dispatch cycle: decides which monitored channels are due for a probe and routes them to a lane.
 *
 * <p>Channels are visited by descending priority score with a random tiebreak among equal scores. Recording
 * channels only get a live observation folded into their statistics. For the others the predictor picks the
 * polling interval; a channel is due when it was never checked or its interval has elapsed since the last check.
 * A due channel is claimed with {@link ChannelState#tryBeginCheck()} before it is queued, so a channel already
 * in flight is counted as busy and never queued twice.
 */
public class LivenessDispatcher {

    private static final Logger LOG = LogManager.getLogger(LivenessDispatcher.class);

    private final ChannelRegistry registry;
    private final LivenessPredictor predictor;
    private final LaneQueues queues;
    private final SchedulerMetrics metrics;
    private final SchedulerProperties properties;
    private final Clock clock;
    private final Random random;

    public LivenessDispatcher(ChannelRegistry registry, LivenessPredictor predictor, LaneQueues queues,
                              SchedulerMetrics metrics, SchedulerProperties properties, Clock clock, Random random) {
        this.registry = registry;
        this.predictor = predictor;
        this.queues = queues;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
        this.random = random;
    }

    public DispatchSummary runCycle() {
        Map<PriorityLane, Integer> dispatched = new EnumMap<>(PriorityLane.class);
        Map<PriorityLane, Integer> busy = new EnumMap<>(PriorityLane.class);
        int waiting = 0;

        Instant now = clock.instant();
        LocalDateTime localNow = LocalDateTime.now(clock);

        for (ChannelState channel : orderByPriority(registry.all())) {
            if (!channel.isMonitoringEnabled()) {
                continue;
            }
            if (channel.isRecording()) {
                channel.recordObservation(true, properties.getEmaAlphaActive(), properties.getEmaAlphaOffline(),
                        clock);
                continue;
            }

            long interval = intervalFor(channel, localNow);
            channel.setLoopIntervalSeconds(interval);
            if (!isDue(channel, interval, now)) {
                waiting++;
                continue;
            }

            PriorityLane lane = PriorityLane.forInterval(interval, properties.getFastLaneMaxSeconds(),
                    properties.getMediumLaneMaxSeconds());
            if (!channel.tryBeginCheck()) {
                busy.merge(lane, 1, Integer::sum);
                metrics.recordBusy(lane);
                continue;
            }
            queues.offer(lane, channel);
            dispatched.merge(lane, 1, Integer::sum);
            metrics.recordDispatch(lane);
            if (LOG.isDebugEnabled()) {
                LOG.debug("Dispatched {} to {} lane (likelihood {}, interval {}s)", channel.getId(), lane,
                        String.format("%.2f", predictor.likelihood(channel, localNow)), interval);
            }
        }

        DispatchSummary summary = new DispatchSummary(dispatched, busy, waiting);
        if (summary.totalDispatched() + summary.totalBusy() > 0) {
            LOG.info("Dispatch cycle summary: {}", summary.format());
        }
        registry.requestPersist();
        return summary;
    }

    long intervalFor(ChannelState channel, LocalDateTime now) {
        if (channel.getConfig().notifyOnly() && channel.isLive() && channel.isNotifiedLiveStart()) {
            return properties.getNotifyLoopTimeSeconds();
        }
        return predictor.adjustedInterval(channel, properties.getLoopTimeSeconds(), now);
    }

    static boolean isDue(ChannelState channel, long intervalSeconds, Instant now) {
        Instant last = channel.getDetectionTime();
        return last == null || Duration.between(last, now).getSeconds() >= intervalSeconds;
    }

    private List<ChannelState> orderByPriority(List<ChannelState> channels) {
        List<Ranked> ranked = new ArrayList<>(channels.size());
        for (ChannelState channel : channels) {
            ranked.add(new Ranked(channel, channel.getPriorityScore(), random.nextDouble()));
        }
        ranked.sort(Comparator.comparingDouble(Ranked::score)
                .thenComparingDouble(Ranked::tiebreak)
                .reversed());
        List<ChannelState> ordered = new ArrayList<>(ranked.size());
        ranked.forEach(r -> ordered.add(r.channel()));
        return ordered;
    }

    private record Ranked(ChannelState channel, double score, double tiebreak) { }
}
