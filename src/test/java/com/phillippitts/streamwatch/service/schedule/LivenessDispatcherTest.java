package com.phillippitts.streamwatch.service.schedule;

import com.phillippitts.streamwatch.config.properties.SchedulerProperties;
import com.phillippitts.streamwatch.domain.ChannelConfig;
import com.phillippitts.streamwatch.domain.ChannelState;
import com.phillippitts.streamwatch.domain.LearnedStatistics;
import com.phillippitts.streamwatch.service.metrics.SchedulerMetrics;
import com.phillippitts.streamwatch.service.predict.LivenessPredictor;
import com.phillippitts.streamwatch.service.registry.ChannelRegistry;
import com.phillippitts.streamwatch.service.registry.DebouncedTaskExecutor;
import com.phillippitts.streamwatch.testutil.EventCapturingPublisher;
import com.phillippitts.streamwatch.testutil.InMemoryChannelStore;
import com.phillippitts.streamwatch.testutil.TestClocks;
import com.phillippitts.streamwatch.testutil.TestClocks.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class LivenessDispatcherTest {

    private MutableClock clock;
    private ChannelRegistry registry;
    private LaneQueues queues;
    private SimpleMeterRegistry meters;
    private SchedulerProperties properties;
    private LivenessDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        clock = TestClocks.mutableAt(TestClocks.TUESDAY_EVENING);
        registry = new ChannelRegistry(new InMemoryChannelStore(),
                new DebouncedTaskExecutor("test-persist", 10_000), new EventCapturingPublisher(), clock);
        queues = new LaneQueues();
        meters = new SimpleMeterRegistry();
        properties = new SchedulerProperties();
        dispatcher = new LivenessDispatcher(registry, new LivenessPredictor(clock), queues,
                new SchedulerMetrics(meters), properties, clock, new Random(7));
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    private ChannelState add(String id, Map<Integer, List<Integer>> history, double score) {
        LearnedStatistics stats = new LearnedStatistics(score, history, null, 0.0, 0, 0);
        ChannelState channel = ChannelState.restore(id, "https://example.com/" + id, null,
                ChannelConfig.defaults(id), null, stats, Duration.ZERO);
        registry.add(channel);
        return channel;
    }

    @Test
    void neverCheckedChannelsAreDispatchedToTheirLanes() {
        ChannelState hot = add("hot", Map.of(2, List.of(20)), 0.9);
        ChannelState fresh = add("fresh", Map.of(), 0.0);
        ChannelState quiet = add("quiet", Map.of(4, List.of(20)), 0.1);

        DispatchSummary summary = dispatcher.runCycle();

        assertThat(summary.format()).isEqualTo("Disp(1F+1M+1S) | Busy(0F+0M+0S) | 0 waiting");
        assertThat(queues.contains(PriorityLane.FAST, hot)).isTrue();
        assertThat(queues.contains(PriorityLane.MEDIUM, fresh)).isTrue();
        assertThat(queues.contains(PriorityLane.SLOW, quiet)).isTrue();
        assertThat(hot.isChecking()).isTrue();
        assertThat(hot.getLoopIntervalSeconds()).isEqualTo(60);
        assertThat(meters.counter("streamwatch.dispatch", "lane", "fast").count()).isEqualTo(1.0);
    }

    @Test
    void channelWithProbeInFlightIsCountedBusyAndNotQueuedAgain() {
        ChannelState channel = add("c1", Map.of(), 0.0);
        assertThat(channel.tryBeginCheck()).isTrue();

        DispatchSummary summary = dispatcher.runCycle();

        assertThat(summary.busy(PriorityLane.MEDIUM)).isEqualTo(1);
        assertThat(summary.totalDispatched()).isZero();
        assertThat(queues.totalSize()).isZero();
    }

    @Test
    void secondCycleDoesNotQueueAChannelTwice() {
        ChannelState channel = add("c1", Map.of(), 0.0);

        dispatcher.runCycle();
        DispatchSummary second = dispatcher.runCycle();

        assertThat(queues.size(PriorityLane.MEDIUM)).isEqualTo(1);
        assertThat(second.busy(PriorityLane.MEDIUM)).isEqualTo(1);
        assertThat(channel.isChecking()).isTrue();
    }

    @Test
    void channelWithinItsIntervalIsWaiting() {
        ChannelState channel = add("c1", Map.of(), 0.0);
        channel.setDetectionTime(clock.instant());

        DispatchSummary summary = dispatcher.runCycle();
        assertThat(summary.format()).isEqualTo("Disp(0F+0M+0S) | Busy(0F+0M+0S) | 1 waiting");

        clock.advance(Duration.ofSeconds(150));
        assertThat(dispatcher.runCycle().dispatched(PriorityLane.MEDIUM)).isEqualTo(1);
    }

    @Test
    void recordingChannelGetsLiveObservationInsteadOfProbe() {
        ChannelState channel = add("c1", Map.of(), 0.0);
        channel.setLive(true);
        channel.beginRecordingSession(clock.instant());

        DispatchSummary summary = dispatcher.runCycle();

        assertThat(summary.totalDispatched()).isZero();
        assertThat(summary.waiting()).isZero();
        assertThat(channel.isChecking()).isFalse();
        assertThat(channel.getPriorityScore()).isGreaterThan(0.0);
        assertThat(channel.getHistory().contains(2, 20)).isTrue();
    }

    @Test
    void unmonitoredChannelsAreSkipped() {
        ChannelState channel = add("c1", Map.of(), 0.0);
        channel.setConfig(channel.getConfig().withMonitoringEnabled(false));

        DispatchSummary summary = dispatcher.runCycle();

        assertThat(summary.format()).isEqualTo("Disp(0F+0M+0S) | Busy(0F+0M+0S) | 0 waiting");
        assertThat(channel.isChecking()).isFalse();
    }

    @Test
    void announcedNotifyOnlyChannelUsesNotifyLoopInterval() {
        ChannelState channel = add("c1", Map.of(2, List.of(20)), 0.9);
        channel.setConfig(new ChannelConfig("c1", "OD", "ts", true, false, List.of(), false, 1800, null, false,
                true));
        channel.setLive(true);
        channel.setNotifiedLiveStart(true);

        dispatcher.runCycle();

        assertThat(channel.getLoopIntervalSeconds()).isEqualTo(properties.getNotifyLoopTimeSeconds());
        assertThat(queues.size(PriorityLane.SLOW)).isEqualTo(1);
    }

    @Test
    void higherScoresAreQueuedFirstWithinALane() {
        ChannelState low = add("low", Map.of(), 0.1);
        ChannelState high = add("high", Map.of(), 0.8);
        ChannelState mid = add("mid", Map.of(), 0.4);

        dispatcher.runCycle();

        List<ChannelState> order = List.of(take(), take(), take());
        assertThat(order).containsExactly(high, mid, low);
    }

    private ChannelState take() {
        try {
            return queues.take(PriorityLane.MEDIUM);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssertionError(e);
        }
    }
}
