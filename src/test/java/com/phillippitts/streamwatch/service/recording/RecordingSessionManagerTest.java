package com.phillippitts.streamwatch.service.recording;

import com.phillippitts.streamwatch.domain.ChannelConfig;
import com.phillippitts.streamwatch.domain.ChannelState;
import com.phillippitts.streamwatch.domain.ChannelStatus;
import com.phillippitts.streamwatch.service.recording.event.RecordingEndedEvent;
import com.phillippitts.streamwatch.service.registry.ChannelRegistry;
import com.phillippitts.streamwatch.service.registry.DebouncedTaskExecutor;
import com.phillippitts.streamwatch.service.resolver.StreamInfo;
import com.phillippitts.streamwatch.testutil.EventCapturingPublisher;
import com.phillippitts.streamwatch.testutil.FakeStreamRecorder;
import com.phillippitts.streamwatch.testutil.InMemoryChannelStore;
import com.phillippitts.streamwatch.testutil.TestClocks;
import com.phillippitts.streamwatch.testutil.TestClocks.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class RecordingSessionManagerTest {

    private MutableClock clock;
    private EventCapturingPublisher publisher;
    private ChannelRegistry registry;
    private FakeStreamRecorder recorder;
    private RecordingSessionManager sessions;
    private ChannelState channel;

    @BeforeEach
    void setUp() {
        clock = TestClocks.mutableAt(TestClocks.TUESDAY_EVENING);
        publisher = new EventCapturingPublisher();
        registry = new ChannelRegistry(new InMemoryChannelStore(),
                new DebouncedTaskExecutor("test-persist", 10_000), publisher, clock);
        recorder = new FakeStreamRecorder();
        sessions = new RecordingSessionManager(recorder, registry, publisher, clock);
        channel = new ChannelState("c1", "https://example.com/c1", ChannelConfig.defaults("Alice"), Instant.EPOCH);
        registry.add(channel);
        channel.setLive(true);
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    @Test
    void startOpensSessionAndRegistersRecorder() {
        assertThat(sessions.startSession(channel, StreamInfo.live("Alice", null))).isTrue();

        assertThat(channel.isRecording()).isTrue();
        assertThat(channel.getStatus()).isEqualTo(ChannelStatus.RECORDING);
        assertThat(channel.getStartTime()).isEqualTo(clock.instant());
        assertThat(sessions.hasBlockingRecorder("c1")).isTrue();
        assertThat(sessions.activeRecorders()).containsOnlyKeys("c1");
    }

    @Test
    void secondStartIsRejected() {
        sessions.startSession(channel, StreamInfo.live("Alice", null));

        assertThat(sessions.startSession(channel, StreamInfo.live("Alice", null))).isFalse();
        assertThat(recorder.started).hasSize(1);
    }

    @Test
    void manualStopRequestsRecorderStopAndClosesSession() {
        sessions.startSession(channel, StreamInfo.live("Alice", null));
        FakeStreamRecorder.Handle handle = recorder.last();
        handle.autoAcknowledge = false;
        clock.advance(Duration.ofMinutes(10));

        assertThat(sessions.stopRecording(channel, true)).isTrue();

        assertThat(handle.stopRequested).isTrue();
        assertThat(channel.isStoppingInProgress()).isTrue();
        assertThat(channel.isRecording()).isFalse();
        assertThat(channel.isLive()).isFalse();
        assertThat(channel.isManuallyStopped()).isTrue();
        assertThat(channel.getStatus()).isEqualTo(ChannelStatus.NOT_RECORDING);
        assertThat(channel.getLastDuration()).isEqualTo(Duration.ofMinutes(10));
        assertThat(channel.getDetectionTime()).isNull();
        assertThat(sessions.hasBlockingRecorder("c1")).isFalse();
        assertThat(publisher.eventsOfType(RecordingEndedEvent.class)).singleElement()
                .satisfies(e -> {
                    assertThat(e.manual()).isTrue();
                    assertThat(e.duration()).isEqualTo(Duration.ofMinutes(10));
                });

        handle.acknowledgeStop();
        assertThat(channel.isStoppingInProgress()).isFalse();
    }

    @Test
    void stopWithoutRegisteredRecorderSetsForceStop() {
        channel.beginRecordingSession(clock.instant());

        assertThat(sessions.stopRecording(channel, false)).isTrue();

        assertThat(channel.isForceStop()).isTrue();
        assertThat(channel.isStoppingInProgress()).isFalse();
        assertThat(channel.isRecording()).isFalse();
    }

    @Test
    void stopWhenNotRecordingOnlyClearsLive() {
        assertThat(sessions.stopRecording(channel, true)).isFalse();

        assertThat(channel.isLive()).isFalse();
        assertThat(publisher.eventsOfType(RecordingEndedEvent.class)).isEmpty();
    }

    @Test
    void stopWhenNotRecordingLeavesLiveFlagToInFlightCheck() {
        assertThat(channel.tryBeginCheck()).isTrue();

        assertThat(sessions.stopRecording(channel, true)).isFalse();

        assertThat(channel.isLive()).isTrue();
        channel.clearChecking();
    }

    @Test
    void startIsRefusedWhenMonitoringIsOff() {
        channel.setConfig(channel.getConfig().withMonitoringEnabled(false));

        assertThat(sessions.startSession(channel, StreamInfo.live("Alice", null))).isFalse();

        assertThat(channel.isRecording()).isFalse();
        assertThat(recorder.started).isEmpty();
    }

    @Test
    void startIsRefusedOnceChannelWentOffline() {
        channel.setLive(false);

        assertThat(sessions.startSession(channel, StreamInfo.live("Alice", null))).isFalse();
        assertThat(recorder.started).isEmpty();
    }

    @Test
    void recorderExitingOnItsOwnClosesSession() {
        sessions.startSession(channel, StreamInfo.live("Alice", null));
        clock.advance(Duration.ofSeconds(95));

        recorder.last().finish();

        assertThat(channel.isRecording()).isFalse();
        assertThat(channel.isLive()).isFalse();
        assertThat(channel.getStatus()).isEqualTo(ChannelStatus.NOT_RECORDING);
        assertThat(sessions.activeRecorder("c1")).isEmpty();
        assertThat(publisher.eventsOfType(RecordingEndedEvent.class)).singleElement()
                .satisfies(e -> {
                    assertThat(e.manual()).isFalse();
                    assertThat(e.duration()).isEqualTo(Duration.ofSeconds(95));
                });
    }

    @Test
    void recorderExitAfterManualStopPublishesOnlyOnce() {
        sessions.startSession(channel, StreamInfo.live("Alice", null));
        sessions.stopRecording(channel, true);

        recorder.last().fail(new IllegalStateException("killed"));

        assertThat(sessions.activeRecorder("c1")).isEmpty();
        assertThat(publisher.eventsOfType(RecordingEndedEvent.class)).hasSize(1);
    }

    @Test
    void failedStartLeavesRecordingError() {
        recorder.failOnStart = true;

        assertThat(sessions.startSession(channel, StreamInfo.live("Alice", null))).isFalse();

        assertThat(channel.isRecording()).isFalse();
        assertThat(channel.getStatus()).isEqualTo(ChannelStatus.RECORDING_ERROR);
        assertThat(sessions.activeRecorders()).isEmpty();
    }

    @Test
    void durationRunsWhileRecording() {
        sessions.startSession(channel, StreamInfo.live("Alice", null));
        clock.advance(Duration.ofSeconds(42));

        assertThat(sessions.durationOf(channel)).isEqualTo(Duration.ofSeconds(42));
    }
}
