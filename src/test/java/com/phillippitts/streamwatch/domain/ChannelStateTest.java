package com.phillippitts.streamwatch.domain;

import com.phillippitts.streamwatch.testutil.TestClocks;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ChannelStateTest {

    private static final double ALPHA_ACTIVE = 0.1;
    private static final double ALPHA_OFFLINE = 0.01;

    private final Clock tuesdayEvening = TestClocks.at(TestClocks.TUESDAY_EVENING);

    private static ChannelState channel() {
        return new ChannelState("c1", "https://live.example.com/room1", ChannelConfig.defaults("Alice"),
                Instant.parse("2024-01-01T00:00:00Z"));
    }

    private static ChannelState restored(double score, Instant lastSeen, int checks, int found) {
        LearnedStatistics stats = new LearnedStatistics(score, Map.of(), lastSeen, 0.0, checks, found);
        return ChannelState.restore("c1", "https://example.com/room1", "example.com",
                ChannelConfig.defaults("Alice"), Instant.parse("2024-01-01T00:00:00Z"), stats, Duration.ZERO);
    }

    @Test
    void freshChannelStartsWithZeroScoreAndMonitoringStatus() {
        ChannelState c = channel();

        assertThat(c.getPriorityScore()).isZero();
        assertThat(c.getLiveCheckCount()).isZero();
        assertThat(c.getHistory().isEmpty()).isTrue();
        assertThat(c.getStatus()).isEqualTo(ChannelStatus.MONITORING);
    }

    @Test
    void emaConvergesTowardOneAfterConsecutiveLiveObservations() {
        ChannelState c = channel();

        for (int i = 0; i < 10; i++) {
            c.recordObservation(true, ALPHA_ACTIVE, ALPHA_OFFLINE, tuesdayEvening);
        }

        assertThat(c.getPriorityScore()).isCloseTo(1 - Math.pow(0.9, 10), within(0.01));
        assertThat(c.getPriorityScore()).isCloseTo(0.651, within(0.01));
    }

    @Test
    void offlineObservationUsesOfflineAlpha() {
        ChannelState c = restored(0.5, null, 0, 0);

        c.recordObservation(false, ALPHA_ACTIVE, ALPHA_OFFLINE, tuesdayEvening);

        assertThat(c.getPriorityScore()).isCloseTo(0.495, within(1e-9));
        assertThat(c.getHistory().isEmpty()).isTrue();
        assertThat(c.getLastSeenLiveAt()).isNull();
    }

    @Test
    void liveObservationRecordsWeekdayHourAndLastSeen() {
        ChannelState c = channel();

        c.recordObservation(true, ALPHA_ACTIVE, ALPHA_OFFLINE, tuesdayEvening);

        // Tuesday is day 2 when Sunday is 0
        assertThat(c.getHistory().contains(2, 20)).isTrue();
        assertThat(c.getLastSeenLiveAt()).isEqualTo(tuesdayEvening.instant());
        assertThat(c.getConsistencyScore()).isCloseTo(0.2, within(1e-9));
        assertThat(c.getLiveFoundCount()).isEqualTo(1);
    }

    @Test
    void countersAreHalvedOncePastOneHundredChecks() {
        ChannelState c = restored(0.4, tuesdayEvening.instant(), 100, 60);

        c.recordObservation(true, ALPHA_ACTIVE, ALPHA_OFFLINE, tuesdayEvening);

        assertThat(c.getLiveCheckCount()).isEqualTo(101 / 2);
        assertThat(c.getLiveFoundCount()).isEqualTo(61 / 2);
    }

    @Test
    void scoreDecaysWhenNotSeenLiveForMoreThanThirtyDays() {
        Instant fortyDaysAgo = tuesdayEvening.instant().minus(Duration.ofDays(40));
        ChannelState c = restored(0.8, fortyDaysAgo, 10, 5);

        c.recordObservation(false, ALPHA_ACTIVE, ALPHA_OFFLINE, tuesdayEvening);

        double emaOnly = 0.8 * (1 - ALPHA_OFFLINE);
        assertThat(c.getPriorityScore()).isLessThan(emaOnly);
        assertThat(c.getPriorityScore()).isCloseTo(emaOnly * Math.pow(0.99, 10), within(1e-9));
    }

    @Test
    void noDecayWithinThirtyDays() {
        Instant tenDaysAgo = tuesdayEvening.instant().minus(Duration.ofDays(10));
        ChannelState c = restored(0.8, tenDaysAgo, 10, 5);

        c.recordObservation(false, ALPHA_ACTIVE, ALPHA_OFFLINE, tuesdayEvening);

        assertThat(c.getPriorityScore()).isCloseTo(0.792, within(1e-9));
    }

    @Test
    void restoreClampsScoreAndDerivesConsistencyFromHistory() {
        LearnedStatistics stats = new LearnedStatistics(1.7, Map.of(2, List.of(20, 21)), null, 0.9, 3, 9);

        ChannelState c = ChannelState.restore("c1", "https://example.com/a", null, ChannelConfig.defaults("A"),
                null, stats, null);

        assertThat(c.getPriorityScore()).isEqualTo(1.0);
        assertThat(c.getConsistencyScore()).isCloseTo(0.4, within(1e-9));
        assertThat(c.getLiveFoundCount()).isEqualTo(3);
        assertThat(c.getLastDuration()).isEqualTo(Duration.ZERO);
    }

    @Test
    void onlyOneCheckCanBeInFlight() {
        ChannelState c = channel();

        assertThat(c.tryBeginCheck()).isTrue();
        assertThat(c.tryBeginCheck()).isFalse();
        c.clearChecking();
        assertThat(c.tryBeginCheck()).isTrue();
    }

    @Test
    void recordingRequiresLiveChannel() {
        ChannelState c = channel();

        assertThatThrownBy(() -> c.beginRecordingSession(Instant.now()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void cannotGoOfflineWhileRecording() {
        ChannelState c = channel();
        c.setLive(true);
        assertThat(c.beginRecordingSession(Instant.now())).isTrue();

        assertThatThrownBy(() -> c.setLive(false)).isInstanceOf(IllegalStateException.class);
        assertThat(c.isLive()).isTrue();
    }

    @Test
    void secondSessionStartIsRejected() {
        ChannelState c = channel();
        c.setLive(true);

        assertThat(c.beginRecordingSession(Instant.now())).isTrue();
        assertThat(c.beginRecordingSession(Instant.now())).isFalse();
    }

    @Test
    void endingSessionFoldsElapsedTimeIntoDurations() {
        ChannelState c = channel();
        Instant start = Instant.parse("2024-01-02T20:00:00Z");
        c.setLive(true);
        c.beginRecordingSession(start);

        assertThat(c.durationAt(start.plusSeconds(30))).isEqualTo(Duration.ofSeconds(30));
        assertThat(c.endRecordingSession(start.plusSeconds(90))).isTrue();

        assertThat(c.isRecording()).isFalse();
        assertThat(c.getStartTime()).isNull();
        assertThat(c.getCumulativeDuration()).isEqualTo(Duration.ofSeconds(90));
        assertThat(c.getLastDuration()).isEqualTo(Duration.ofSeconds(90));
        assertThat(c.durationAt(start.plusSeconds(500))).isEqualTo(Duration.ofSeconds(90));
        assertThat(c.endRecordingSession(start.plusSeconds(100))).isFalse();
    }

    @Test
    void liveTransitionResetsNotificationFlags() {
        ChannelState c = channel();
        c.setNotifiedLiveStart(true);
        c.setNotifiedLiveEnd(true);

        c.markLiveTransition();

        assertThat(c.isNotifiedLiveStart()).isFalse();
        assertThat(c.isNotifiedLiveEnd()).isFalse();
    }

    @Test
    void adoptsAnchorNameOnlyOverPlaceholder() {
        ChannelState placeholder = new ChannelState("p", "https://example.com/p", ChannelConfig.defaults(null),
                Instant.now());
        ChannelState named = channel();

        assertThat(placeholder.adoptAnchorName(" Bob ")).isTrue();
        assertThat(placeholder.getConfig().displayName()).isEqualTo("Bob");
        assertThat(named.adoptAnchorName("Bob")).isFalse();
        assertThat(named.getConfig().displayName()).isEqualTo("Alice");
        assertThat(placeholder.adoptAnchorName("  ")).isFalse();
    }

    @Test
    void rejectsBlankIdentity() {
        assertThatThrownBy(() -> new ChannelState(" ", "https://x", ChannelConfig.defaults("A"), null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ChannelState("id", "", ChannelConfig.defaults("A"), null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void stoppedMonitoringConfigStartsInStoppedStatus() {
        ChannelState c = new ChannelState("c", "https://example.com/c",
                ChannelConfig.defaults("A").withMonitoringEnabled(false), Instant.now());

        assertThat(c.getStatus()).isEqualTo(ChannelStatus.STOPPED_MONITORING);
        assertThat(c.isMonitoringEnabled()).isFalse();
    }
}
