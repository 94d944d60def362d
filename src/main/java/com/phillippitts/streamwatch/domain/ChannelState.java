package com.phillippitts.streamwatch.domain;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Mutable per-channel record: identity, configuration, live/recording flags, timers and learned statistics.
 *
 * <p><b>Thread safety:</b> runtime flags are volatile so that the dispatcher, lane workers and REST readers see
 * current values. The in-flight probe flag is an {@link AtomicBoolean} claimed with {@link #tryBeginCheck()}, so
 * at most one probe owns a channel at a time. Learned statistics and the recording session are guarded by the
 * instance monitor.
 *
 * <p>A channel can only be recording while it is live: {@link #beginRecordingSession(Instant)} requires the live
 * flag, and {@link #setLive(boolean)} refuses to clear it while a session is open.
 */
public final class ChannelState {

    private static final double DECAY_PER_DAY = 0.99;
    private static final int DECAY_GRACE_DAYS = 30;
    private static final int DECAY_MAX_DAYS = 60;
    private static final int LEGACY_COUNTER_CAP = 100;

    private final String id;
    private final String url;
    private final Instant addedAt;
    private volatile String platformKey;
    private volatile ChannelConfig config;

    private final AtomicBoolean checking = new AtomicBoolean();
    private volatile boolean live;
    private volatile boolean recording;
    private volatile boolean manuallyStopped;
    private volatile boolean stoppingInProgress;
    private volatile boolean forceStop;
    private volatile boolean notifiedLiveStart;
    private volatile boolean notifiedLiveEnd;
    private volatile ChannelStatus status;
    private volatile String liveTitle;

    private volatile Instant detectionTime;
    private volatile Instant startTime;
    private volatile Duration cumulativeDuration = Duration.ZERO;
    private volatile Duration lastDuration = Duration.ZERO;
    private volatile long loopIntervalSeconds;

    // guarded by this
    private double priorityScore;
    private final HistoricalPattern history;
    private Instant lastSeenLiveAt;
    private double consistencyScore;
    private int liveCheckCount;
    private int liveFoundCount;

    public ChannelState(String id, String url, ChannelConfig config, Instant addedAt) {
        this(id, url, null, config, addedAt, LearnedStatistics.NONE, Duration.ZERO);
    }

    private ChannelState(String id, String url, String platformKey, ChannelConfig config, Instant addedAt,
                         LearnedStatistics stats, Duration lastDuration) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must not be blank");
        }
        this.id = id;
        this.url = url.trim();
        this.platformKey = platformKey;
        this.config = Objects.requireNonNull(config, "config");
        this.addedAt = addedAt;
        this.status = config.monitoringEnabled() ? ChannelStatus.MONITORING : ChannelStatus.STOPPED_MONITORING;
        this.priorityScore = clamp(stats.priorityScore());
        this.history = HistoricalPattern.fromMap(stats.historicalIntervals());
        this.lastSeenLiveAt = stats.lastSeenLiveAt();
        this.consistencyScore = history.isEmpty() ? clamp(stats.consistencyScore()) : history.consistency();
        this.liveCheckCount = Math.max(0, stats.liveCheckCount());
        this.liveFoundCount = Math.max(0, Math.min(stats.liveFoundCount(), this.liveCheckCount));
        this.lastDuration = lastDuration == null ? Duration.ZERO : lastDuration;
    }

    /**
     * Recreates a channel from stored data. The priority score is clamped to [0,1].
     */
    public static ChannelState restore(String id, String url, String platformKey, ChannelConfig config,
                                       Instant addedAt, LearnedStatistics stats, Duration lastDuration) {
        return new ChannelState(id, url, platformKey, config, addedAt,
                stats == null ? LearnedStatistics.NONE : stats, lastDuration);
    }

    /**
     * Folds one liveness observation into the learned statistics.
     *
     * <p>A live observation records the current weekday and hour in the historical pattern and refreshes the
     * last-seen timestamp. The priority score then moves toward 1 (live) or 0 (offline) with the matching
     * smoothing factor, and gets an extra geometric decay when the channel has not been seen live for more than
     * 30 days. Legacy counters are halved once the check count passes 100.
     */
    public synchronized void recordObservation(boolean observedLive, double alphaActive, double alphaOffline,
                                               Clock clock) {
        ZonedDateTime now = ZonedDateTime.now(clock);
        if (observedLive) {
            history.record(HistoricalPattern.dayIndex(now.getDayOfWeek()), now.getHour());
            lastSeenLiveAt = now.toInstant();
        }
        if (!history.isEmpty()) {
            consistencyScore = history.consistency();
        }

        double alpha = observedLive ? alphaActive : alphaOffline;
        double observed = observedLive ? 1.0 : 0.0;
        priorityScore = priorityScore * (1 - alpha) + observed * alpha;

        if (lastSeenLiveAt != null) {
            long daysInactive = Duration.between(lastSeenLiveAt, now.toInstant()).toDays();
            if (daysInactive > DECAY_GRACE_DAYS) {
                long decayDays = Math.min(daysInactive - DECAY_GRACE_DAYS, DECAY_MAX_DAYS);
                priorityScore *= Math.pow(DECAY_PER_DAY, decayDays);
            }
        }
        priorityScore = clamp(priorityScore);

        liveCheckCount++;
        if (observedLive) {
            liveFoundCount++;
        }
        if (liveCheckCount > LEGACY_COUNTER_CAP) {
            liveCheckCount /= 2;
            liveFoundCount /= 2;
        }
    }

    /**
     * Claims the in-flight probe slot. Returns false if a probe already owns this channel.
     */
    public boolean tryBeginCheck() {
        return checking.compareAndSet(false, true);
    }

    public void clearChecking() {
        checking.set(false);
    }

    public boolean isChecking() {
        return checking.get();
    }

    /**
     * Opens a recording session: resets durations and stamps the start time.
     *
     * @return false if a session is already open
     * @throws IllegalStateException if the channel is not live
     */
    public synchronized boolean beginRecordingSession(Instant now) {
        if (!live) {
            throw new IllegalStateException("Cannot record channel " + id + " while it is offline");
        }
        if (recording) {
            return false;
        }
        cumulativeDuration = Duration.ZERO;
        lastDuration = Duration.ZERO;
        startTime = now;
        recording = true;
        return true;
    }

    /**
     * Closes the open recording session, folding its elapsed time into the cumulative duration.
     *
     * @return false if no session was open
     */
    public synchronized boolean endRecordingSession(Instant now) {
        if (!recording) {
            return false;
        }
        if (startTime != null) {
            Duration elapsed = Duration.between(startTime, now);
            if (!elapsed.isNegative()) {
                cumulativeDuration = cumulativeDuration.plus(elapsed);
            }
            lastDuration = cumulativeDuration;
        }
        startTime = null;
        recording = false;
        return true;
    }

    /** Cumulative plus running time while recording, otherwise the duration of the last session. */
    public synchronized Duration durationAt(Instant now) {
        if (recording && startTime != null) {
            Duration elapsed = Duration.between(startTime, now);
            return cumulativeDuration.plus(elapsed.isNegative() ? Duration.ZERO : elapsed);
        }
        return lastDuration;
    }

    public synchronized void setLive(boolean live) {
        if (!live && recording) {
            throw new IllegalStateException("Channel " + id + " is recording; end the session before going offline");
        }
        this.live = live;
    }

    /** Resets session bookkeeping after an offline-to-live transition. */
    public void markLiveTransition() {
        notifiedLiveStart = false;
        notifiedLiveEnd = false;
        cumulativeDuration = Duration.ZERO;
        lastDuration = Duration.ZERO;
    }

    public synchronized LearnedStatistics learnedStatistics() {
        return new LearnedStatistics(priorityScore, history.asMap(), lastSeenLiveAt, consistencyScore,
                liveCheckCount, liveFoundCount);
    }

    /**
     * Adopts the resolver's anchor name when the configured display name is blank or the placeholder.
     *
     * @return true if the display name changed
     */
    public boolean adoptAnchorName(String anchorName) {
        ChannelConfig current = config;
        if (anchorName == null || anchorName.isBlank() || !current.hasPlaceholderName()) {
            return false;
        }
        config = current.withDisplayName(anchorName.trim());
        return true;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    public String getId() {
        return id;
    }

    public String getUrl() {
        return url;
    }

    public Instant getAddedAt() {
        return addedAt;
    }

    public String getPlatformKey() {
        return platformKey;
    }

    public void setPlatformKey(String platformKey) {
        this.platformKey = platformKey;
    }

    public ChannelConfig getConfig() {
        return config;
    }

    public void setConfig(ChannelConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public boolean isMonitoringEnabled() {
        return config.monitoringEnabled();
    }

    public boolean isLive() {
        return live;
    }

    public boolean isRecording() {
        return recording;
    }

    public boolean isManuallyStopped() {
        return manuallyStopped;
    }

    public void setManuallyStopped(boolean manuallyStopped) {
        this.manuallyStopped = manuallyStopped;
    }

    public boolean isStoppingInProgress() {
        return stoppingInProgress;
    }

    public void setStoppingInProgress(boolean stoppingInProgress) {
        this.stoppingInProgress = stoppingInProgress;
    }

    public boolean isForceStop() {
        return forceStop;
    }

    public void setForceStop(boolean forceStop) {
        this.forceStop = forceStop;
    }

    public boolean isNotifiedLiveStart() {
        return notifiedLiveStart;
    }

    public void setNotifiedLiveStart(boolean notifiedLiveStart) {
        this.notifiedLiveStart = notifiedLiveStart;
    }

    public boolean isNotifiedLiveEnd() {
        return notifiedLiveEnd;
    }

    public void setNotifiedLiveEnd(boolean notifiedLiveEnd) {
        this.notifiedLiveEnd = notifiedLiveEnd;
    }

    public ChannelStatus getStatus() {
        return status;
    }

    public void setStatus(ChannelStatus status) {
        this.status = Objects.requireNonNull(status, "status");
    }

    public String getLiveTitle() {
        return liveTitle;
    }

    public void setLiveTitle(String liveTitle) {
        this.liveTitle = liveTitle;
    }

    public Instant getDetectionTime() {
        return detectionTime;
    }

    public void setDetectionTime(Instant detectionTime) {
        this.detectionTime = detectionTime;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Duration getCumulativeDuration() {
        return cumulativeDuration;
    }

    public Duration getLastDuration() {
        return lastDuration;
    }

    public long getLoopIntervalSeconds() {
        return loopIntervalSeconds;
    }

    public void setLoopIntervalSeconds(long loopIntervalSeconds) {
        this.loopIntervalSeconds = loopIntervalSeconds;
    }

    public synchronized double getPriorityScore() {
        return priorityScore;
    }

    public synchronized double getConsistencyScore() {
        return consistencyScore;
    }

    public synchronized Instant getLastSeenLiveAt() {
        return lastSeenLiveAt;
    }

    public synchronized int getLiveCheckCount() {
        return liveCheckCount;
    }

    public synchronized int getLiveFoundCount() {
        return liveFoundCount;
    }

    /** Live view of the learned pattern; it is internally synchronized. */
    public HistoricalPattern getHistory() {
        return history;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof ChannelState other && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "ChannelState{id='" + id + "', name='" + config.displayName() + "', status=" + status
                + ", live=" + live + ", recording=" + recording + '}';
    }
}
