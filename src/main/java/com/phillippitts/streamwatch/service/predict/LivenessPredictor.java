package com.phillippitts.streamwatch.service.predict;

import com.phillippitts.streamwatch.domain.ChannelState;
import com.phillippitts.streamwatch.domain.HistoricalPattern;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Scores how likely a channel is to be live right now from its learned weekday/hour pattern, and turns the
 * score into a polling interval.
 *
 * <p>Scores:
 * <ul>
 *   <li>no history: {@value #NEUTRAL}</li>
 *   <li>today never seen live: {@value #QUIET_DAY}</li>
 *   <li>current hour seen live: {@value #ACTIVE_HOUR}</li>
 *   <li>next hour seen live: ramps from 0.5 to 0.9 across the current hour</li>
 *   <li>otherwise: {@value #OFF_HOURS}</li>
 * </ul>
 *
 * <p>Stateless apart from the clock; safe to share.
 */
public class LivenessPredictor {

    static final double NEUTRAL = 0.5;
    static final double QUIET_DAY = 0.2;
    static final double ACTIVE_HOUR = 1.0;
    static final double OFF_HOURS = 0.1;

    /** Interval used when a channel is very likely live. */
    public static final long HOT_INTERVAL_SECONDS = 60;

    private final Clock clock;

    public LivenessPredictor(Clock clock) {
        this.clock = clock;
    }

    public double likelihood(ChannelState channel) {
        return likelihood(channel, LocalDateTime.now(clock));
    }

    public double likelihood(ChannelState channel, LocalDateTime now) {
        HistoricalPattern history = channel.getHistory();
        if (history.isEmpty()) {
            return NEUTRAL;
        }
        int day = HistoricalPattern.dayIndex(now.getDayOfWeek());
        if (!history.hasDay(day)) {
            return QUIET_DAY;
        }
        int hour = now.getHour();
        if (history.contains(day, hour)) {
            return ACTIVE_HOUR;
        }
        if (history.contains(day, (hour + 1) % 24)) {
            return 0.5 + 0.4 * (now.getMinute() / 60.0);
        }
        return OFF_HOURS;
    }

    public long adjustedInterval(ChannelState channel, long baseIntervalSeconds) {
        return adjustedInterval(channel, baseIntervalSeconds, LocalDateTime.now(clock));
    }

    public long adjustedInterval(ChannelState channel, long baseIntervalSeconds, LocalDateTime now) {
        return intervalFor(likelihood(channel, now), baseIntervalSeconds);
    }

    /**
     * Maps a likelihood score to a polling interval relative to {@code baseIntervalSeconds}.
     */
    public static long intervalFor(double likelihood, long baseIntervalSeconds) {
        if (likelihood >= 0.9) {
            return HOT_INTERVAL_SECONDS;
        }
        if (likelihood >= 0.5) {
            return baseIntervalSeconds / 2;
        }
        if (likelihood <= 0.2) {
            return baseIntervalSeconds * 2;
        }
        return baseIntervalSeconds;
    }
}
