package com.phillippitts.streamwatch.domain;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of a channel's learned statistics, used to restore a channel from storage and to persist it.
 *
 * @param priorityScore       EMA of liveness in [0,1]
 * @param historicalIntervals weekday (0 = Sunday) to hours of day last observed live
 * @param lastSeenLiveAt      last live observation, or null if never seen live
 * @param consistencyScore    density of the learned schedule in [0,1]
 * @param liveCheckCount      legacy check counter (diagnostic only)
 * @param liveFoundCount      legacy live-found counter (diagnostic only)
 */
public record LearnedStatistics(
        double priorityScore,
        Map<Integer, List<Integer>> historicalIntervals,
        Instant lastSeenLiveAt,
        double consistencyScore,
        int liveCheckCount,
        int liveFoundCount
) {

    public static final LearnedStatistics NONE = new LearnedStatistics(0.0, Map.of(), null, 0.0, 0, 0);

    public LearnedStatistics {
        historicalIntervals = historicalIntervals == null ? Map.of() : Map.copyOf(historicalIntervals);
    }
}
