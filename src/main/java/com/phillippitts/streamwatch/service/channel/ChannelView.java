package com.phillippitts.streamwatch.service.channel;

import com.phillippitts.streamwatch.domain.ChannelStatus;

import java.time.Instant;

/**
 * Read-only snapshot of a channel for display.
 *
 * @param likelihood      predicted probability of being live right now
 * @param intervalSeconds polling interval the dispatcher would use right now
 * @param duration        recording duration formatted as {@code H:MM:SS}
 */
public record ChannelView(
        String id,
        String url,
        String platformKey,
        String displayName,
        ChannelStatus status,
        boolean monitoringEnabled,
        boolean live,
        boolean recording,
        boolean notifyOnly,
        String liveTitle,
        double priorityScore,
        double consistencyScore,
        double likelihood,
        long intervalSeconds,
        Instant lastSeenLiveAt,
        String duration
) {
}
