package com.phillippitts.streamwatch.service.probe.event;

import java.time.Instant;

/**
 * Published when a liveness probe cannot determine a channel's status (resolver failure, incomplete result,
 * permit timeout).
 */
public record ProbeFailedEvent(String channelId, String platformKey, String reason, Instant at) {
    public ProbeFailedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
