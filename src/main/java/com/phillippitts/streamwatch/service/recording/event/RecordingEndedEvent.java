package com.phillippitts.streamwatch.service.recording.event;

import java.time.Duration;
import java.time.Instant;

/**
 * Published when a recording session closes.
 *
 * @param channelId channel whose session ended
 * @param manual    true if the user stopped it, false if the recorder finished on its own
 * @param duration  total duration of the session
 * @param at        when the session closed
 */
public record RecordingEndedEvent(String channelId, boolean manual, Duration duration, Instant at) { }
