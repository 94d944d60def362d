package com.phillippitts.streamwatch.service.recording;

import com.phillippitts.streamwatch.domain.ChannelState;
import com.phillippitts.streamwatch.exception.StreamWatchException;
import com.phillippitts.streamwatch.service.resolver.StreamInfo;

/**
 * Fallback used when no capture backend is configured. Starting a session always fails, which leaves the
 * channel in the recording-error status.
 */
public class UnconfiguredStreamRecorder implements StreamRecorder {

    @Override
    public RecorderHandle start(ChannelState channel, StreamInfo info) {
        throw new StreamWatchException("No stream recorder configured; cannot record channel " + channel.getId());
    }
}
