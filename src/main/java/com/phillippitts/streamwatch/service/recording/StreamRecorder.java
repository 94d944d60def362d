package com.phillippitts.streamwatch.service.recording;

import com.phillippitts.streamwatch.domain.ChannelState;
import com.phillippitts.streamwatch.service.resolver.StreamInfo;

/**
 * Starts capture processes. The scheduler owns lifecycle decisions; the recorder owns capture mechanics.
 */
public interface StreamRecorder {

    /**
     * Starts capturing the channel's stream.
     *
     * @param channel channel to record, already marked as recording
     * @param info    resolution result that found the channel live
     * @return handle used to stop the capture and observe its completion
     * @throws com.phillippitts.streamwatch.exception.StreamWatchException if the capture cannot start
     */
    RecorderHandle start(ChannelState channel, StreamInfo info);
}
