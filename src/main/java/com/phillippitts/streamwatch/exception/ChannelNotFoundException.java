package com.phillippitts.streamwatch.exception;

/** Thrown when a command names a channel id that is not registered. */
public class ChannelNotFoundException extends StreamWatchException {

    private final String channelId;

    public ChannelNotFoundException(String channelId) {
        super("Channel not found: " + channelId);
        this.channelId = channelId;
    }

    public String getChannelId() {
        return channelId;
    }
}
