package com.phillippitts.streamwatch.exception;

/**
 * Thrown when the stream resolver call fails or returns incomplete data.
 * Recoverable: the channel surfaces a check-error status and is retried on its next scheduled cycle.
 */
public class ResolutionException extends StreamWatchException {

    private final String platformKey;

    public ResolutionException(String message, String platformKey) {
        super(message + " (platform: " + platformKey + ")");
        this.platformKey = platformKey;
    }

    public ResolutionException(String message, String platformKey, Throwable cause) {
        super(message + " (platform: " + platformKey + ")", cause);
        this.platformKey = platformKey;
    }

    public String getPlatformKey() {
        return platformKey;
    }
}
