package com.phillippitts.streamwatch.exception;

/**
 * Thrown when a per-platform probe permit cannot be acquired within the configured wait.
 */
public class PermitUnavailableException extends ResolutionException {

    private final long waitedMs;

    public PermitUnavailableException(String platformKey, long waitedMs) {
        super("Probe permit unavailable after " + waitedMs + "ms wait", platformKey);
        this.waitedMs = waitedMs;
    }

    public PermitUnavailableException(String platformKey, InterruptedException cause) {
        super("Interrupted while waiting for probe permit", platformKey, cause);
        this.waitedMs = 0;
    }

    public long getWaitedMs() {
        return waitedMs;
    }
}
