package com.phillippitts.streamwatch.service.probe;

import com.phillippitts.streamwatch.exception.PermitUnavailableException;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Bounds simultaneous outbound probes per platform with one fair semaphore per platform key.
 *
 * <p><b>Usage Pattern:</b>
 * <pre>{@code
 * permits.acquire(platformKey); // blocks up to the configured timeout
 * try {
 *     // ... call the resolver ...
 * } finally {
 *     permits.release(platformKey);
 * }
 * }</pre>
 *
 * <p>Thread-safe. Semaphores are created lazily on first use of a platform key.
 */
public final class PlatformPermits {

    private final int maxPerPlatform;
    private final long timeoutMs;
    private final Map<String, Semaphore> semaphores = new ConcurrentHashMap<>();

    /**
     * @param maxPerPlatform maximum simultaneous probes per platform
     * @param timeoutMs      maximum time to wait for a permit in milliseconds
     */
    public PlatformPermits(int maxPerPlatform, long timeoutMs) {
        if (maxPerPlatform <= 0) {
            throw new IllegalArgumentException("maxPerPlatform must be positive");
        }
        this.maxPerPlatform = maxPerPlatform;
        this.timeoutMs = timeoutMs;
    }

    /**
     * Acquires a permit for the platform, blocking up to the configured timeout.
     *
     * @throws PermitUnavailableException if no permit became available in time or the thread was interrupted
     */
    public void acquire(String platformKey) {
        try {
            if (!semaphore(platformKey).tryAcquire(timeoutMs, TimeUnit.MILLISECONDS)) {
                throw new PermitUnavailableException(platformKey, timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PermitUnavailableException(platformKey, e);
        }
    }

    /**
     * Releases a previously acquired permit. Call in a finally block.
     */
    public void release(String platformKey) {
        semaphore(platformKey).release();
    }

    public int availablePermits(String platformKey) {
        return semaphore(platformKey).availablePermits();
    }

    public int getMaxPerPlatform() {
        return maxPerPlatform;
    }

    private Semaphore semaphore(String platformKey) {
        return semaphores.computeIfAbsent(platformKey, k -> new Semaphore(maxPerPlatform, true));
    }
}
