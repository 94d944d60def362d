package com.phillippitts.streamwatch.config.properties;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Outbound probe limits.
 *
 * <p>When a platform already has {@code platform-max-concurrent} probes in flight, further probes wait up to
 * {@code permit-timeout-seconds} for a permit before failing with a check error. Each probe sleeps a random
 * jitter in [{@code jitter-min-ms}, {@code jitter-max-ms}] while holding the permit to spread bursts.
 */
@ConfigurationProperties(prefix = "streamwatch.probe")
@Validated
public class ProbeProperties {

    /** Maximum simultaneous probes against one platform. */
    @Positive(message = "Platform concurrency must be positive")
    private int platformMaxConcurrent = 3;

    @Positive(message = "Permit timeout must be positive")
    private int permitTimeoutSeconds = 120;

    @PositiveOrZero
    private long jitterMinMs = 2000;

    @PositiveOrZero
    private long jitterMaxMs = 5000;

    /** Attempts made by the resume re-check after a recording ends on its own. */
    @Positive
    private int retryAttempts = 2;

    @PositiveOrZero
    private int retryDelaySeconds = 20;

    @AssertTrue(message = "jitter-max-ms must not be below jitter-min-ms")
    public boolean isJitterRangeValid() {
        return jitterMaxMs >= jitterMinMs;
    }

    public int getPlatformMaxConcurrent() {
        return platformMaxConcurrent;
    }

    public void setPlatformMaxConcurrent(int platformMaxConcurrent) {
        this.platformMaxConcurrent = platformMaxConcurrent;
    }

    public int getPermitTimeoutSeconds() {
        return permitTimeoutSeconds;
    }

    public void setPermitTimeoutSeconds(int permitTimeoutSeconds) {
        this.permitTimeoutSeconds = permitTimeoutSeconds;
    }

    public long getJitterMinMs() {
        return jitterMinMs;
    }

    public void setJitterMinMs(long jitterMinMs) {
        this.jitterMinMs = jitterMinMs;
    }

    public long getJitterMaxMs() {
        return jitterMaxMs;
    }

    public void setJitterMaxMs(long jitterMaxMs) {
        this.jitterMaxMs = jitterMaxMs;
    }

    public int getRetryAttempts() {
        return retryAttempts;
    }

    public void setRetryAttempts(int retryAttempts) {
        this.retryAttempts = retryAttempts;
    }

    public int getRetryDelaySeconds() {
        return retryDelaySeconds;
    }

    public void setRetryDelaySeconds(int retryDelaySeconds) {
        this.retryDelaySeconds = retryDelaySeconds;
    }
}
