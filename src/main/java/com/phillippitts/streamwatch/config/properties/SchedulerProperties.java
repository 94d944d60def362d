package com.phillippitts.streamwatch.config.properties;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Liveness scheduler tuning.
 *
 * <p>Properties:
 * <ul>
 *   <li>streamwatch.scheduler.enabled - run the periodic dispatch cycle (default: true)</li>
 *   <li>streamwatch.scheduler.heartbeat-seconds - delay between dispatch cycles (default: 30)</li>
 *   <li>streamwatch.scheduler.check-on-startup - run the first cycle immediately (default: true)</li>
 *   <li>streamwatch.scheduler.loop-time-seconds - base polling interval per channel (default: 300)</li>
 *   <li>streamwatch.scheduler.notify-loop-time-seconds - interval for notify-only channels already announced
 *       (default: 600)</li>
 *   <li>streamwatch.scheduler.ema-alpha-active / ema-alpha-offline - smoothing factors (default: 0.1 / 0.01)</li>
 *   <li>streamwatch.scheduler.fast-lane-max-seconds / medium-lane-max-seconds - lane boundaries
 *       (default: 60 / 180)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "streamwatch.scheduler")
@Validated
public class SchedulerProperties {

    private boolean enabled = true;

    @Positive(message = "Heartbeat must be positive")
    private int heartbeatSeconds = 30;

    private boolean checkOnStartup = true;

    @Positive(message = "Base polling interval must be positive")
    private int loopTimeSeconds = 300;

    @Positive(message = "Notify-only polling interval must be positive")
    private int notifyLoopTimeSeconds = 600;

    @DecimalMin(value = "0.0", inclusive = false, message = "ema-alpha-active must be in (0,1]")
    @DecimalMax(value = "1.0", message = "ema-alpha-active must be in (0,1]")
    private double emaAlphaActive = 0.1;

    @DecimalMin(value = "0.0", inclusive = false, message = "ema-alpha-offline must be in (0,1]")
    @DecimalMax(value = "1.0", message = "ema-alpha-offline must be in (0,1]")
    private double emaAlphaOffline = 0.01;

    @Positive
    private int fastLaneMaxSeconds = 60;

    @Positive
    private int mediumLaneMaxSeconds = 180;

    @AssertTrue(message = "medium-lane-max-seconds must not be below fast-lane-max-seconds")
    public boolean isLaneBoundsOrdered() {
        return mediumLaneMaxSeconds >= fastLaneMaxSeconds;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getHeartbeatSeconds() {
        return heartbeatSeconds;
    }

    public void setHeartbeatSeconds(int heartbeatSeconds) {
        this.heartbeatSeconds = heartbeatSeconds;
    }

    public boolean isCheckOnStartup() {
        return checkOnStartup;
    }

    public void setCheckOnStartup(boolean checkOnStartup) {
        this.checkOnStartup = checkOnStartup;
    }

    public int getLoopTimeSeconds() {
        return loopTimeSeconds;
    }

    public void setLoopTimeSeconds(int loopTimeSeconds) {
        this.loopTimeSeconds = loopTimeSeconds;
    }

    public int getNotifyLoopTimeSeconds() {
        return notifyLoopTimeSeconds;
    }

    public void setNotifyLoopTimeSeconds(int notifyLoopTimeSeconds) {
        this.notifyLoopTimeSeconds = notifyLoopTimeSeconds;
    }

    public double getEmaAlphaActive() {
        return emaAlphaActive;
    }

    public void setEmaAlphaActive(double emaAlphaActive) {
        this.emaAlphaActive = emaAlphaActive;
    }

    public double getEmaAlphaOffline() {
        return emaAlphaOffline;
    }

    public void setEmaAlphaOffline(double emaAlphaOffline) {
        this.emaAlphaOffline = emaAlphaOffline;
    }

    public int getFastLaneMaxSeconds() {
        return fastLaneMaxSeconds;
    }

    public void setFastLaneMaxSeconds(int fastLaneMaxSeconds) {
        this.fastLaneMaxSeconds = fastLaneMaxSeconds;
    }

    public int getMediumLaneMaxSeconds() {
        return mediumLaneMaxSeconds;
    }

    public void setMediumLaneMaxSeconds(int mediumLaneMaxSeconds) {
        this.mediumLaneMaxSeconds = mediumLaneMaxSeconds;
    }
}
