package com.phillippitts.streamwatch.service.probe;

import java.time.Duration;

/**
 * Blocking pause used for probe jitter and retry delays. Tests substitute a non-blocking implementation.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
