package com.phillippitts.streamwatch.service.disk.event;

import java.time.Instant;

/** Published when free space is back above the threshold and recording may start again. */
public record DiskSpaceRecoveredEvent(String outputDir, Instant at) { }
