package com.phillippitts.streamwatch.service.disk.event;

import java.time.Instant;

/**
 * Published when free space under the recording directory drops below the threshold. New recording sessions
 * are suspended until {@link DiskSpaceRecoveredEvent}.
 */
public record DiskSpaceLowEvent(String outputDir, double thresholdGb, Instant at) { }
