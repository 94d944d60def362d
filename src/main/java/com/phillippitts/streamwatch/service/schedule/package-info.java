/**
 * Adaptive dispatch of liveness checks.
 *
 * <p>A {@link com.phillippitts.streamwatch.service.schedule.LivenessHeartbeat} runs one
 * {@link com.phillippitts.streamwatch.service.schedule.LivenessDispatcher#runCycle() dispatch cycle} per beat. The
 * dispatcher asks the predictor for each channel's polling interval and pushes due channels onto one of three
 * lanes:
 * <ul>
 *   <li>fast: interval up to {@code fast-lane-max-seconds}, one worker</li>
 *   <li>medium: up to {@code medium-lane-max-seconds}, two workers</li>
 *   <li>slow: everything else, one worker</li>
 * </ul>
 * A channel is claimed before it is queued, so it is never queued twice or probed concurrently. Lane workers
 * never die on a failing probe; a dead worker would stall its whole lane.
 */
package com.phillippitts.streamwatch.service.schedule;
