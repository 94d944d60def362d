/**
 * Domain exception hierarchy rooted at {@link com.phillippitts.streamwatch.exception.StreamWatchException}.
 *
 * <p>Schedule-window misses, recorder conflicts and low disk space are not exceptions. They surface as
 * channel statuses so that a single channel can never stall a lane worker.
 */
package com.phillippitts.streamwatch.exception;
