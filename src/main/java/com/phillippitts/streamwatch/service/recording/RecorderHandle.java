package com.phillippitts.streamwatch.service.recording;

import java.util.concurrent.CompletableFuture;

/**
 * Handle to a running capture process owned by a {@link StreamRecorder}.
 */
public interface RecorderHandle {

    /**
     * Asks the recorder to stop cooperatively. The returned future completes once the recorder has acknowledged
     * the request.
     */
    CompletableFuture<Void> requestStop();

    /** True once a stop has been requested or the recorder is winding down on its own. */
    boolean shouldStop();

    /** Completes when the capture process has exited for any reason. */
    CompletableFuture<Void> completion();
}
