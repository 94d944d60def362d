package com.phillippitts.streamwatch.service.registry;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Coalesces repeated submissions into one delayed run.
 *
 * <p>Each {@link #submit(Runnable)} cancels the pending run (if it has not started) and schedules the new task
 * {@code delayMs} later, so a burst of requests results in a single execution after the burst settles. Task
 * failures are logged and do not affect later submissions.
 */
public class DebouncedTaskExecutor implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(DebouncedTaskExecutor.class);

    private final ScheduledExecutorService scheduler;
    private final long delayMs;
    private ScheduledFuture<?> pending;
    private Runnable pendingTask;

    public DebouncedTaskExecutor(String threadName, long delayMs) {
        this.delayMs = delayMs;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void submit(Runnable task) {
        if (pending != null) {
            pending.cancel(false);
        }
        pendingTask = task;
        pending = scheduler.schedule(() -> runPending(task), delayMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Runs the pending task now on the calling thread, if there is one that has not started yet.
     */
    public void flush() {
        Runnable task;
        synchronized (this) {
            if (pending == null || !pending.cancel(false)) {
                return;
            }
            task = pendingTask;
            pending = null;
            pendingTask = null;
        }
        safeRun(task);
    }

    public synchronized boolean hasPending() {
        return pending != null && !pending.isDone();
    }

    @Override
    public void close() {
        flush();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        }
    }

    private void runPending(Runnable task) {
        synchronized (this) {
            if (pendingTask == task) {
                pending = null;
                pendingTask = null;
            }
        }
        safeRun(task);
    }

    private static void safeRun(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            LOG.error("Debounced task failed", e);
        }
    }
}
