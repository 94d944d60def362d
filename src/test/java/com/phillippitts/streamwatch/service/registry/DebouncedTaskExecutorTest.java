package com.phillippitts.streamwatch.service.registry;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class DebouncedTaskExecutorTest {

    private DebouncedTaskExecutor executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.close();
        }
    }

    @Test
    void burstRunsOnlyTheLastTaskOnce() {
        executor = new DebouncedTaskExecutor("test-debounce", 100);
        AtomicInteger first = new AtomicInteger();
        AtomicInteger last = new AtomicInteger();

        executor.submit(first::incrementAndGet);
        executor.submit(first::incrementAndGet);
        executor.submit(last::incrementAndGet);

        await().atMost(Duration.ofSeconds(2)).until(() -> last.get() == 1);
        assertThat(first.get()).isZero();
        assertThat(executor.hasPending()).isFalse();
    }

    @Test
    void flushRunsPendingTaskOnCallerThread() {
        executor = new DebouncedTaskExecutor("test-debounce", 60_000);
        AtomicInteger runs = new AtomicInteger();
        String caller = Thread.currentThread().getName();
        String[] ranOn = new String[1];

        executor.submit(() -> {
            runs.incrementAndGet();
            ranOn[0] = Thread.currentThread().getName();
        });
        assertThat(executor.hasPending()).isTrue();
        executor.flush();
        executor.flush();

        assertThat(runs.get()).isEqualTo(1);
        assertThat(ranOn[0]).isEqualTo(caller);
    }

    @Test
    void failingTaskDoesNotBlockLaterSubmissions() {
        executor = new DebouncedTaskExecutor("test-debounce", 10);
        AtomicInteger runs = new AtomicInteger();

        executor.submit(() -> {
            throw new IllegalStateException("boom");
        });
        await().atMost(Duration.ofSeconds(2)).until(() -> !executor.hasPending());
        executor.submit(runs::incrementAndGet);

        await().atMost(Duration.ofSeconds(2)).until(() -> runs.get() == 1);
    }

    @Test
    void closeFlushesPendingTask() {
        executor = new DebouncedTaskExecutor("test-debounce", 60_000);
        AtomicInteger runs = new AtomicInteger();
        executor.submit(runs::incrementAndGet);

        executor.close();
        executor = null;

        assertThat(runs.get()).isEqualTo(1);
    }
}
