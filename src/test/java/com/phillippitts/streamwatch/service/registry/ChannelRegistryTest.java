package com.phillippitts.streamwatch.service.registry;

import com.phillippitts.streamwatch.domain.ChannelConfig;
import com.phillippitts.streamwatch.domain.ChannelState;
import com.phillippitts.streamwatch.service.registry.event.PersistenceFailedEvent;
import com.phillippitts.streamwatch.testutil.EventCapturingPublisher;
import com.phillippitts.streamwatch.testutil.InMemoryChannelStore;
import com.phillippitts.streamwatch.testutil.TestClocks;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChannelRegistryTest {

    private InMemoryChannelStore store;
    private EventCapturingPublisher publisher;
    private ChannelRegistry registry;

    @BeforeEach
    void setUp() {
        store = new InMemoryChannelStore();
        publisher = new EventCapturingPublisher();
        registry = new ChannelRegistry(store, new DebouncedTaskExecutor("test-persist", 10_000), publisher,
                TestClocks.at(TestClocks.TUESDAY_EVENING));
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    private static ChannelState channel(String id) {
        return new ChannelState(id, "https://example.com/" + id, ChannelConfig.defaults(id), Instant.EPOCH);
    }

    @Test
    void addAndFind() {
        ChannelState a = channel("a");
        registry.add(a);

        assertThat(registry.findById("a")).containsSame(a);
        assertThat(registry.findById("missing")).isEmpty();
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void duplicateIdIsRejected() {
        registry.add(channel("a"));

        assertThatThrownBy(() -> registry.add(channel("a"))).isInstanceOf(IllegalArgumentException.class);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void duplicateUrlUnderAnotherIdIsRejected() {
        registry.add(channel("a"));
        ChannelState sameUrl = new ChannelState("b", "https://example.com/a", ChannelConfig.defaults("b"),
                Instant.EPOCH);

        assertThatThrownBy(() -> registry.add(sameUrl))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("already exists");
        assertThat(registry.findById("b")).isEmpty();
    }

    @Test
    void snapshotIsUnaffectedByLaterMutations() {
        registry.add(channel("a"));
        List<ChannelState> before = registry.all();

        registry.add(channel("b"));

        assertThat(before).extracting(ChannelState::getId).containsExactly("a");
        assertThat(registry.all()).extracting(ChannelState::getId).containsExactly("a", "b");
        assertThatThrownBy(() -> registry.all().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void removeReleasesProbeClaim() {
        ChannelState a = channel("a");
        registry.add(a);
        a.tryBeginCheck();

        assertThat(registry.remove(a)).isTrue();
        assertThat(a.isChecking()).isFalse();
        assertThat(registry.remove(a)).isFalse();
    }

    @Test
    void burstOfMutationsCoalescesIntoOneSave() {
        registry.add(channel("a"));
        registry.add(channel("b"));
        registry.remove(registry.findById("a").orElseThrow());
        registry.requestPersist();

        assertThat(store.saves).isEmpty();
        registry.flush();

        assertThat(store.saves).containsExactly(List.of("b"));
    }

    @Test
    void clearEmptiesRegistryAndPersists() {
        registry.add(channel("a"));
        registry.add(channel("b"));

        registry.clear();
        registry.flush();

        assertThat(registry.size()).isZero();
        assertThat(store.saves).containsExactly(List.of());
    }

    @Test
    void loadFromStoreSeedsBaseInterval() {
        store.stored = List.of(channel("x"), channel("y"));

        int loaded = registry.loadFromStore(300);

        assertThat(loaded).isEqualTo(2);
        assertThat(registry.all()).allSatisfy(c -> assertThat(c.getLoopIntervalSeconds()).isEqualTo(300));
    }

    @Test
    void failedSaveKeepsStateAndPublishesEvent() {
        store.failSaves = true;
        registry.add(channel("a"));

        registry.flush();

        assertThat(registry.isLastSaveFailed()).isTrue();
        assertThat(registry.size()).isEqualTo(1);
        assertThat(publisher.eventsOfType(PersistenceFailedEvent.class)).singleElement()
                .satisfies(e -> assertThat(e.path()).isEqualTo("memory"));

        store.failSaves = false;
        registry.requestPersist();
        registry.flush();

        assertThat(registry.isLastSaveFailed()).isFalse();
        assertThat(store.saves).containsExactly(List.of("a"));
    }

    @Test
    void closeWritesPendingSave() {
        registry.add(channel("a"));

        registry.close();

        assertThat(store.saves).containsExactly(List.of("a"));
    }

    @Test
    void concurrentAddsAreAllRetained() throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int i = 0; i < 40; i++) {
                String id = "c" + i;
                pool.submit(() -> {
                    start.await();
                    registry.add(channel(id));
                    return null;
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(registry.size()).isEqualTo(40);
    }

    @Test
    void concurrentAddsOfSameUrlKeepOnlyOne() throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger rejected = new AtomicInteger();
        try {
            for (int i = 0; i < 20; i++) {
                String id = "c" + i;
                pool.submit(() -> {
                    start.await();
                    try {
                        registry.add(new ChannelState(id, "https://example.com/shared", ChannelConfig.defaults(id),
                                Instant.EPOCH));
                    } catch (IllegalArgumentException e) {
                        rejected.incrementAndGet();
                    }
                    return null;
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(registry.size()).isEqualTo(1);
        assertThat(rejected).hasValue(19);
    }
}
