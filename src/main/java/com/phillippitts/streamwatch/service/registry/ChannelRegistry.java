package com.phillippitts.streamwatch.service.registry;

import com.phillippitts.streamwatch.domain.ChannelState;
import com.phillippitts.streamwatch.exception.PersistenceException;
import com.phillippitts.streamwatch.service.persistence.ChannelStore;
import com.phillippitts.streamwatch.service.registry.event.PersistenceFailedEvent;
import com.phillippitts.streamwatch.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Shared collection of all monitored channels.
 *
 * <p>Structural mutations (add, remove, clear, load) are serialized under one lock and publish a new immutable
 * snapshot; readers iterate that snapshot without locking and never observe a half-applied change. Every
 * mutation schedules a debounced save of the whole snapshot through the {@link ChannelStore}.
 *
 * <p>Failed saves are logged and published as {@link PersistenceFailedEvent}; in-memory state stays
 * authoritative and the next save retries.
 */
public class ChannelRegistry implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(ChannelRegistry.class);

    private final ReentrantLock mutationLock = new ReentrantLock();
    private volatile List<ChannelState> snapshot = List.of();

    private final ChannelStore store;
    private final DebouncedTaskExecutor persistExecutor;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;
    private volatile boolean lastSaveFailed;

    public ChannelRegistry(ChannelStore store, DebouncedTaskExecutor persistExecutor,
                           ApplicationEventPublisher publisher, Clock clock) {
        this.store = store;
        this.persistExecutor = persistExecutor;
        this.publisher = publisher;
        this.clock = clock;
    }

    /**
     * Registers a channel.
     *
     * @throws IllegalArgumentException if a channel with the same id or url is already registered
     */
    public void add(ChannelState channel) {
        mutationLock.lock();
        try {
            if (indexOf(channel.getId()) >= 0) {
                throw new IllegalArgumentException("Channel already registered: " + channel.getId());
            }
            for (ChannelState existing : snapshot) {
                if (existing.getUrl().equals(channel.getUrl())) {
                    throw new IllegalArgumentException(
                            "Channel already exists for url " + LogSanitizer.url(channel.getUrl()));
                }
            }
            List<ChannelState> next = new ArrayList<>(snapshot);
            next.add(channel);
            snapshot = List.copyOf(next);
        } finally {
            mutationLock.unlock();
        }
        LOG.info("Registered channel {}", channel.getId());
        requestPersist();
    }

    /**
     * Removes a channel and releases its in-flight probe claim.
     *
     * @return true if the channel was registered
     */
    public boolean remove(ChannelState channel) {
        boolean removed;
        mutationLock.lock();
        try {
            int index = indexOf(channel.getId());
            removed = index >= 0;
            if (removed) {
                List<ChannelState> next = new ArrayList<>(snapshot);
                next.remove(index);
                snapshot = List.copyOf(next);
            }
        } finally {
            mutationLock.unlock();
        }
        if (removed) {
            channel.clearChecking();
            LOG.info("Removed channel {}", channel.getId());
            requestPersist();
        }
        return removed;
    }

    public void clear() {
        List<ChannelState> previous;
        mutationLock.lock();
        try {
            previous = snapshot;
            snapshot = List.of();
        } finally {
            mutationLock.unlock();
        }
        previous.forEach(ChannelState::clearChecking);
        LOG.info("Cleared {} channel(s)", previous.size());
        requestPersist();
    }

    /** Immutable snapshot in registration order. */
    public List<ChannelState> all() {
        return snapshot;
    }

    public Optional<ChannelState> findById(String id) {
        for (ChannelState channel : snapshot) {
            if (channel.getId().equals(id)) {
                return Optional.of(channel);
            }
        }
        return Optional.empty();
    }

    public int size() {
        return snapshot.size();
    }

    /**
     * Replaces the registry contents with the stored channels and seeds their polling interval.
     *
     * @return number of channels loaded
     */
    public int loadFromStore(long baseIntervalSeconds) {
        List<ChannelState> loaded = store.loadAll();
        loaded.forEach(channel -> channel.setLoopIntervalSeconds(baseIntervalSeconds));
        mutationLock.lock();
        try {
            snapshot = List.copyOf(loaded);
        } finally {
            mutationLock.unlock();
        }
        LOG.info("Live channels: loaded {} item(s)", loaded.size());
        return loaded.size();
    }

    /**
     * Schedules a debounced save of the current snapshot. Calls within the debounce window collapse into one
     * write of the snapshot current at write time.
     */
    public void requestPersist() {
        persistExecutor.submit(this::saveNow);
    }

    /** Writes any pending save immediately. */
    public void flush() {
        persistExecutor.flush();
    }

    public boolean isLastSaveFailed() {
        return lastSaveFailed;
    }

    @Override
    public void close() {
        persistExecutor.close();
    }

    void saveNow() {
        List<ChannelState> toSave = snapshot;
        try {
            store.saveAll(toSave);
            if (lastSaveFailed) {
                LOG.info("Channel store writable again; saved {} channel(s)", toSave.size());
            }
            lastSaveFailed = false;
        } catch (PersistenceException e) {
            lastSaveFailed = true;
            LOG.error("Saving {} channel(s) failed; keeping in-memory state", toSave.size(), e);
            publisher.publishEvent(new PersistenceFailedEvent(String.valueOf(e.getPath()), e.getMessage(),
                    clock.instant()));
        }
    }

    private int indexOf(String id) {
        List<ChannelState> current = snapshot;
        for (int i = 0; i < current.size(); i++) {
            if (current.get(i).getId().equals(id)) {
                return i;
            }
        }
        return -1;
    }
}
