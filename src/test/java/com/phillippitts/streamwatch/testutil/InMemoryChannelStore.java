package com.phillippitts.streamwatch.testutil;

import com.phillippitts.streamwatch.domain.ChannelState;
import com.phillippitts.streamwatch.exception.PersistenceException;
import com.phillippitts.streamwatch.service.persistence.ChannelStore;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * ChannelStore kept in memory. Every save is recorded; {@code failSaves} makes saves throw.
 */
public class InMemoryChannelStore implements ChannelStore {
    public final List<List<String>> saves = new CopyOnWriteArrayList<>();
    public volatile List<ChannelState> stored = List.of();
    public volatile boolean failSaves;

    @Override
    public void saveAll(List<ChannelState> channels) {
        if (failSaves) {
            throw new PersistenceException(Path.of("memory"), "disk full", null);
        }
        List<String> ids = new ArrayList<>();
        channels.forEach(c -> ids.add(c.getId()));
        saves.add(List.copyOf(ids));
        stored = List.copyOf(channels);
    }

    @Override
    public List<ChannelState> loadAll() {
        return stored;
    }
}
