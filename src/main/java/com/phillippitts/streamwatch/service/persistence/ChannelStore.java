package com.phillippitts.streamwatch.service.persistence;

import com.phillippitts.streamwatch.domain.ChannelState;

import java.util.List;

/**
 * Persistence gateway for channel records, keyed by stable channel id.
 *
 * <p>{@link #saveAll(List)} replaces the stored set with the given snapshot. Implementations must make the
 * write atomic (a crash never leaves a partial file observable) and idempotent on replay.
 */
public interface ChannelStore {

    /**
     * @throws com.phillippitts.streamwatch.exception.PersistenceException if the snapshot cannot be written
     */
    void saveAll(List<ChannelState> channels);

    /**
     * @return stored channels in registration order; empty if nothing was stored yet
     * @throws com.phillippitts.streamwatch.exception.PersistenceException if the store exists but is unreadable
     */
    List<ChannelState> loadAll();
}
