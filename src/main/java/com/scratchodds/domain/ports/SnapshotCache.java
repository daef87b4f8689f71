package com.scratchodds.domain.ports;

import com.scratchodds.domain.model.CachedSnapshot;

import java.util.Optional;

/**
 * Port for keeping the last successful snapshot under a fixed key.
 */
public interface SnapshotCache {

    /**
     * Loads the cached snapshot.
     *
     * @return the snapshot, or empty if nothing usable is cached
     */
    Optional<CachedSnapshot> load();

    /**
     * Replaces the cached snapshot.
     *
     * @param snapshot snapshot to store
     */
    void save(CachedSnapshot snapshot);

    /**
     * Removes the cached snapshot, if any.
     */
    void clear();
}
