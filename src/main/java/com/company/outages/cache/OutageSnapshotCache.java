package com.company.outages.cache;

import java.util.Optional;

/**
 * Holds the latest default-parameter result. Refreshing is the caller's job; the cache only
 * stores and returns a value.
 */
public interface OutageSnapshotCache {

    /**
     * @return the latest snapshot, or empty if none has been stored (or it cannot be read)
     */
    Optional<OutageSnapshot> get();

    void store(OutageSnapshot snapshot);
}
