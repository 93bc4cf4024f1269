package io.civicledger.core.storage;

import io.civicledger.core.protocol.Block;

import java.util.List;
import java.util.Optional;

/**
 * Keeps the last snapshot in memory. Good for tests and throwaway runs.
 */
public final class InMemorySnapshotStore implements SnapshotStore {

    private List<Block> snapshot; // null until the first save
    private int saves;

    @Override
    public synchronized void save(List<Block> chain) {
        if (chain == null) throw new IllegalArgumentException("chain must not be null");
        snapshot = List.copyOf(chain);
        saves++;
    }

    @Override
    public synchronized Optional<List<Block>> load() {
        return Optional.ofNullable(snapshot);
    }

    /** Number of successful saves (debug/tests). */
    public synchronized int saveCount() {
        return saves;
    }
}
