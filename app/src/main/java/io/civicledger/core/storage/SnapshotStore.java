package io.civicledger.core.storage;

import io.civicledger.core.protocol.Block;

import java.util.List;
import java.util.Optional;

/**
 * Durable home for ledger snapshots.
 *
 * Notes:
 * - A snapshot is the full ordered chain, genesis first.
 * - Stores never validate; the ledger's loadAndValidate decides whether a loaded snapshot is trusted.
 */
public interface SnapshotStore {

    /** Replace the stored snapshot with {@code chain}. */
    void save(List<Block> chain);

    /** The last saved snapshot, or empty when nothing has been saved yet. */
    Optional<List<Block>> load();
}
