package io.civicledger.core.protocol;

public enum IntegrityError {
    /** Candidate sequence had no blocks at all. */
    EMPTY_CHAIN,
    /** Stored index does not match the block's position. */
    INDEX_MISMATCH,
    /** Recomputed seal differs from the stored hash: content altered after sealing. */
    HASH_MISMATCH,
    /** previousHash does not match the preceding block: inserted, removed or reordered. */
    LINK_BROKEN,
    /** Block 0 is not the fixed genesis block. */
    GENESIS_MISMATCH
}
