package io.civicledger.core.consensus;

import io.civicledger.core.protocol.Block;
import io.civicledger.core.protocol.Digest;
import io.civicledger.core.protocol.IntegrityError;
import io.civicledger.core.protocol.ValidationResult;

import java.util.List;

/**
 * Full-chain integrity scan. Block 0 must have index 0 and a seal matching its content.
 * For every block after it:
 * 1) index equals its position
 * 2) recomputed seal equals the stored hash
 * 3) previousHash equals the stored hash of the block before it
 *
 * Stops at the first failure. Whether block 0 is the expected genesis is the ledger's check.
 */
public final class ChainValidator {
    private ChainValidator() {}

    public static ValidationResult validate(List<Block> chain) {
        if (chain == null || chain.isEmpty()) {
            return ValidationResult.error(IntegrityError.EMPTY_CHAIN, -1L, "Chain has no blocks");
        }
        if (chain.get(0) == null || chain.get(0).index() != 0L) {
            return ValidationResult.error(IntegrityError.INDEX_MISMATCH, 0L, "First block must have index 0");
        }
        Block first = chain.get(0);
        Digest firstSeal = first.computeHash();
        if (!firstSeal.equals(first.hash())) {
            return ValidationResult.error(IntegrityError.HASH_MISMATCH, 0L,
                    "Block 0 hash mismatch: stored " + first.hash().hex() + ", computed " + firstSeal.hex());
        }
        for (int i = 1; i < chain.size(); i++) {
            Block current = chain.get(i);
            Block previous = chain.get(i - 1);
            if (current == null) {
                return ValidationResult.error(IntegrityError.INDEX_MISMATCH, i, "Missing block at position " + i);
            }
            if (current.index() != i) {
                return ValidationResult.error(IntegrityError.INDEX_MISMATCH, i,
                        "Block at position " + i + " claims index " + current.index());
            }

            // recompute, never compare cached values
            Digest recomputed = current.computeHash();
            if (!recomputed.equals(current.hash())) {
                return ValidationResult.error(IntegrityError.HASH_MISMATCH, i,
                        "Block " + i + " hash mismatch: stored " + current.hash().hex() + ", computed " + recomputed.hex());
            }
            if (!current.previousHash().equals(previous.hash())) {
                return ValidationResult.error(IntegrityError.LINK_BROKEN, i,
                        "Block " + i + " chain link broken");
            }
        }
        return ValidationResult.ok();
    }

    public static boolean isValid(List<Block> chain) {
        return validate(chain).ok;
    }
}
