package io.civicledger.core.consensus;

import io.civicledger.core.protocol.Block;
import io.civicledger.core.protocol.BlockPayload;
import io.civicledger.core.protocol.Digest;

/**
 * Hex-prefix Proof-of-Work:
 * - A seal is acceptable when its hex form starts with {@code difficulty} '0' characters.
 * - Expected attempts are about 16^difficulty.
 *
 * There is a single writer, so difficulty is a cost knob rather than a security boundary.
 * Mining is unbounded and synchronous.
 */
public final class ProofOfWork {

    public static final int MAX_DIFFICULTY = Digest.LENGTH * 2;

    private final int difficulty;
    private final String prefix;

    public ProofOfWork(int difficulty) {
        this.difficulty = clamp(difficulty);
        this.prefix = "0".repeat(this.difficulty);
    }

    public int difficulty() { return difficulty; }

    /** Quick check: does this seal meet the configured difficulty? */
    public boolean meetsTarget(Digest hash) {
        return hash != null && hash.hex().startsWith(prefix);
    }

    public boolean meetsTarget(Block block) {
        return block != null && meetsTarget(block.hash());
    }

    /**
     * Search nonce = 0, 1, 2, ... until the seal meets the target.
     */
    public Seal mine(long index, long timestamp, BlockPayload payload, Digest previousHash) {
        long nonce = 0L;
        while (true) {
            Digest hash = Block.computeHash(index, timestamp, payload, previousHash, nonce);
            if (meetsTarget(hash)) {
                return new Seal(hash, nonce, nonce + 1);
            }
            nonce++;
        }
    }

    /** Winning hash and nonce; attempts is the number of digests computed. */
    public record Seal(Digest hash, long nonce, long attempts) {}

    private static int clamp(int difficulty) {
        if (difficulty < 0) return 0;
        if (difficulty > MAX_DIFFICULTY) return MAX_DIFFICULTY;
        return difficulty;
    }
}
