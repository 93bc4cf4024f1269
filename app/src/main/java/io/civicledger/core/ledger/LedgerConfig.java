package io.civicledger.core.ledger;

/** Simple config holder for a report ledger. */
public final class LedgerConfig {
    public final int difficulty;

    public LedgerConfig(int difficulty) {
        if (difficulty < 0) {
            throw new IllegalArgumentException("difficulty must be >= 0");
        }
        this.difficulty = difficulty;
    }

    public static LedgerConfig defaultLocal() {
        return new LedgerConfig(2); // two leading hex zeros, ~256 attempts per block
    }

    public LedgerConfig withDifficulty(int difficulty) {
        return new LedgerConfig(difficulty);
    }
}
