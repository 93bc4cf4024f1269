package io.civicledger.core.protocol;

import java.util.Objects;

/**
 * Sealed ledger entry: one report payload plus its link to the previous block.
 * hash = SHA-256(SealEncoding(index, timestamp, data, previousHash, nonce)).
 */
public final class Block {
    private final long index;
    private final long timestamp;
    private final BlockPayload data;
    private final Digest previousHash;
    private final Digest hash;
    private final long nonce;

    public Block(long index, long timestamp, BlockPayload data, Digest previousHash, Digest hash, long nonce) {
        this.index = index;
        this.timestamp = timestamp;
        this.data = data;
        this.previousHash = previousHash;
        this.hash = hash;
        this.nonce = nonce;
        basicValidate();
    }

    public long index() { return index; }
    public long timestamp() { return timestamp; }
    public BlockPayload data() { return data; }
    public Digest previousHash() { return previousHash; }
    public Digest hash() { return hash; }
    public long nonce() { return nonce; }

    /** Recompute the seal from content; never trusts the stored {@link #hash()}. */
    public Digest computeHash() {
        return computeHash(index, timestamp, data, previousHash, nonce);
    }

    public static Digest computeHash(long index, long timestamp, BlockPayload data, Digest previousHash, long nonce) {
        return Hashes.digest(SealEncoding.encode(index, timestamp, data, previousHash, nonce));
    }

    public void basicValidate() {
        if (index < 0) throw new IllegalArgumentException("index must be >= 0");
        if (data == null) throw new IllegalArgumentException("missing data");
        if (previousHash == null) throw new IllegalArgumentException("missing previousHash");
        if (hash == null) throw new IllegalArgumentException("missing hash");
        if (nonce < 0) throw new IllegalArgumentException("nonce must be >= 0");
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Block)) return false;
        Block b = (Block) o;
        return index == b.index
                && timestamp == b.timestamp
                && nonce == b.nonce
                && data.equals(b.data)
                && previousHash.equals(b.previousHash)
                && hash.equals(b.hash);
    }

    @Override public int hashCode() {
        return Objects.hash(index, timestamp, data, previousHash, hash, nonce);
    }

    @Override public String toString() {
        return "Block{index=" + index + ", report=" + data.reportId() + ", hash=" + hash + "}";
    }
}
