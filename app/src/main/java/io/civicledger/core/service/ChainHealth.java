package io.civicledger.core.service;

import io.civicledger.core.protocol.Digest;

import java.time.Instant;

public record ChainHealth(
        Status status,
        int chainLength,
        long latestBlockIndex,
        Digest latestBlockHash,
        Instant lastUpdated,
        String failure
) {
    public enum Status { HEALTHY, COMPROMISED }

    public boolean healthy() {
        return status == Status.HEALTHY;
    }
}
