package io.civicledger.core.service;

import io.civicledger.core.protocol.Digest;

import java.time.Instant;

/**
 * Proof that a report is on the ledger.
 * {@code dataHash} is the digest of the sealed payload's canonical encoding.
 */
public record VerificationReport(
        String reportId,
        long blockIndex,
        Digest blockHash,
        Digest previousHash,
        Instant timestamp,
        long nonce,
        Digest dataHash,
        boolean chainIntact
) {}
