package io.civicledger.core.service;

import io.civicledger.core.protocol.Digest;
import io.civicledger.core.protocol.ReportStatus;

import java.time.Instant;

/** What a citizen gets back after a report is sealed. */
public record SubmissionReceipt(
        String reportId,
        String referenceId,
        long blockIndex,
        Digest blockHash,
        ReportStatus status,
        int chainLength,
        Instant submittedAt
) {}
