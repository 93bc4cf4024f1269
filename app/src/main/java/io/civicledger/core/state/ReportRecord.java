package io.civicledger.core.state;

import io.civicledger.core.protocol.Digest;
import io.civicledger.core.protocol.Identity;
import io.civicledger.core.protocol.Location;
import io.civicledger.core.protocol.ReportStatus;
import io.civicledger.core.protocol.Urgency;

import java.util.List;

/**
 * Queryable report metadata. Points at its sealed block by index and hash;
 * {@code status} here is the live status, which may differ from the one sealed in the block.
 */
public record ReportRecord(
        String id,
        String referenceId,
        long blockIndex,
        Digest blockHash,
        String category,
        Urgency urgency,
        Digest descriptionHash,
        Identity identity,
        String citizenId,
        ReportStatus status,
        Location location,
        boolean emergency,
        List<Digest> evidenceHashes,
        List<String> authorities,
        long createdAt,
        long updatedAt
) {
    public ReportRecord {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("Missing id");
        if (status == null) throw new IllegalArgumentException("Missing status");
        evidenceHashes = evidenceHashes == null ? List.of() : List.copyOf(evidenceHashes);
        authorities = authorities == null ? List.of() : List.copyOf(authorities);
    }

    public ReportRecord withStatus(ReportStatus next, long at) {
        return new ReportRecord(id, referenceId, blockIndex, blockHash, category, urgency, descriptionHash,
                identity, citizenId, next, location, emergency, evidenceHashes, authorities, createdAt, at);
    }
}
