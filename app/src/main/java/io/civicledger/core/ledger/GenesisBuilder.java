package io.civicledger.core.ledger;

import io.civicledger.core.protocol.Block;
import io.civicledger.core.protocol.BlockPayload;
import io.civicledger.core.protocol.Digest;
import io.civicledger.core.protocol.Location;
import io.civicledger.core.protocol.ReportStatus;
import io.civicledger.core.protocol.Urgency;

import java.util.List;

/**
 * Creates the genesis block.
 * - index = 0, timestamp = 2024-01-01T00:00:00Z
 * - previousHash = all-zero digest
 * - nonce = 0, not mined
 *
 * Every input is constant, so every ledger starts from the same genesis hash.
 */
public final class GenesisBuilder {
    public static final long GENESIS_TIMESTAMP = 1_704_067_200_000L;
    public static final String GENESIS_REPORT_ID = "GENESIS";

    private GenesisBuilder(){}

    public static Block buildGenesis() {
        BlockPayload data = BlockPayload.builder()
                .reportId(GENESIS_REPORT_ID)
                .category("SYSTEM")
                .urgency(Urgency.NONE)
                .location(new Location("India", "Origin", "N/A"))
                .descriptionHash(Digest.ZERO)
                .evidenceHashes(List.of())
                .anonymous()
                .timestamp(GENESIS_TIMESTAMP)
                .authorityRouted(List.of())
                .status(ReportStatus.RESOLVED)
                .build();
        Digest hash = Block.computeHash(0L, GENESIS_TIMESTAMP, data, Digest.ZERO, 0L);
        return new Block(0L, GENESIS_TIMESTAMP, data, Digest.ZERO, hash, 0L);
    }
}
