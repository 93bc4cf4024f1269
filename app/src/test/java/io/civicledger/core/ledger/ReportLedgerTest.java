package io.civicledger.core.ledger;

import io.civicledger.core.consensus.ChainValidator;
import io.civicledger.core.consensus.ProofOfWork;
import io.civicledger.core.protocol.Block;
import io.civicledger.core.protocol.BlockCodec;
import io.civicledger.core.protocol.BlockPayload;
import io.civicledger.core.protocol.Digest;
import io.civicledger.core.protocol.Hashes;
import io.civicledger.core.protocol.IntegrityError;
import io.civicledger.core.protocol.Location;
import io.civicledger.core.protocol.ReportStatus;
import io.civicledger.core.protocol.SealEncoding;
import io.civicledger.core.protocol.Urgency;
import io.civicledger.core.protocol.ValidationResult;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.UnaryOperator;

import static org.junit.jupiter.api.Assertions.*;

class ReportLedgerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-01T10:15:30Z"), ZoneOffset.UTC);

    @Test
    void genesisIsIdenticalAcrossLedgers() {
        ReportLedger a = new ReportLedger(LedgerConfig.defaultLocal());
        ReportLedger b = new ReportLedger(new LedgerConfig(4));

        assertEquals(a.genesis(), b.genesis());
        assertEquals(a.genesis().hash(), b.genesis().hash());
        assertEquals(GenesisBuilder.buildGenesis().hash(), a.genesis().hash());
    }

    @Test
    void genesisHasFixedContent() {
        Block genesis = new ReportLedger(LedgerConfig.defaultLocal()).genesis();

        assertEquals(0L, genesis.index());
        assertEquals(GenesisBuilder.GENESIS_TIMESTAMP, genesis.timestamp());
        assertEquals(Digest.ZERO, genesis.previousHash());
        assertEquals(0L, genesis.nonce());
        assertEquals("GENESIS", genesis.data().reportId());
        assertEquals("SYSTEM", genesis.data().category());
        assertEquals(Urgency.NONE, genesis.data().urgency());
        assertEquals(ReportStatus.RESOLVED, genesis.data().status());
        assertTrue(genesis.data().evidenceHashes().isEmpty());
        assertTrue(genesis.data().citizenId().isEmpty());
        assertEquals(genesis.computeHash(), genesis.hash());
    }

    @Test
    void freshLedgerHoldsOnlyGenesis() {
        ReportLedger ledger = new ReportLedger(LedgerConfig.defaultLocal());

        assertEquals(1, ledger.length());
        assertEquals(ledger.genesis(), ledger.latest());
        assertTrue(ledger.isValid());
    }

    @Test
    void appendsProduceContiguousIndices() {
        ReportLedger ledger = new ReportLedger(LedgerConfig.defaultLocal(), CLOCK);
        int n = 6;
        for (int i = 0; i < n; i++) {
            Block block = ledger.append(payload("R" + i));
            assertEquals(i + 1, block.index());
            assertEquals(block, ledger.latest());
        }

        assertEquals(n + 1, ledger.length());
        List<Block> chain = ledger.exportSnapshot();
        for (int i = 0; i < chain.size(); i++) {
            assertEquals(i, chain.get(i).index());
        }
    }

    @Test
    void everyBlockLinksToItsPredecessor() {
        ReportLedger ledger = ledgerWith(5);
        List<Block> chain = ledger.exportSnapshot();

        for (int i = 1; i < chain.size(); i++) {
            assertEquals(chain.get(i - 1).hash(), chain.get(i).previousHash());
        }
    }

    @Test
    void everyMinedBlockMeetsDifficulty() {
        ReportLedger ledger = new ReportLedger(new LedgerConfig(3), CLOCK);
        for (int i = 0; i < 4; i++) {
            ledger.append(payload("R" + i));
        }

        ProofOfWork pow = new ProofOfWork(3);
        List<Block> chain = ledger.exportSnapshot();
        for (Block block : chain.subList(1, chain.size())) {
            assertTrue(block.hash().hex().startsWith("000"), block.hash().hex());
            assertTrue(pow.meetsTarget(block));
            assertEquals(block.computeHash(), block.hash());
        }
    }

    @Test
    void appendUsesClockForTimestamp() {
        ReportLedger ledger = new ReportLedger(LedgerConfig.defaultLocal(), CLOCK);
        Block block = ledger.append(payload("R1"));

        assertEquals(CLOCK.millis(), block.timestamp());
    }

    @Test
    void appendRejectsNullPayload() {
        ReportLedger ledger = new ReportLedger(LedgerConfig.defaultLocal());
        assertThrows(IllegalArgumentException.class, () -> ledger.append(null));
        assertEquals(1, ledger.length());
    }

    @Test
    void detectsAnyPayloadFieldChange() {
        List<UnaryOperator<BlockPayload.Builder>> mutations = List.of(
                b -> b.reportId("R-forged"),
                b -> b.category("Sanitation"),
                b -> b.urgency(Urgency.CRITICAL),
                b -> b.location(new Location("Ward 9", "Elsewhere", "North Station")),
                b -> b.descriptionHash(Hashes.digest("something else")),
                b -> b.evidenceHashes(List.of(Hashes.digest("forged.jpg"))),
                b -> b.named("CIT-777"),
                b -> b.timestamp(42L),
                b -> b.authorityRouted(List.of("Someone Else")),
                b -> b.status(ReportStatus.DISMISSED)
        );

        ReportLedger ledger = ledgerWith(3);
        List<Block> chain = ledger.exportSnapshot();

        for (int target = 1; target < chain.size(); target++) {
            for (UnaryOperator<BlockPayload.Builder> mutation : mutations) {
                Block original = chain.get(target);
                BlockPayload altered = mutation.apply(original.data().toBuilder()).build();
                assertNotEquals(original.data(), altered);

                List<Block> tampered = new ArrayList<>(chain);
                tampered.set(target, new Block(original.index(), original.timestamp(), altered,
                        original.previousHash(), original.hash(), original.nonce()));

                ValidationResult result = ChainValidator.validate(tampered);
                assertFalse(result.ok);
                assertEquals(IntegrityError.HASH_MISMATCH, result.error);
                assertEquals(target, result.blockIndex);
                assertFalse(ledger.loadAndValidate(tampered));
            }
        }
        assertTrue(ledger.isValid());
    }

    @Test
    void detectsBlockTimestampAndNonceChange() {
        ReportLedger ledger = ledgerWith(2);
        List<Block> chain = ledger.exportSnapshot();
        Block b = chain.get(1);

        List<Block> timeShifted = new ArrayList<>(chain);
        timeShifted.set(1, new Block(b.index(), b.timestamp() + 1, b.data(), b.previousHash(), b.hash(), b.nonce()));
        assertFalse(ChainValidator.isValid(timeShifted));

        List<Block> nonceShifted = new ArrayList<>(chain);
        nonceShifted.set(1, new Block(b.index(), b.timestamp(), b.data(), b.previousHash(), b.hash(), b.nonce() + 1));
        assertFalse(ChainValidator.isValid(nonceShifted));
    }

    @Test
    void detectsRelinkedBlock() {
        ReportLedger ledger = ledgerWith(3);
        List<Block> chain = ledger.exportSnapshot();

        for (int target = 2; target < chain.size(); target++) {
            Block b = chain.get(target);
            Digest otherValid = chain.get(0).hash();
            List<Block> tampered = new ArrayList<>(chain);
            tampered.set(target, new Block(b.index(), b.timestamp(), b.data(), otherValid, b.hash(), b.nonce()));

            assertFalse(ChainValidator.isValid(tampered));
            assertFalse(ledger.loadAndValidate(tampered));
        }
    }

    @Test
    void detectsRelinkedBlockEvenWhenResealed() {
        ReportLedger ledger = ledgerWith(3);
        List<Block> chain = ledger.exportSnapshot();
        Block b = chain.get(2);

        // attacker re-mines block 2 onto genesis: its own seal is valid, the link is not
        Digest forgedParent = chain.get(0).hash();
        ProofOfWork.Seal seal = new ProofOfWork(2).mine(b.index(), b.timestamp(), b.data(), forgedParent);
        List<Block> tampered = new ArrayList<>(chain);
        tampered.set(2, new Block(b.index(), b.timestamp(), b.data(), forgedParent, seal.hash(), seal.nonce()));

        ValidationResult result = ChainValidator.validate(tampered);
        assertFalse(result.ok);
        assertEquals(IntegrityError.LINK_BROKEN, result.error);
        assertEquals(2L, result.blockIndex);
    }

    @Test
    void detectsSwappedBlocks() {
        ReportLedger ledger = ledgerWith(4);
        List<Block> chain = ledger.exportSnapshot();

        for (int i = 1; i + 1 < chain.size(); i++) {
            List<Block> swapped = new ArrayList<>(chain);
            swapped.set(i, chain.get(i + 1));
            swapped.set(i + 1, chain.get(i));
            assertFalse(ChainValidator.isValid(swapped));
            assertFalse(ledger.loadAndValidate(swapped));
        }
    }

    @Test
    void detectsRemovedBlock() {
        ReportLedger ledger = ledgerWith(3);
        List<Block> chain = new ArrayList<>(ledger.exportSnapshot());
        chain.remove(2);

        assertFalse(ChainValidator.isValid(chain));
    }

    @Test
    void rawDescriptionNeverAppearsInBlock() {
        String raw = "pothole near the park";
        ReportLedger ledger = new ReportLedger(LedgerConfig.defaultLocal(), CLOCK);
        Block block = ledger.append(BlockPayload.builder()
                .reportId("R-privacy")
                .category("Roads")
                .urgency(Urgency.HIGH)
                .location(new Location("Ward 3", "Lake Road", "East Station"))
                .descriptionHash(Hashes.digest(raw))
                .evidenceHashes(List.of(Hashes.digest("evidence-bytes-ref")))
                .anonymous()
                .timestamp(CLOCK.millis())
                .build());

        String json = BlockCodec.toJson(block).toString();
        String sealed = new String(SealEncoding.encode(block.index(), block.timestamp(), block.data(),
                block.previousHash(), block.nonce()), StandardCharsets.UTF_8);

        assertFalse(json.contains(raw));
        assertFalse(sealed.contains(raw));
        assertFalse(block.toString().contains(raw));
        assertFalse(json.contains("evidence-bytes-ref"));
        assertEquals(Hashes.digest(raw), block.data().descriptionHash());
    }

    @Test
    void loadingExportedSnapshotKeepsChainUnchanged() {
        ReportLedger ledger = ledgerWith(4);
        List<Block> before = ledger.exportSnapshot();

        assertTrue(ledger.loadAndValidate(ledger.exportSnapshot()));
        assertEquals(before, ledger.exportSnapshot());
        for (int i = 0; i < before.size(); i++) {
            assertArrayEquals(BlockCodec.toBytes(before.get(i)), BlockCodec.toBytes(ledger.exportSnapshot().get(i)));
        }
        assertTrue(ledger.isValid());
    }

    @Test
    void loadAdoptsValidChainFromAnotherLedger() {
        ReportLedger source = ledgerWith(3);
        ReportLedger target = new ReportLedger(LedgerConfig.defaultLocal());

        assertTrue(target.loadAndValidate(source.exportSnapshot()));
        assertEquals(4, target.length());
        assertEquals(source.latest(), target.latest());

        Block next = target.append(payload("R-next"));
        assertEquals(4L, next.index());
        assertEquals(source.latest().hash(), next.previousHash());
    }

    @Test
    void failedLoadKeepsPreviousChain() {
        ReportLedger ledger = ledgerWith(3);
        List<Block> before = ledger.exportSnapshot();

        List<Block> candidate = new ArrayList<>(before);
        Block b = candidate.get(2);
        Digest corrupted = Hashes.digest("not the real hash");
        candidate.set(2, new Block(b.index(), b.timestamp(), b.data(), b.previousHash(), corrupted, b.nonce()));

        assertFalse(ledger.loadAndValidate(candidate));
        assertEquals(before, ledger.exportSnapshot());
        assertTrue(ledger.isValid());
    }

    @Test
    void rejectsCandidateWithCorruptedGenesisHash() {
        ReportLedger ledger = ledgerWith(1);
        List<Block> before = ledger.exportSnapshot();
        Block g = ledger.genesis();

        List<Block> candidate = List.of(
                new Block(0, g.timestamp(), g.data(), g.previousHash(), Hashes.digest("corrupt"), 0));

        assertFalse(ledger.loadAndValidate(candidate));
        assertEquals(before, ledger.exportSnapshot());
        assertEquals(GenesisBuilder.buildGenesis().hash(), ledger.genesis().hash());
    }

    @Test
    void rejectsCandidateWithAlteredGenesisPayload() {
        ReportLedger ledger = ledgerWith(1);
        List<Block> candidate = new ArrayList<>(ledger.exportSnapshot());
        Block g = candidate.get(0);
        candidate.set(0, new Block(0, g.timestamp(), g.data().toBuilder().category("FORGED").build(),
                g.previousHash(), g.hash(), g.nonce()));

        assertFalse(ledger.loadAndValidate(candidate));
        assertEquals("SYSTEM", ledger.genesis().data().category());
        assertTrue(ledger.isValid());
    }

    @Test
    void rejectsCandidateBuiltOnResealedGenesis() {
        Block g = GenesisBuilder.buildGenesis();
        BlockPayload forgedData = g.data().toBuilder().category("FORGED").build();
        Digest forgedHash = Block.computeHash(0, g.timestamp(), forgedData, Digest.ZERO, 0);
        Block forgedGenesis = new Block(0, g.timestamp(), forgedData, Digest.ZERO, forgedHash, 0);

        BlockPayload next = payload("R1");
        ProofOfWork.Seal seal = new ProofOfWork(2).mine(1, 5L, next, forgedHash);
        List<Block> candidate = List.of(forgedGenesis, new Block(1, 5L, next, forgedHash, seal.hash(), seal.nonce()));
        assertTrue(ChainValidator.isValid(candidate));

        ReportLedger ledger = new ReportLedger(LedgerConfig.defaultLocal(), CLOCK);
        assertFalse(ledger.loadAndValidate(candidate));
        assertEquals(1, ledger.length());
        assertEquals(g, ledger.genesis());
    }

    @Test
    void rejectsEmptyOrNullCandidate() {
        ReportLedger ledger = ledgerWith(1);

        assertFalse(ledger.loadAndValidate(null));
        assertFalse(ledger.loadAndValidate(List.of()));
        assertEquals(2, ledger.length());
    }

    @Test
    void findsReportByIdOrReturnsEmpty() {
        ReportLedger ledger = new ReportLedger(LedgerConfig.defaultLocal(), CLOCK);
        Block r1 = ledger.append(payload("R1"));
        ledger.append(payload("R2"));

        assertEquals(Optional.of(r1), ledger.findByReportId("R1"));
        assertTrue(ledger.findByReportId("missing").isEmpty());
        assertTrue(ledger.findByReportId(null).isEmpty());
    }

    @Test
    void getBlockByIndex() {
        ReportLedger ledger = ledgerWith(2);

        assertEquals(ledger.genesis(), ledger.getBlock(0).orElseThrow());
        assertEquals(ledger.latest(), ledger.getBlock(2).orElseThrow());
        assertTrue(ledger.getBlock(3).isEmpty());
        assertTrue(ledger.getBlock(-1).isEmpty());
    }

    @Test
    void exportedSnapshotIsReadOnly() {
        ReportLedger ledger = ledgerWith(1);
        List<Block> snapshot = ledger.exportSnapshot();

        assertThrows(UnsupportedOperationException.class, () -> snapshot.remove(1));
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(ledger.genesis()));
        assertEquals(2, ledger.length());
    }

    @Test
    void endToEndStreetlightReport() {
        ReportLedger ledger = new ReportLedger(LedgerConfig.defaultLocal());
        assertEquals(1, ledger.length());
        Block genesis = ledger.latest();

        ledger.append(BlockPayload.builder()
                .reportId("R1")
                .category("Infrastructure")
                .urgency(Urgency.MEDIUM)
                .location(new Location("Ward 5", "Station Road", "Central"))
                .descriptionHash(Hashes.digest("broken streetlight"))
                .anonymous()
                .build());

        assertEquals(2, ledger.length());
        assertEquals(1L, ledger.latest().index());
        assertEquals(genesis.hash(), ledger.latest().previousHash());
        assertEquals(Optional.of(ledger.latest()), ledger.findByReportId("R1"));
        assertTrue(ledger.isValid());
    }

    @Test
    void concurrentAppendsStayLinked() throws Exception {
        ReportLedger ledger = new ReportLedger(LedgerConfig.defaultLocal());
        int threads = 4;
        int perThread = 5;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int id = t;
                futures.add(pool.submit(() -> {
                    go.await();
                    for (int i = 0; i < perThread; i++) {
                        ledger.append(payload("T" + id + "-" + i));
                        ledger.isValid();
                    }
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> f : futures) {
                f.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(threads * perThread + 1, ledger.length());
        assertTrue(ledger.isValid());
    }

    private static ReportLedger ledgerWith(int blocks) {
        ReportLedger ledger = new ReportLedger(LedgerConfig.defaultLocal(), CLOCK);
        for (int i = 0; i < blocks; i++) {
            ledger.append(payload("R" + i));
        }
        return ledger;
    }

    private static BlockPayload payload(String reportId) {
        return BlockPayload.builder()
                .reportId(reportId)
                .category("Infrastructure")
                .urgency(Urgency.MEDIUM)
                .location(new Location("Ward 12", "MG Road", "Central Police Station"))
                .descriptionHash(Hashes.digest("description of " + reportId))
                .evidenceHashes(List.of(Hashes.digest("photo-" + reportId)))
                .anonymous()
                .timestamp(1_740_000_000_000L)
                .authorityRouted(List.of("Municipal Corporation"))
                .status(ReportStatus.PENDING)
                .build();
    }
}
