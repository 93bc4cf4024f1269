package io.civicledger.core.ledger;

import io.civicledger.core.consensus.ChainValidator;
import io.civicledger.core.consensus.ProofOfWork;
import io.civicledger.core.metrics.LedgerMetrics;
import io.civicledger.core.protocol.Block;
import io.civicledger.core.protocol.BlockPayload;
import io.civicledger.core.protocol.IntegrityError;
import io.civicledger.core.protocol.ValidationResult;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Logger;

/**
 * Append-only, hash-linked ledger of report submissions.
 *
 * The chain always holds at least the genesis block and only changes by {@link #append}
 * or by a validated {@link #loadAndValidate} replacement. Writers take the write lock,
 * so appends are serialized; reads may run concurrently with each other.
 *
 * Persistence is the caller's job: snapshot {@link #exportSnapshot()} after an append.
 */
public final class ReportLedger {
    private static final Logger LOG = Logger.getLogger(ReportLedger.class.getName());

    private final ProofOfWork pow;
    private final Clock clock;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private List<Block> chain;

    public ReportLedger(LedgerConfig config, Clock clock) {
        this.pow = new ProofOfWork(config.difficulty);
        this.clock = clock;
        this.chain = new ArrayList<>();
        this.chain.add(GenesisBuilder.buildGenesis());
    }

    public ReportLedger(LedgerConfig config) {
        this(config, Clock.systemUTC());
    }

    public int difficulty() { return pow.difficulty(); }

    /**
     * Mine and append one block for the payload.
     * The returned block's index is exactly one past the previous latest block.
     */
    public Block append(BlockPayload payload) {
        if (payload == null) throw new IllegalArgumentException("payload must not be null");
        lock.writeLock().lock();
        try {
            Block previous = chain.get(chain.size() - 1);
            long index = previous.index() + 1;
            long timestamp = clock.millis();

            ProofOfWork.Seal seal = LedgerMetrics.recordMining(
                    () -> pow.mine(index, timestamp, payload, previous.hash()));

            Block block = new Block(index, timestamp, payload, previous.hash(), seal.hash(), seal.nonce());
            chain.add(block);
            LedgerMetrics.recordAppend(seal.attempts());
            LOG.fine(() -> "Appended block " + index + " for report " + payload.reportId()
                    + " after " + seal.attempts() + " attempts");
            return block;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public ValidationResult validate() {
        lock.readLock().lock();
        try {
            ValidationResult result = ChainValidator.validate(chain);
            if (!result.ok) {
                LedgerMetrics.incrementIntegrityFailures();
                LOG.severe("TAMPERING DETECTED: " + result);
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isValid() {
        return validate().ok;
    }

    /**
     * Replace the active chain with {@code candidate} only if it starts at the fixed genesis
     * block and validates. On failure the previous chain stays active.
     */
    public boolean loadAndValidate(List<Block> candidate) {
        if (candidate == null || candidate.isEmpty()) {
            LOG.warning("Refusing to load an empty chain");
            return false;
        }
        List<Block> copy = new ArrayList<>(candidate);
        lock.writeLock().lock();
        try {
            ValidationResult result = ChainValidator.validate(copy);
            if (result.ok && !GenesisBuilder.buildGenesis().equals(copy.get(0))) {
                result = ValidationResult.error(IntegrityError.GENESIS_MISMATCH, 0L,
                        "Block 0 is not the genesis block");
            }
            if (!result.ok) {
                LedgerMetrics.incrementIntegrityFailures();
                LOG.severe("Loaded chain is invalid, keeping current chain: " + result);
                return false;
            }
            this.chain = copy;
            LOG.info("Loaded chain of " + copy.size() + " blocks");
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Block latest() {
        lock.readLock().lock();
        try {
            return chain.get(chain.size() - 1);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Block genesis() {
        lock.readLock().lock();
        try {
            return chain.get(0);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int length() {
        lock.readLock().lock();
        try {
            return chain.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** First block whose payload carries {@code reportId}; empty when the id is unknown. */
    public Optional<Block> findByReportId(String reportId) {
        if (reportId == null) return Optional.empty();
        lock.readLock().lock();
        try {
            for (Block block : chain) {
                if (reportId.equals(block.data().reportId())) {
                    return Optional.of(block);
                }
            }
            return Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Block> getBlock(long index) {
        lock.readLock().lock();
        try {
            if (index < 0 || index >= chain.size()) return Optional.empty();
            return Optional.of(chain.get((int) index));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Read-only copy of the whole chain, genesis first. */
    public List<Block> exportSnapshot() {
        lock.readLock().lock();
        try {
            return List.copyOf(chain);
        } finally {
            lock.readLock().unlock();
        }
    }
}
