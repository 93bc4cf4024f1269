package io.civicledger.core.storage;

import io.civicledger.core.protocol.Block;
import io.civicledger.core.protocol.BlockCodec;
import org.rocksdb.*;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Persistent SnapshotStore using RocksDB.
 *
 * Layout (column families):
 *  - "blocks" : key = index(8, big-endian), val = block JSON (see BlockCodec)
 *  - "meta"   : key = "count", val = number of blocks(8)
 *               key = "head",  val = hex hash of the last block
 *
 * Snapshots are written in one WriteBatch so a crash leaves either the old or the new chain.
 */
public final class RocksDBSnapshotStore implements SnapshotStore, AutoCloseable {

    static {
        RocksDB.loadLibrary();
    }

    private static final byte[] KEY_COUNT = "count".getBytes(StandardCharsets.UTF_8);
    private static final byte[] KEY_HEAD = "head".getBytes(StandardCharsets.UTF_8);

    private final RocksDB db;
    private final ColumnFamilyHandle cfDefault;
    private final ColumnFamilyHandle cfBlocks;
    private final ColumnFamilyHandle cfMeta;
    private final DBOptions dbOptions;

    private RocksDBSnapshotStore(RocksDB db,
                                 ColumnFamilyHandle cfDefault,
                                 ColumnFamilyHandle cfBlocks,
                                 ColumnFamilyHandle cfMeta,
                                 DBOptions dbOptions) {
        this.db = db;
        this.cfDefault = cfDefault;
        this.cfBlocks = cfBlocks;
        this.cfMeta = cfMeta;
        this.dbOptions = dbOptions;
    }

    /** Factory: open/create a store in the given directory path. */
    public static RocksDBSnapshotStore open(String dataDir) {
        try {
            DBOptions dbOpts = new DBOptions()
                    .setCreateIfMissing(true)
                    .setCreateMissingColumnFamilies(true);

            List<ColumnFamilyDescriptor> cfDescs = List.of(
                    new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY),
                    new ColumnFamilyDescriptor("blocks".getBytes(StandardCharsets.UTF_8)),
                    new ColumnFamilyDescriptor("meta".getBytes(StandardCharsets.UTF_8))
            );
            List<ColumnFamilyHandle> cfHandles = new ArrayList<>();

            RocksDB db = RocksDB.open(dbOpts, dataDir, cfDescs, cfHandles);
            return new RocksDBSnapshotStore(db, cfHandles.get(0), cfHandles.get(1), cfHandles.get(2), dbOpts);
        } catch (RocksDBException e) {
            throw new SnapshotStoreException("Failed to open RocksDB at " + dataDir, e);
        }
    }

    @Override
    public synchronized void save(List<Block> chain) {
        if (chain == null || chain.isEmpty()) {
            throw new IllegalArgumentException("chain must contain at least the genesis block");
        }
        try (WriteOptions wo = new WriteOptions().setSync(true);
             WriteBatch batch = new WriteBatch()) {
            long previousCount = storedCount();
            for (int i = 0; i < chain.size(); i++) {
                batch.put(cfBlocks, longToBytes(i), BlockCodec.toBytes(chain.get(i)));
            }
            // drop leftovers from a longer snapshot
            for (long i = chain.size(); i < previousCount; i++) {
                batch.delete(cfBlocks, longToBytes(i));
            }
            batch.put(cfMeta, KEY_COUNT, longToBytes(chain.size()));
            batch.put(cfMeta, KEY_HEAD, chain.get(chain.size() - 1).hash().hex().getBytes(StandardCharsets.UTF_8));
            db.write(wo, batch);
        } catch (RocksDBException e) {
            throw new SnapshotStoreException("save failed", e);
        }
    }

    @Override
    public synchronized Optional<List<Block>> load() {
        try {
            long count = storedCount();
            if (count <= 0) return Optional.empty();
            List<Block> blocks = new ArrayList<>((int) count);
            for (long i = 0; i < count; i++) {
                byte[] body = db.get(cfBlocks, longToBytes(i));
                if (body == null) {
                    throw new SnapshotStoreException("Snapshot is missing block " + i + " of " + count, null);
                }
                blocks.add(BlockCodec.fromBytes(body));
            }
            return Optional.of(blocks);
        } catch (RocksDBException e) {
            throw new SnapshotStoreException("load failed", e);
        }
    }

    /** Hex hash of the last saved block, if any. */
    public synchronized Optional<String> headHash() {
        try {
            byte[] head = db.get(cfMeta, KEY_HEAD);
            return head == null ? Optional.empty() : Optional.of(new String(head, StandardCharsets.UTF_8));
        } catch (RocksDBException e) {
            throw new SnapshotStoreException("headHash failed", e);
        }
    }

    @Override
    public void close() {
        // Close CF handles first, then DB/options
        cfBlocks.close();
        cfMeta.close();
        cfDefault.close();
        db.close();
        dbOptions.close();
    }

    private long storedCount() throws RocksDBException {
        byte[] count = db.get(cfMeta, KEY_COUNT);
        return count == null ? 0L : bytesToLong(count);
    }

    private static byte[] longToBytes(long v) {
        ByteBuffer b = ByteBuffer.allocate(8);
        b.putLong(v);
        return b.array();
    }

    private static long bytesToLong(byte[] a) {
        ByteBuffer b = ByteBuffer.wrap(a);
        return b.getLong();
    }
}
