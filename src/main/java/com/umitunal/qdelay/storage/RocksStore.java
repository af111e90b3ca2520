package com.umitunal.qdelay.storage;

import com.umitunal.qdelay.config.StorageConfig;
import org.rocksdb.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Shared RocksDB store behind the delayed queue and the schedule registry.
 *
 * <p>The database is opened as an {@link OptimisticTransactionDB}. Reading a
 * key with {@code getForUpdate} inside a transaction watches it: if any other
 * writer commits a change to that key first, this transaction's commit fails
 * with {@code Busy} and nothing it wrote becomes visible.
 *
 * <p>All data lives in the default column family; every read and write names
 * its handle explicitly.
 *
 * <p>One store may be shared by any number of queue and registry instances
 * and threads.
 */
public class RocksStore implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(RocksStore.class);

    private final OptimisticTransactionDB transactionDB;
    private final ColumnFamilyHandle defaultColumnFamily;
    private final WriteOptions writeOpts;
    private final OptimisticTransactionOptions txnOpts;
    private final ReadOptions readOpts;
    private final ReadOptions scanReadOpts;
    private final DBOptions dbOptions;
    private final ColumnFamilyOptions columnFamilyOptions;
    private final BlockBasedTableConfig tableConfig;
    private final Cache blockCache;
    private final Filter bloomFilter;
    private final int transactionRetries;
    private final AtomicLong txnRetryCount = new AtomicLong(0);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public RocksStore(StorageConfig config) throws RocksDBException {
        this.transactionRetries = config.getTransactionRetries();

        RocksDB.loadLibrary();

        File dataDir = new File(config.getDataDirectory());
        if (!dataDir.exists() && !dataDir.mkdirs()) {
            throw new IllegalStateException("Failed to create directory: " + dataDir);
        }

        // Create block cache and bloom filter
        this.blockCache = new LRUCache(64 * 1024 * 1024); // 64MB cache
        this.bloomFilter = new BloomFilter(10, false); // 10 bits per key

        this.tableConfig = new BlockBasedTableConfig()
                .setBlockCache(blockCache)
                .setFilterPolicy(bloomFilter)
                .setCacheIndexAndFilterBlocks(true)
                .setPinL0FilterAndIndexBlocksInCache(true);

        this.columnFamilyOptions = new ColumnFamilyOptions()
                .setCompressionType(CompressionType.LZ4_COMPRESSION)
                .setWriteBufferSize((long) config.getMemoryBufferSizeMB() * 1024 * 1024)
                .setMaxWriteBufferNumber(config.getMaxMemoryBuffers())
                .setTableFormatConfig(tableConfig);

        this.dbOptions = new DBOptions()
                .setCreateIfMissing(true)
                .setMaxBackgroundJobs(config.getBackgroundThreads())
                .setMaxOpenFiles(-1);

        List<ColumnFamilyDescriptor> descriptors = new ArrayList<>();
        descriptors.add(new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY, columnFamilyOptions));
        List<ColumnFamilyHandle> handles = new ArrayList<>();

        try {
            this.transactionDB = OptimisticTransactionDB.open(dbOptions, config.getDataDirectory(),
                    descriptors, handles);
        } catch (RocksDBException e) {
            logger.error("Failed to open store at {}: {}", config.getDataDirectory(), e.getMessage(), e);
            dbOptions.close();
            columnFamilyOptions.close();
            blockCache.close();
            bloomFilter.close();
            throw e;
        }
        this.defaultColumnFamily = handles.get(0);

        this.writeOpts = new WriteOptions()
                .setSync(config.isDurableWrites())
                .setDisableWAL(!config.isDurableWrites());

        // Conflicts are checked against the snapshot taken when the transaction begins
        this.txnOpts = new OptimisticTransactionOptions()
                .setSetSnapshot(true);

        this.readOpts = new ReadOptions();

        // ReadOptions for scans - don't pollute cache with full table scans
        this.scanReadOpts = new ReadOptions()
                .setFillCache(false);

        logger.info("Opened store at {} (durableWrites={})", config.getDataDirectory(), config.isDurableWrites());
    }

    /**
     * Work performed inside one optimistic transaction. Everything the work
     * reads through {@code txn} is consistent with what the commit validates.
     */
    @FunctionalInterface
    public interface TransactionWork<R> {
        R execute(StoreTransaction txn) throws RocksDBException;
    }

    /**
     * Run {@code work} in a transaction and commit it, starting over whenever
     * the commit loses to a concurrent writer.
     *
     * @throws ConcurrentModificationException if every attempt conflicted
     */
    public <R> R inTransaction(String operation, TransactionWork<R> work) throws RocksDBException {
        for (int attempt = 1; ; attempt++) {
            try (Transaction txn = transactionDB.beginTransaction(writeOpts, txnOpts);
                 ReadOptions snapshotReads = new ReadOptions().setSnapshot(txn.getSnapshot())) {
                StoreTransaction storeTxn = new StoreTransaction(txn, snapshotReads, defaultColumnFamily);
                R result = work.execute(storeTxn);
                storeTxn.commit();
                return result;
            } catch (RocksDBException e) {
                if (!isConflict(e)) {
                    throw e;
                }
                txnRetryCount.incrementAndGet();
                if (attempt >= transactionRetries) {
                    logger.warn("{} gave up after {} conflicting attempts", operation, attempt);
                    throw new ConcurrentModificationException(
                            operation + " conflicted " + attempt + " times", e);
                }
                logger.debug("{} conflicted on attempt {}, retrying", operation, attempt);
            }
        }
    }

    /**
     * Run {@code work} in a transaction once. A lost commit is not an error:
     * the transaction is simply discarded.
     *
     * @return true if the transaction committed
     */
    public boolean commitIfUnchanged(String operation, TransactionWork<?> work) throws RocksDBException {
        try (Transaction txn = transactionDB.beginTransaction(writeOpts, txnOpts);
             ReadOptions snapshotReads = new ReadOptions().setSnapshot(txn.getSnapshot())) {
            StoreTransaction storeTxn = new StoreTransaction(txn, snapshotReads, defaultColumnFamily);
            work.execute(storeTxn);
            storeTxn.commit();
            return true;
        } catch (RocksDBException e) {
            if (!isConflict(e)) {
                throw e;
            }
            logger.debug("{} skipped, watched key changed concurrently", operation);
            return false;
        }
    }

    public byte[] get(byte[] key) throws RocksDBException {
        return transactionDB.get(defaultColumnFamily, readOpts, key);
    }

    /**
     * Iterator for range scans outside a transaction. Callers must close it.
     */
    public RocksIterator newScanIterator() {
        return transactionDB.newIterator(defaultColumnFamily, scanReadOpts);
    }

    public ColumnFamilyHandle getDefaultColumnFamily() {
        return defaultColumnFamily;
    }

    /**
     * Get the number of transaction retries that occurred.
     * Useful for monitoring contention.
     */
    public long getTransactionRetryCount() {
        return txnRetryCount.get();
    }

    private static boolean isConflict(RocksDBException e) {
        Status status = e.getStatus();
        if (status == null) {
            return false;
        }
        Status.Code code = status.getCode();
        return code == Status.Code.Busy || code == Status.Code.TryAgain;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        scanReadOpts.close();
        readOpts.close();
        txnOpts.close();
        writeOpts.close();
        // The handle has to go before the database
        defaultColumnFamily.close();
        transactionDB.close();
        dbOptions.close();
        columnFamilyOptions.close();
        blockCache.close();
        bloomFilter.close();
        logger.info("Closed store");
    }
}
