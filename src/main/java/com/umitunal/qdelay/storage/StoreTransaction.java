package com.umitunal.qdelay.storage;

import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.Transaction;

/**
 * One optimistic transaction on the store's column family. Every read goes
 * through the transaction's snapshot.
 */
public class StoreTransaction {
    private final Transaction txn;
    private final ReadOptions snapshotReads;
    private final ColumnFamilyHandle columnFamily;

    StoreTransaction(Transaction txn, ReadOptions snapshotReads, ColumnFamilyHandle columnFamily) {
        this.txn = txn;
        this.snapshotReads = snapshotReads;
        this.columnFamily = columnFamily;
    }

    /**
     * Read {@code key} and watch it: the commit fails if another writer
     * changes it first.
     */
    public byte[] getForUpdate(byte[] key) throws RocksDBException {
        return txn.getForUpdate(snapshotReads, columnFamily, key, true);
    }

    public byte[] get(byte[] key) throws RocksDBException {
        return txn.get(columnFamily, snapshotReads, key);
    }

    /**
     * Iterator over the snapshot merged with this transaction's own writes.
     * Callers must close it.
     */
    public RocksIterator newIterator() {
        return txn.getIterator(snapshotReads, columnFamily);
    }

    public void put(byte[] key, byte[] value) throws RocksDBException {
        txn.put(columnFamily, key, value);
    }

    public void delete(byte[] key) throws RocksDBException {
        txn.delete(columnFamily, key);
    }

    void commit() throws RocksDBException {
        txn.commit();
    }
}
