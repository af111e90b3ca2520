package com.umitunal.qdelay.storage;

import com.umitunal.qdelay.core.DelayedQueue;
import com.umitunal.qdelay.core.QueueMetrics;
import com.umitunal.qdelay.model.JobDescriptor;
import com.umitunal.qdelay.serialization.JsonCodec;
import com.umitunal.qdelay.serialization.PayloadCodec;
import org.rocksdb.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * RocksDB-backed implementation of DelayedQueue.
 *
 * <p>Every bucket mutation runs in an optimistic transaction that watches the
 * bucket header, so a push, pop or removal that races with another writer of
 * the same timestamp is re-run against the new state. Removing a bucket that
 * became empty is a separate transaction: it re-reads the header under watch
 * and deletes header and index entry together only if the bucket is still
 * empty at commit time. If a concurrent push refilled it, the cleanup does
 * nothing and the bucket survives.
 */
public class RocksDelayedQueue implements DelayedQueue {
    private static final Logger logger = LoggerFactory.getLogger(RocksDelayedQueue.class);

    private final RocksStore store;
    private final PayloadCodec<JobDescriptor> codec;
    private final Clock clock;

    public RocksDelayedQueue(RocksStore store) {
        this(store, new JsonCodec<>(JobDescriptor.class), Clock.systemUTC());
    }

    public RocksDelayedQueue(RocksStore store, Clock clock) {
        this(store, new JsonCodec<>(JobDescriptor.class), clock);
    }

    public RocksDelayedQueue(RocksStore store, PayloadCodec<JobDescriptor> codec, Clock clock) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.codec = Objects.requireNonNull(codec, "codec cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    @Override
    public boolean push(long timestamp, JobDescriptor job) throws RocksDBException {
        Objects.requireNonNull(job, "job cannot be null");
        byte[] encoded = codec.encode(job);
        byte[] bucketKey = StoreKeys.bucket(timestamp);

        boolean first = store.inTransaction("push", txn -> {
            BucketHeader header = BucketHeader.decode(txn.getForUpdate(bucketKey));
            boolean alreadyQueued = header.length() > 0 && containsItem(txn, timestamp, encoded);

            // Duplicates are appended; the index entry is per timestamp and idempotent
            txn.put(StoreKeys.item(timestamp, header.nextSequence()), encoded);
            txn.put(bucketKey, header.appended().encode());
            txn.put(StoreKeys.index(timestamp), StoreKeys.EMPTY);
            return !alreadyQueued;
        });

        logger.debug("Pushed {} at {} (first={})", job, timestamp, first);
        return first;
    }

    @Override
    public List<Long> peek(int start, int count) {
        List<Long> timestamps = new ArrayList<>();
        if (count <= 0 || start < 0) {
            return timestamps;
        }

        try (final RocksIterator iter = store.newScanIterator()) {
            int offset = 0;
            for (iter.seek(StoreKeys.DELAYED_QUEUE_SCHEDULE);
                 iter.isValid() && StoreKeys.startsWith(iter.key(), StoreKeys.DELAYED_QUEUE_SCHEDULE)
                         && timestamps.size() < count;
                 iter.next()) {
                if (offset++ >= start) {
                    timestamps.add(StoreKeys.timestampOf(iter.key(), StoreKeys.DELAYED_QUEUE_SCHEDULE));
                }
            }
        }
        return timestamps;
    }

    @Override
    public long delayedQueueScheduleSize() {
        return indexedTimestamps().size();
    }

    @Override
    public long bucketSize(long timestamp) throws RocksDBException {
        return BucketHeader.decode(store.get(StoreKeys.bucket(timestamp))).length();
    }

    @Override
    public List<JobDescriptor> bucketPeek(long timestamp, int start, int count) {
        List<JobDescriptor> jobs = new ArrayList<>();
        if (count <= 0 || start < 0) {
            return jobs;
        }

        byte[] prefix = StoreKeys.itemPrefix(timestamp);
        try (final RocksIterator iter = store.newScanIterator()) {
            int offset = 0;
            for (iter.seek(prefix);
                 iter.isValid() && StoreKeys.startsWith(iter.key(), prefix) && jobs.size() < count;
                 iter.next()) {
                if (offset++ >= start) {
                    jobs.add(codec.decode(iter.value()));
                }
            }
        }
        return jobs;
    }

    @Override
    public OptionalLong nextDelayedTimestamp() {
        return nextDelayedTimestamp(clock.instant().getEpochSecond());
    }

    @Override
    public OptionalLong nextDelayedTimestamp(long atTime) {
        try (final RocksIterator iter = store.newScanIterator()) {
            iter.seek(StoreKeys.DELAYED_QUEUE_SCHEDULE);
            if (iter.isValid() && StoreKeys.startsWith(iter.key(), StoreKeys.DELAYED_QUEUE_SCHEDULE)) {
                long timestamp = StoreKeys.timestampOf(iter.key(), StoreKeys.DELAYED_QUEUE_SCHEDULE);
                if (timestamp <= atTime) {
                    return OptionalLong.of(timestamp);
                }
            }
        }
        return OptionalLong.empty();
    }

    @Override
    public Optional<JobDescriptor> nextItemForTimestamp(long timestamp) throws RocksDBException {
        byte[] bucketKey = StoreKeys.bucket(timestamp);
        byte[] prefix = StoreKeys.itemPrefix(timestamp);

        byte[] encoded = store.inTransaction("pop", txn -> {
            byte[] raw = txn.getForUpdate(bucketKey);
            BucketHeader header = BucketHeader.decode(raw);
            if (header.length() == 0) {
                return null;
            }

            byte[] headKey;
            byte[] value;
            try (final RocksIterator iter = txn.newIterator()) {
                iter.seek(prefix);
                if (!iter.isValid() || !StoreKeys.startsWith(iter.key(), prefix)) {
                    throw new IllegalStateException("Bucket " + timestamp + " claims "
                            + header.length() + " entries but holds none");
                }
                headKey = iter.key();
                value = iter.value();
            }
            txn.delete(headKey);
            txn.put(bucketKey, header.removed(1).encode());
            return value;
        });

        // Also reached when an earlier cleanup never ran and left an empty header behind
        cleanUpBucket(timestamp);

        if (encoded == null) {
            return Optional.empty();
        }
        JobDescriptor job = codec.decode(encoded);
        logger.debug("Popped {} from {}", job, timestamp);
        return Optional.of(job);
    }

    @Override
    public void resetDelayedQueue() throws RocksDBException {
        // Each bucket goes together with its own index entry, under watch of its header
        List<Long> timestamps = indexedTimestamps();
        for (long timestamp : timestamps) {
            deleteBucket(timestamp);
        }

        logger.info("Reset delayed queue, dropped {} buckets", timestamps.size());
    }

    @Override
    public long removeMatching(JobDescriptor job) throws RocksDBException {
        byte[] encoded = codec.encode(job);

        // No reverse index exists: every bucket header in the store is visited
        List<Long> timestamps = new ArrayList<>();
        try (final RocksIterator iter = store.newScanIterator()) {
            for (iter.seek(StoreKeys.DELAYED);
                 iter.isValid() && StoreKeys.startsWith(iter.key(), StoreKeys.DELAYED);
                 iter.next()) {
                timestamps.add(StoreKeys.timestampOf(iter.key(), StoreKeys.DELAYED));
            }
        }

        long removed = 0;
        for (long timestamp : timestamps) {
            removed += removeEncodedAt(timestamp, encoded);
        }

        logger.debug("Removed {} occurrences of {} across {} buckets", removed, job, timestamps.size());
        return removed;
    }

    @Override
    public long removeMatchingAt(long timestamp, JobDescriptor job) throws RocksDBException {
        long removed = removeEncodedAt(timestamp, codec.encode(job));
        logger.debug("Removed {} occurrences of {} at {}", removed, job, timestamp);
        return removed;
    }

    @Override
    public long countAllScheduledJobs() throws RocksDBException {
        long total = 0;
        for (long timestamp : indexedTimestamps()) {
            total += bucketSize(timestamp);
        }
        return total;
    }

    @Override
    public QueueMetrics getMetrics() throws RocksDBException {
        long timestamps = 0;
        long jobs = 0;
        for (long timestamp : indexedTimestamps()) {
            timestamps++;
            jobs += bucketSize(timestamp);
        }
        return new QueueMetrics(timestamps, jobs, store.getTransactionRetryCount());
    }

    private long removeEncodedAt(long timestamp, byte[] encoded) throws RocksDBException {
        byte[] bucketKey = StoreKeys.bucket(timestamp);
        byte[] prefix = StoreKeys.itemPrefix(timestamp);

        long removed = store.inTransaction("remove", txn -> {
            BucketHeader header = BucketHeader.decode(txn.getForUpdate(bucketKey));
            if (header.length() == 0) {
                return 0L;
            }

            List<byte[]> matches = new ArrayList<>();
            try (final RocksIterator iter = txn.newIterator()) {
                for (iter.seek(prefix); iter.isValid() && StoreKeys.startsWith(iter.key(), prefix); iter.next()) {
                    if (Arrays.equals(iter.value(), encoded)) {
                        matches.add(iter.key());
                    }
                }
            }
            for (byte[] key : matches) {
                txn.delete(key);
            }
            if (!matches.isEmpty()) {
                txn.put(bucketKey, header.removed(matches.size()).encode());
            }
            return (long) matches.size();
        });

        if (removed > 0) {
            cleanUpBucket(timestamp);
        }
        return removed;
    }

    /**
     * Delete the bucket header and its index entry if the bucket is empty at
     * commit time. Losing the race to a concurrent push leaves both in place.
     */
    private void cleanUpBucket(long timestamp) throws RocksDBException {
        byte[] bucketKey = StoreKeys.bucket(timestamp);
        byte[] indexKey = StoreKeys.index(timestamp);

        store.commitIfUnchanged("cleanup of " + timestamp, txn -> {
            byte[] raw = txn.getForUpdate(bucketKey);
            if (raw == null) {
                // Index entry left behind without a bucket
                if (txn.get(indexKey) != null) {
                    txn.delete(indexKey);
                }
            } else if (BucketHeader.decode(raw).length() == 0) {
                txn.delete(bucketKey);
                txn.delete(indexKey);
                logger.debug("Removed empty bucket {}", timestamp);
            }
            return null;
        });
    }

    private void deleteBucket(long timestamp) throws RocksDBException {
        byte[] bucketKey = StoreKeys.bucket(timestamp);
        byte[] prefix = StoreKeys.itemPrefix(timestamp);

        store.inTransaction("reset", txn -> {
            txn.getForUpdate(bucketKey);
            List<byte[]> keys = new ArrayList<>();
            try (final RocksIterator iter = txn.newIterator()) {
                for (iter.seek(prefix); iter.isValid() && StoreKeys.startsWith(iter.key(), prefix); iter.next()) {
                    keys.add(iter.key());
                }
            }
            for (byte[] key : keys) {
                txn.delete(key);
            }
            txn.delete(bucketKey);
            txn.delete(StoreKeys.index(timestamp));
            return null;
        });
    }

    private boolean containsItem(StoreTransaction txn, long timestamp, byte[] encoded) {
        byte[] prefix = StoreKeys.itemPrefix(timestamp);
        try (final RocksIterator iter = txn.newIterator()) {
            for (iter.seek(prefix); iter.isValid() && StoreKeys.startsWith(iter.key(), prefix); iter.next()) {
                if (Arrays.equals(iter.value(), encoded)) {
                    return true;
                }
            }
        }
        return false;
    }

    private List<Long> indexedTimestamps() {
        List<Long> timestamps = new ArrayList<>();
        try (final RocksIterator iter = store.newScanIterator()) {
            for (iter.seek(StoreKeys.DELAYED_QUEUE_SCHEDULE);
                 iter.isValid() && StoreKeys.startsWith(iter.key(), StoreKeys.DELAYED_QUEUE_SCHEDULE);
                 iter.next()) {
                timestamps.add(StoreKeys.timestampOf(iter.key(), StoreKeys.DELAYED_QUEUE_SCHEDULE));
            }
        }
        return timestamps;
    }
}
