package com.umitunal.qdelay.core;

import com.umitunal.qdelay.model.JobDescriptor;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Persistent, time-ordered store of jobs that are not yet due.
 *
 * <p>Jobs are grouped into buckets, one per due second. Within a bucket jobs
 * are popped in insertion order. An index of due timestamps finds the next
 * eligible bucket. Timestamps are Unix epoch seconds; the {@link Instant}
 * overloads drop sub-second precision.
 *
 * <p>Any number of threads or queue instances may share the same store.
 */
public interface DelayedQueue {

    /**
     * Append a job to the bucket for {@code timestamp} and make sure the
     * timestamp is indexed.
     *
     * @return true if no identical job was already waiting at that timestamp
     */
    boolean push(long timestamp, JobDescriptor job) throws Exception;

    default boolean push(Instant timestamp, JobDescriptor job) throws Exception {
        return push(timestamp.getEpochSecond(), job);
    }

    /**
     * Due timestamps in ascending order, starting at index offset {@code start}.
     * For inspection only; nothing is consumed.
     */
    List<Long> peek(int start, int count) throws Exception;

    /**
     * Number of distinct due timestamps currently indexed.
     */
    long delayedQueueScheduleSize() throws Exception;

    /**
     * Number of jobs waiting at exactly {@code timestamp}, 0 if none.
     */
    long bucketSize(long timestamp) throws Exception;

    /**
     * Up to {@code count} jobs of the bucket at {@code timestamp}, starting at
     * offset {@code start}, without removing them.
     */
    List<JobDescriptor> bucketPeek(long timestamp, int start, int count) throws Exception;

    /**
     * Smallest indexed timestamp that is due now.
     */
    OptionalLong nextDelayedTimestamp() throws Exception;

    /**
     * Smallest indexed timestamp less than or equal to {@code atTime}.
     */
    OptionalLong nextDelayedTimestamp(long atTime) throws Exception;

    /**
     * Remove and return the oldest job of the bucket at {@code timestamp}. A
     * bucket emptied by this call is deleted together with its index entry,
     * unless another writer refilled it in the meantime.
     */
    Optional<JobDescriptor> nextItemForTimestamp(long timestamp) throws Exception;

    /**
     * Delete every bucket referenced by the index, then the index itself.
     */
    void resetDelayedQueue() throws Exception;

    /**
     * Remove every occurrence of {@code job} across all timestamps.
     *
     * <p>This walks every bucket in the store. There is no reverse index from
     * job to timestamps, so keep it for rare administrative use.
     *
     * @return number of occurrences removed
     */
    long removeMatching(JobDescriptor job) throws Exception;

    /**
     * Remove every occurrence of {@code job} from the bucket at {@code timestamp}.
     *
     * @return number of occurrences removed
     */
    long removeMatchingAt(long timestamp, JobDescriptor job) throws Exception;

    /**
     * Total number of waiting jobs, summed over every indexed bucket.
     */
    long countAllScheduledJobs() throws Exception;

    /**
     * Get statistics about the queue.
     */
    QueueMetrics getMetrics() throws Exception;
}
