package com.umitunal.qdelay.core;

/**
 * Metrics and statistics for delayed queue monitoring.
 */
public class QueueMetrics {
    private final long scheduledTimestamps;
    private final long scheduledJobs;
    private final long transactionRetries;

    public QueueMetrics(long scheduledTimestamps, long scheduledJobs, long transactionRetries) {
        this.scheduledTimestamps = scheduledTimestamps;
        this.scheduledJobs = scheduledJobs;
        this.transactionRetries = transactionRetries;
    }

    public long getScheduledTimestamps() { return scheduledTimestamps; }
    public long getScheduledJobs() { return scheduledJobs; }
    public long getTransactionRetries() { return transactionRetries; }

    @Override
    public String toString() {
        return String.format(
            "QueueMetrics{timestamps=%d, jobs=%d, txnRetries=%d}",
            scheduledTimestamps, scheduledJobs, transactionRetries
        );
    }
}
