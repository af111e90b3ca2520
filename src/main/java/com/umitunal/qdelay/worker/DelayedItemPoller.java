package com.umitunal.qdelay.worker;

import com.umitunal.qdelay.core.DelayedQueue;
import com.umitunal.qdelay.model.JobDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Polls the delayed queue and hands every due job to the executor.
 *
 * <p>Several pollers may drain the same store at once; each pop removes a job
 * for exactly one of them. A popped job is gone from the delayed queue even
 * when the executor fails: retrying belongs to the execution engine.
 */
public class DelayedItemPoller implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(DelayedItemPoller.class);

    private final String pollerId;
    private final DelayedQueue queue;
    private final JobExecutor executor;
    private final Clock clock;
    private final long pollInterval;
    private final AtomicBoolean running;
    private final AtomicLong handedOverCount;
    private final AtomicLong failedCount;

    private Thread pollerThread;

    private DelayedItemPoller(Builder builder) {
        this.pollerId = builder.pollerId;
        this.queue = builder.queue;
        this.executor = builder.executor;
        this.clock = builder.clock;
        this.pollInterval = builder.pollInterval;
        this.running = new AtomicBoolean(false);
        this.handedOverCount = new AtomicLong(0);
        this.failedCount = new AtomicLong(0);
    }

    /**
     * Start the poller in the background.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            pollerThread = new Thread(this::run, "DelayedItemPoller-" + pollerId);
            pollerThread.setDaemon(false);
            pollerThread.start();
            logger.info("Poller {} started (interval={}ms)", pollerId, pollInterval);
        }
    }

    /**
     * Stop the poller gracefully.
     */
    public void stop() {
        if (!running.getAndSet(false)) {
            return;
        }
        if (pollerThread != null) {
            pollerThread.interrupt();
            try {
                pollerThread.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        logger.info("Poller {} stopped after handing over {} jobs ({} failed)",
                pollerId, handedOverCount.get(), failedCount.get());
    }

    /**
     * Drain every timestamp that is due now, oldest first.
     *
     * @return number of jobs handed to the executor
     */
    public long handleDelayedItems() throws Exception {
        long handled = 0;
        OptionalLong previous = OptionalLong.empty();

        OptionalLong timestamp;
        while ((timestamp = queue.nextDelayedTimestamp(clock.instant().getEpochSecond())).isPresent()) {
            long drained = enqueueDelayedItemsForTimestamp(timestamp.getAsLong());
            if (drained == 0 && previous.equals(timestamp)) {
                // Nothing left to pop here; let the next pass look again
                break;
            }
            handled += drained;
            previous = timestamp;
        }
        return handled;
    }

    /**
     * Pop every job waiting at {@code timestamp} and hand it over.
     *
     * @return number of jobs popped
     */
    public long enqueueDelayedItemsForTimestamp(long timestamp) throws Exception {
        long drained = 0;
        Optional<JobDescriptor> item;
        while ((item = queue.nextItemForTimestamp(timestamp)).isPresent()) {
            JobDescriptor job = item.get();
            drained++;
            try {
                executor.execute(job.getQueue(), job.getClassName(), job.getArgs());
                handedOverCount.incrementAndGet();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw e;
            } catch (Exception e) {
                failedCount.incrementAndGet();
                logger.warn("Poller {} failed to hand over {} due at {}: {}",
                        pollerId, job, timestamp, e.getMessage(), e);
            }
        }
        return drained;
    }

    private void run() {
        while (running.get()) {
            try {
                handleDelayedItems();
                Thread.sleep(pollInterval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                logger.error("Poller {} error: {}", pollerId, e.getMessage(), e);
            }
        }
    }

    public String getPollerId() { return pollerId; }
    public long getHandedOverCount() { return handedOverCount.get(); }
    public long getFailedCount() { return failedCount.get(); }
    public boolean isRunning() { return running.get(); }

    @Override
    public void close() {
        stop();
    }

    public static Builder builder(String pollerId, DelayedQueue queue, JobExecutor executor) {
        return new Builder(pollerId, queue, executor);
    }

    public static class Builder {
        private final String pollerId;
        private final DelayedQueue queue;
        private final JobExecutor executor;
        private Clock clock = Clock.systemUTC();
        private long pollInterval = 1000;   // 1 second

        private Builder(String pollerId, DelayedQueue queue, JobExecutor executor) {
            this.pollerId = Objects.requireNonNull(pollerId, "pollerId cannot be null");
            this.queue = Objects.requireNonNull(queue, "queue cannot be null");
            this.executor = Objects.requireNonNull(executor, "executor cannot be null");
        }

        public Builder withPollInterval(long millis) {
            this.pollInterval = millis;
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock cannot be null");
            return this;
        }

        public DelayedItemPoller build() {
            return new DelayedItemPoller(this);
        }
    }
}
