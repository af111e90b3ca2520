package com.umitunal.qdelay.scheduler;

import com.umitunal.qdelay.config.SchedulerConfig;
import com.umitunal.qdelay.core.DelayedQueue;
import com.umitunal.qdelay.core.NoClassException;
import com.umitunal.qdelay.core.NoQueueException;
import com.umitunal.qdelay.model.JobDescriptor;
import com.umitunal.qdelay.worker.JobExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Entry point for scheduling one-off jobs at or after a given time.
 *
 * <p>{@code enqueueAt} validates the job, runs the before-schedule hooks and
 * then either stores the job in the delayed queue or, in inline mode, hands it
 * straight to the executor. Until its timestamp has passed a stored job sits
 * in the delayed queue.
 *
 * <pre>{@code
 * JobScheduler scheduler = JobScheduler.builder(queue, QueueResolver.constant("mail"))
 *         .withHook(auditHook)
 *         .build();
 * scheduler.enqueueIn(300, "SendReminder", "user-42");
 * }</pre>
 */
public class JobScheduler {
    private static final Logger logger = LoggerFactory.getLogger(JobScheduler.class);

    private final DelayedQueue queue;
    private final QueueResolver queueResolver;
    private final JobExecutor executor;
    private final List<ScheduleHook> hooks;
    private final SchedulerConfig config;

    private JobScheduler(Builder builder) {
        this.queue = builder.queue;
        this.queueResolver = builder.queueResolver;
        this.executor = builder.executor;
        this.hooks = Collections.unmodifiableList(new ArrayList<>(builder.hooks));
        this.config = builder.config;
    }

    /**
     * Schedule a job on the queue its class resolves to.
     *
     * @param timestamp due time in epoch seconds
     * @return false if a before-schedule hook rejected the job
     * @throws NoClassException if className is empty
     * @throws NoQueueException if className resolves to no queue
     */
    public boolean enqueueAt(long timestamp, String className, Object... args) throws Exception {
        validateJob(className);
        return enqueueAtWithQueue(queueResolver.queueFor(className), timestamp, className, args);
    }

    public boolean enqueueAt(Instant timestamp, String className, Object... args) throws Exception {
        return enqueueAt(timestamp.getEpochSecond(), className, args);
    }

    /**
     * Same as {@link #enqueueAt(long, String, Object...)} but on an explicit queue.
     * Respects inline mode by running the job right away instead of storing it.
     */
    public boolean enqueueAtWithQueue(String queueName, long timestamp, String className, Object... args)
            throws Exception {
        if (className == null || className.isEmpty()) {
            throw new NoClassException("Jobs must be given a class.");
        }
        if (queueName == null || queueName.isEmpty()) {
            throw new NoQueueException("Jobs must be placed onto a queue.");
        }

        List<Object> argList = toList(args);
        for (ScheduleHook hook : hooks) {
            if (!hook.beforeSchedule(className, argList)) {
                logger.debug("Schedule of {} at {} rejected by {}", className, timestamp, hook);
                return false;
            }
        }

        if (config.isInline()) {
            executor.execute(queueName, className, argList);
        } else {
            queue.push(timestamp, new JobDescriptor(className, queueName, argList));
        }

        for (ScheduleHook hook : hooks) {
            hook.afterSchedule(className, argList);
        }
        return true;
    }

    /**
     * Schedule a job {@code seconds} from now.
     */
    public boolean enqueueIn(long seconds, String className, Object... args) throws Exception {
        return enqueueAt(now() + seconds, className, args);
    }

    public boolean enqueueIn(Duration delay, String className, Object... args) throws Exception {
        return enqueueAt(config.getClock().instant().plus(delay), className, args);
    }

    /**
     * Schedule a job {@code seconds} from now on an explicit queue.
     */
    public boolean enqueueInWithQueue(String queueName, long seconds, String className, Object... args)
            throws Exception {
        return enqueueAtWithQueue(queueName, now() + seconds, className, args);
    }

    /**
     * Remove every waiting occurrence of a job, whatever its due time.
     * Walks every bucket; see {@link DelayedQueue#removeMatching}.
     *
     * @return number of occurrences removed
     */
    public long removeDelayed(String className, Object... args) throws Exception {
        return queue.removeMatching(toDescriptor(className, args));
    }

    /**
     * Remove every occurrence of a job due at {@code timestamp}.
     *
     * @return number of occurrences removed
     */
    public long removeDelayedJobFromTimestamp(long timestamp, String className, Object... args) throws Exception {
        return queue.removeMatchingAt(timestamp, toDescriptor(className, args));
    }

    public DelayedQueue getQueue() {
        return queue;
    }

    private JobDescriptor toDescriptor(String className, Object[] args) {
        return new JobDescriptor(className, queueResolver.queueFor(className), toList(args));
    }

    private void validateJob(String className) {
        if (className == null || className.isEmpty()) {
            throw new NoClassException("Jobs must be given a class.");
        }
        if (queueResolver.queueFor(className) == null) {
            throw new NoQueueException("Jobs must be placed onto a queue.");
        }
    }

    private long now() {
        return config.getClock().instant().getEpochSecond();
    }

    private static List<Object> toList(Object[] args) {
        return args == null ? Collections.emptyList() : Arrays.asList(args);
    }

    public static Builder builder(DelayedQueue queue, QueueResolver queueResolver) {
        return new Builder(queue, queueResolver);
    }

    public static class Builder {
        private final DelayedQueue queue;
        private final QueueResolver queueResolver;
        private final List<ScheduleHook> hooks = new ArrayList<>();
        private JobExecutor executor;
        private SchedulerConfig config = SchedulerConfig.defaults();

        private Builder(DelayedQueue queue, QueueResolver queueResolver) {
            this.queue = Objects.requireNonNull(queue, "queue cannot be null");
            this.queueResolver = Objects.requireNonNull(queueResolver, "queueResolver cannot be null");
        }

        /**
         * Executor used in inline mode.
         */
        public Builder withExecutor(JobExecutor executor) {
            this.executor = executor;
            return this;
        }

        public Builder withHook(ScheduleHook hook) {
            this.hooks.add(Objects.requireNonNull(hook, "hook cannot be null"));
            return this;
        }

        public Builder withConfig(SchedulerConfig config) {
            this.config = Objects.requireNonNull(config, "config cannot be null");
            return this;
        }

        public JobScheduler build() {
            if (config.isInline() && executor == null) {
                throw new IllegalStateException("Inline mode requires an executor");
            }
            return new JobScheduler(this);
        }
    }
}
