package com.umitunal.examples;

import com.umitunal.qdelay.config.StorageConfig;
import com.umitunal.qdelay.scheduler.JobScheduler;
import com.umitunal.qdelay.scheduler.QueueResolver;
import com.umitunal.qdelay.storage.RocksDelayedQueue;
import com.umitunal.qdelay.storage.RocksStore;
import com.umitunal.qdelay.worker.DelayedItemPoller;
import com.umitunal.qdelay.worker.JobExecutor;

import java.util.Map;

/**
 * Time-based scheduling example - demonstrates delayed job hand-over.
 */
public class DelayedJobsExample {

    public static void main(String[] args) {
        System.out.println("=== Delayed Jobs Example ===\n");

        StorageConfig config = StorageConfig.newBuilder("/tmp/qdelay-delayed")
                .build();

        try (RocksStore store = new RocksStore(config)) {
            RocksDelayedQueue queue = new RocksDelayedQueue(store);
            queue.resetDelayedQueue();

            JobScheduler scheduler = JobScheduler.builder(queue,
                    QueueResolver.fromMap(Map.of("SendEmail", "mail", "ResizeImage", "media")))
                    .build();

            // Schedule jobs at different times
            scheduler.enqueueIn(0, "SendEmail", "alice@example.com");
            scheduler.enqueueIn(2, "ResizeImage", "cat.png", 640);
            scheduler.enqueueIn(4, "SendEmail", "bob@example.com");

            System.out.println("Scheduled 3 jobs at " + queue.peek(0, 10));
            System.out.println(queue.getMetrics());

            JobExecutor executor = (queueName, className, jobArgs) ->
                    System.out.println("  -> " + queueName + ": " + className + jobArgs);

            try (DelayedItemPoller poller = DelayedItemPoller.builder("poller-1", queue, executor)
                    .withPollInterval(250)
                    .build()) {
                poller.start();

                System.out.println("\nWaiting 5 seconds...");
                Thread.sleep(5000);

                System.out.println("\nHanded over: " + poller.getHandedOverCount());
            }

            System.out.println(queue.getMetrics());

        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
