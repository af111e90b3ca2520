package com.umitunal.examples;

import com.umitunal.qdelay.config.SchedulerConfig;
import com.umitunal.qdelay.config.StorageConfig;
import com.umitunal.qdelay.model.ScheduleDefinition;
import com.umitunal.qdelay.scheduler.ScheduleCache;
import com.umitunal.qdelay.storage.RocksScheduleRegistry;
import com.umitunal.qdelay.storage.RocksStore;

import java.util.Map;

/**
 * Schedule registry example - demonstrates dynamic schedules and live reload.
 */
public class DynamicScheduleExample {

    public static void main(String[] args) {
        System.out.println("=== Dynamic Schedule Example ===\n");

        StorageConfig config = StorageConfig.newBuilder("/tmp/qdelay-schedules")
                .build();

        try (RocksStore store = new RocksStore(config)) {
            RocksScheduleRegistry registry = new RocksScheduleRegistry(store);

            // Process A owns the configuration and publishes it
            ScheduleCache publisher = new ScheduleCache(registry,
                    SchedulerConfig.newBuilder().withDynamic(true).build());
            publisher.setSchedulesFromRaw(Map.of(
                    "MakeTea", Map.of("every", "1m"),
                    "clear_cache", Map.of(
                            "cron", "0 * * * *",
                            "class", "ClearCache",
                            "args", "all",
                            "rails_envs", "production,staging",
                            "description", "Hourly cache flush")));

            // Process B keeps a live copy
            ScheduleCache follower = new ScheduleCache(registry, SchedulerConfig.defaults());
            System.out.println("Loaded: " + follower.reload().keySet());
            registry.popChangedScheduleNames();

            registry.setSchedule("send_digest", ScheduleDefinition.builder()
                    .cron("0 8 * * *")
                    .className("SendDigest")
                    .queue("mail")
                    .build());
            registry.removeSchedule("MakeTea");

            System.out.println("Changed: " + follower.applyChanges());
            System.out.println("Now: " + follower.getSchedules().keySet());
            System.out.println("In production: " + follower.getSchedulesFor("production").keySet());

        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
