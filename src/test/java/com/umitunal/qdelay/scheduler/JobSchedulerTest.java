package com.umitunal.qdelay.scheduler;

import com.umitunal.qdelay.config.SchedulerConfig;
import com.umitunal.qdelay.config.StorageConfig;
import com.umitunal.qdelay.core.NoClassException;
import com.umitunal.qdelay.core.NoQueueException;
import com.umitunal.qdelay.model.JobDescriptor;
import com.umitunal.qdelay.storage.RocksDelayedQueue;
import com.umitunal.qdelay.storage.RocksStore;
import com.umitunal.qdelay.testing.MutableClock;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class JobSchedulerTest {

    @TempDir
    Path tempDir;

    private RocksStore store;
    private RocksDelayedQueue queue;
    private MutableClock clock;
    private QueueResolver resolver;

    @BeforeEach
    void setUp() throws Exception {
        store = new RocksStore(StorageConfig.newBuilder(tempDir.toString())
                .withDurableWrites(false)
                .build());
        clock = MutableClock.startingAtSeconds(10_000);
        queue = new RocksDelayedQueue(store, clock);
        resolver = QueueResolver.fromMap(Map.of("Send", "mail", "Resize", "media"));
    }

    @AfterEach
    void tearDown() {
        if (store != null) {
            store.close();
        }
    }

    private JobScheduler.Builder schedulerBuilder() {
        return JobScheduler.builder(queue, resolver)
                .withConfig(SchedulerConfig.newBuilder().withClock(clock).build());
    }

    @Test
    @DisplayName("Should store a job on the queue its class resolves to")
    void testEnqueueAt() throws Exception {
        // Given
        JobScheduler scheduler = schedulerBuilder().build();

        // When
        boolean scheduled = scheduler.enqueueAt(12_000, "Send", "user-1", 3);

        // Then
        assertThat(scheduled).isTrue();
        assertThat(queue.bucketPeek(12_000, 0, 10))
                .containsExactly(JobDescriptor.of("Send", "mail", "user-1", 3));
    }

    @Test
    @DisplayName("Should reject jobs without a class or a queue")
    void testValidation() {
        JobScheduler scheduler = schedulerBuilder().build();

        assertThatThrownBy(() -> scheduler.enqueueAt(12_000, ""))
                .isInstanceOf(NoClassException.class)
                .hasMessage("Jobs must be given a class.");
        assertThatThrownBy(() -> scheduler.enqueueAt(12_000, "Unknown"))
                .isInstanceOf(NoQueueException.class)
                .hasMessage("Jobs must be placed onto a queue.");
        assertThatThrownBy(() -> scheduler.enqueueAtWithQueue("", 12_000, "Send"))
                .isInstanceOf(NoQueueException.class);
        assertThatThrownBy(() -> scheduler.enqueueAtWithQueue("mail", 12_000, null))
                .isInstanceOf(NoClassException.class);
    }

    @Test
    @DisplayName("Should not touch the store or hooks when validation fails")
    void testValidationBeforeMutation() throws Exception {
        // Given
        List<String> calls = new ArrayList<>();
        JobScheduler scheduler = schedulerBuilder()
                .withHook(new ScheduleHook() {
                    @Override
                    public boolean beforeSchedule(String className, List<Object> args) {
                        calls.add("before:" + className);
                        return true;
                    }
                })
                .build();

        // When
        assertThatThrownBy(() -> scheduler.enqueueAt(12_000, "", "x")).isInstanceOf(NoClassException.class);
        assertThatThrownBy(() -> scheduler.enqueueAt(12_000, "Unknown", "x")).isInstanceOf(NoQueueException.class);
        assertThatThrownBy(() -> scheduler.enqueueIn(60, "Unknown")).isInstanceOf(NoQueueException.class);
        assertThatThrownBy(() -> scheduler.enqueueAtWithQueue(null, 12_000, "Send")).isInstanceOf(NoQueueException.class);

        // Then
        assertThat(calls).isEmpty();
        assertThat(queue.countAllScheduledJobs()).isZero();
        assertThat(queue.delayedQueueScheduleSize()).isZero();
        assertThat(queue.bucketSize(12_000)).isZero();
    }

    @Test
    @DisplayName("Should schedule relative to the configured clock")
    void testEnqueueIn() throws Exception {
        // Given
        JobScheduler scheduler = schedulerBuilder().build();

        // When
        scheduler.enqueueIn(300, "Send", "a");
        scheduler.enqueueIn(Duration.ofMillis(1_500), "Resize", "b");

        // Then
        assertThat(queue.peek(0, 10)).containsExactly(10_001L, 10_300L);
        assertThat(queue.nextDelayedTimestamp()).isEmpty();

        clock.advanceSeconds(1);
        assertThat(queue.nextDelayedTimestamp()).hasValue(10_001L);
    }

    @Test
    @DisplayName("Should truncate instants to whole seconds")
    void testEnqueueAtInstant() throws Exception {
        JobScheduler scheduler = schedulerBuilder().build();

        scheduler.enqueueAt(Instant.ofEpochSecond(12_000, 999_000_000), "Send");

        assertThat(queue.bucketSize(12_000)).isEqualTo(1);
    }

    @Test
    @DisplayName("Should honour an explicit queue")
    void testEnqueueWithQueue() throws Exception {
        JobScheduler scheduler = schedulerBuilder().build();

        scheduler.enqueueInWithQueue("urgent", 60, "Send", "x");

        assertThat(queue.bucketPeek(10_060, 0, 1))
                .containsExactly(JobDescriptor.of("Send", "urgent", "x"));
    }

    @Test
    @DisplayName("Should run hooks around scheduling and stop on rejection")
    void testHooks() throws Exception {
        // Given
        List<String> calls = new ArrayList<>();
        ScheduleHook recorder = new ScheduleHook() {
            @Override
            public boolean beforeSchedule(String className, List<Object> args) {
                calls.add("before:" + className + args);
                return !args.contains("skip");
            }

            @Override
            public void afterSchedule(String className, List<Object> args) {
                calls.add("after:" + className + args);
            }
        };
        JobScheduler scheduler = schedulerBuilder().withHook(recorder).build();

        // When
        boolean accepted = scheduler.enqueueAt(12_000, "Send", "ok");
        boolean rejected = scheduler.enqueueAt(12_000, "Send", "skip");

        // Then
        assertThat(accepted).isTrue();
        assertThat(rejected).isFalse();
        assertThat(calls).containsExactly("before:Send[ok]", "after:Send[ok]", "before:Send[skip]");
        assertThat(queue.bucketSize(12_000)).isEqualTo(1);
    }

    @Test
    @DisplayName("Should execute immediately in inline mode")
    void testInlineMode() throws Exception {
        // Given
        List<String> executed = new ArrayList<>();
        JobScheduler scheduler = JobScheduler.builder(queue, resolver)
                .withConfig(SchedulerConfig.newBuilder().withInline(true).withClock(clock).build())
                .withExecutor((queueName, className, args) -> executed.add(queueName + ":" + className + args))
                .build();

        // When
        scheduler.enqueueIn(3_600, "Resize", "cat.png");

        // Then
        assertThat(executed).containsExactly("media:Resize[cat.png]");
        assertThat(queue.delayedQueueScheduleSize()).isZero();
    }

    @Test
    @DisplayName("Should refuse inline mode without an executor")
    void testInlineWithoutExecutor() {
        JobScheduler.Builder builder = JobScheduler.builder(queue, resolver)
                .withConfig(SchedulerConfig.newBuilder().withInline(true).build());

        assertThatThrownBy(builder::build).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should remove delayed jobs everywhere or at one timestamp")
    void testRemoveDelayed() throws Exception {
        // Given
        JobScheduler scheduler = schedulerBuilder().build();
        scheduler.enqueueAt(11_000, "Send", "x");
        scheduler.enqueueAt(12_000, "Send", "x");
        scheduler.enqueueAt(12_000, "Send", "y");
        scheduler.enqueueAt(13_000, "Send", "x");

        // When
        long atOne = scheduler.removeDelayedJobFromTimestamp(12_000, "Send", "x");
        long everywhere = scheduler.removeDelayed("Send", "x");

        // Then
        assertThat(atOne).isEqualTo(1);
        assertThat(everywhere).isEqualTo(2);
        assertThat(queue.countAllScheduledJobs()).isEqualTo(1);
        assertThat(queue.peek(0, 10)).containsExactly(12_000L);
    }
}
