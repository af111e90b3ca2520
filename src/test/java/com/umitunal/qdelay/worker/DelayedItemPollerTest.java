package com.umitunal.qdelay.worker;

import com.umitunal.qdelay.config.StorageConfig;
import com.umitunal.qdelay.model.JobDescriptor;
import com.umitunal.qdelay.storage.RocksDelayedQueue;
import com.umitunal.qdelay.storage.RocksStore;
import com.umitunal.qdelay.testing.MutableClock;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.*;

class DelayedItemPollerTest {

    @TempDir
    Path tempDir;

    private RocksStore store;
    private RocksDelayedQueue queue;
    private MutableClock clock;
    private final List<String> executed = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() throws Exception {
        store = new RocksStore(StorageConfig.newBuilder(tempDir.toString())
                .withDurableWrites(false)
                .build());
        clock = MutableClock.startingAtSeconds(1_000);
        queue = new RocksDelayedQueue(store, clock);
    }

    @AfterEach
    void tearDown() {
        if (store != null) {
            store.close();
        }
    }

    private JobExecutor recordingExecutor() {
        return (queueName, className, args) -> executed.add(queueName + ":" + className + args);
    }

    @Test
    @DisplayName("Should hand over only due jobs, oldest timestamp first")
    void testHandleDueItems() throws Exception {
        // Given
        queue.push(900, JobDescriptor.of("B", "default"));
        queue.push(800, JobDescriptor.of("A", "default"));
        queue.push(800, JobDescriptor.of("A2", "default"));
        queue.push(2_000, JobDescriptor.of("Later", "default"));
        DelayedItemPoller poller = DelayedItemPoller.builder("p1", queue, recordingExecutor())
                .withClock(clock)
                .build();

        // When
        long handled = poller.handleDelayedItems();

        // Then
        assertThat(handled).isEqualTo(3);
        assertThat(executed).containsExactly("default:A[]", "default:A2[]", "default:B[]");
        assertThat(queue.peek(0, 10)).containsExactly(2_000L);
        assertThat(poller.getHandedOverCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should drop a job whose hand-over fails and keep going")
    void testExecutorFailure() throws Exception {
        // Given
        queue.push(500, JobDescriptor.of("Broken", "default"));
        queue.push(500, JobDescriptor.of("Fine", "default"));
        JobExecutor flaky = (queueName, className, args) -> {
            if (className.equals("Broken")) {
                throw new IllegalStateException("boom");
            }
            executed.add(className);
        };
        DelayedItemPoller poller = DelayedItemPoller.builder("p1", queue, flaky)
                .withClock(clock)
                .build();

        // When
        long drained = poller.enqueueDelayedItemsForTimestamp(500);

        // Then
        assertThat(drained).isEqualTo(2);
        assertThat(executed).containsExactly("Fine");
        assertThat(poller.getFailedCount()).isEqualTo(1);
        assertThat(queue.countAllScheduledJobs()).isZero();
    }

    @Test
    @DisplayName("Should pick up jobs as they become due in the background")
    void testBackgroundPolling() throws Exception {
        // Given
        queue.push(1_005, JobDescriptor.of("Reminder", "mail", "user-7"));
        DelayedItemPoller poller = DelayedItemPoller.builder("bg", queue, recordingExecutor())
                .withClock(clock)
                .withPollInterval(20)
                .build();

        try {
            // When
            poller.start();
            assertThat(poller.isRunning()).isTrue();

            // Then nothing is due yet
            TimeUnit.MILLISECONDS.sleep(100);
            assertThat(executed).isEmpty();

            clock.advanceSeconds(5);
            await().atMost(5, TimeUnit.SECONDS)
                    .untilAsserted(() -> assertThat(executed).containsExactly("mail:Reminder[user-7]"));
        } finally {
            poller.stop();
        }

        assertThat(poller.isRunning()).isFalse();
        assertThat(queue.delayedQueueScheduleSize()).isZero();
    }
}
