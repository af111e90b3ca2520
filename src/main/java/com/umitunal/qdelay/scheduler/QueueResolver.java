package com.umitunal.qdelay.scheduler;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Maps an execution target to the queue its jobs are placed on.
 */
@FunctionalInterface
public interface QueueResolver {

    /**
     * @return the queue name, or null if the target has no known queue
     */
    String queueFor(String className);

    /**
     * Every target goes to the same queue.
     */
    static QueueResolver constant(String queue) {
        Objects.requireNonNull(queue, "queue cannot be null");
        return className -> queue;
    }

    /**
     * Look targets up in a fixed table.
     */
    static QueueResolver fromMap(Map<String, String> queues) {
        Map<String, String> copy = new HashMap<>(queues);
        return copy::get;
    }
}
