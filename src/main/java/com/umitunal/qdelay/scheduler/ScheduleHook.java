package com.umitunal.qdelay.scheduler;

import java.util.List;

/**
 * Callbacks run around every scheduled enqueue.
 */
public interface ScheduleHook {

    /**
     * Called before a job is stored or run inline.
     *
     * @return false to abort the enqueue
     */
    default boolean beforeSchedule(String className, List<Object> args) {
        return true;
    }

    /**
     * Called after a job was stored or run inline.
     */
    default void afterSchedule(String className, List<Object> args) {
    }
}
