package com.umitunal.qdelay.core;

import com.umitunal.qdelay.model.ScheduleDefinition;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Persistent store of named recurring job definitions.
 *
 * <p>Every effective change records the schedule name in a change feed so
 * that processes holding a live copy know what to reload.
 */
public interface ScheduleRegistry {

    /**
     * Create or update a schedule. Nothing is written, and no change is
     * recorded, when the stored definition is already identical.
     *
     * @return the definition as given
     * @throws InvalidScheduleException if the definition has neither cron nor every
     */
    ScheduleDefinition setSchedule(String name, ScheduleDefinition definition) throws Exception;

    /**
     * Retrieve the schedule stored under {@code name}.
     */
    Optional<ScheduleDefinition> getSchedule(String name) throws Exception;

    /**
     * Remove a schedule and record the removal in the change feed.
     */
    void removeSchedule(String name) throws Exception;

    /**
     * All stored schedules by name.
     *
     * @return empty if no schedule was ever stored, otherwise the (possibly
     *         empty) mapping
     */
    Optional<Map<String, ScheduleDefinition>> getSchedules() throws Exception;

    /**
     * Names changed since the feed was last drained, without draining it.
     */
    Set<String> changedScheduleNames() throws Exception;

    /**
     * Names changed since the feed was last drained; clears the feed.
     */
    Set<String> popChangedScheduleNames() throws Exception;

    /**
     * Check that {@code definition} may be stored under {@code name}.
     *
     * @throws InvalidScheduleException if the name is empty or the definition
     *         has neither cron nor every
     */
    static void validate(String name, ScheduleDefinition definition) {
        if (name == null || name.isEmpty()) {
            throw new InvalidScheduleException("Schedules must have a name");
        }
        Objects.requireNonNull(definition, "definition cannot be null");
        if (definition.getTrigger().isEmpty()) {
            throw new InvalidScheduleException("Schedule '" + name + "' needs a cron or every trigger");
        }
    }
}
