package com.umitunal.qdelay.scheduler;

import com.umitunal.qdelay.config.SchedulerConfig;
import com.umitunal.qdelay.core.ScheduleRegistry;
import com.umitunal.qdelay.model.ScheduleDefinition;
import com.umitunal.qdelay.serialization.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Process-local copy of the recurring schedules.
 *
 * <p>The registry is the source of truth; this cache is what a trigger
 * evaluator reads on every tick. It starts empty and is filled either by bulk
 * assignment ({@link #setSchedules}) or from the registry ({@link #reload},
 * {@link #applyChanges}). In dynamic mode bulk assignment also writes every
 * entry through to the registry.
 *
 * <p>Not shared between processes.
 */
public class ScheduleCache {
    private static final Logger logger = LoggerFactory.getLogger(ScheduleCache.class);

    private final ScheduleRegistry registry;
    private final SchedulerConfig config;
    private final JsonCodec<ScheduleDefinition> rawConverter;
    private volatile Map<String, ScheduleDefinition> schedules = Collections.emptyMap();

    public ScheduleCache(ScheduleRegistry registry, SchedulerConfig config) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.rawConverter = new JsonCodec<>(ScheduleDefinition.class);
    }

    /**
     * Replace the schedule with {@code definitions}. A definition without a
     * class uses its name as class.
     *
     * @throws com.umitunal.qdelay.core.InvalidScheduleException if any entry has
     *         no name or no trigger; neither the registry nor the snapshot change
     *
     * <pre>{@code
     * cache.setSchedules(Map.of(
     *         "MakeTea", ScheduleDefinition.builder().every("1m").build(),
     *         "some_name", ScheduleDefinition.builder()
     *                 .cron("0/5 * * * *")
     *                 .className("DoSomeWork")
     *                 .args("work on this string")
     *                 .build()));
     * }</pre>
     */
    public synchronized Map<String, ScheduleDefinition> setSchedules(Map<String, ScheduleDefinition> definitions)
            throws Exception {
        Map<String, ScheduleDefinition> prepared = prepareSchedule(definitions);
        // Nothing is written or replaced unless every entry is valid
        prepared.forEach(ScheduleRegistry::validate);

        if (config.isDynamic()) {
            for (Map.Entry<String, ScheduleDefinition> entry : prepared.entrySet()) {
                registry.setSchedule(entry.getKey(), entry.getValue());
            }
        }

        this.schedules = Collections.unmodifiableMap(prepared);
        logger.info("Loaded {} schedules (dynamic={})", prepared.size(), config.isDynamic());
        return this.schedules;
    }

    /**
     * Same as {@link #setSchedules} for loosely typed configuration, e.g. parsed
     * YAML or JSON. Recognised keys: {@code class}, {@code cron}, {@code every},
     * {@code args}, {@code queue}, {@code envs} (or the comma separated
     * {@code rails_envs}) and {@code description}.
     */
    public Map<String, ScheduleDefinition> setSchedulesFromRaw(Map<String, ? extends Map<String, ?>> raw)
            throws Exception {
        Map<String, ScheduleDefinition> definitions = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends Map<String, ?>> entry : raw.entrySet()) {
            definitions.put(entry.getKey(), rawConverter.convert(entry.getValue()));
        }
        return setSchedules(definitions);
    }

    /**
     * The current snapshot; empty until something was loaded.
     */
    public Map<String, ScheduleDefinition> getSchedules() {
        return schedules;
    }

    /**
     * Snapshot entries enabled in {@code env}.
     */
    public Map<String, ScheduleDefinition> getSchedulesFor(String env) {
        Map<String, ScheduleDefinition> enabled = new LinkedHashMap<>();
        schedules.forEach((name, definition) -> {
            if (definition.isEnabledIn(env)) {
                enabled.put(name, definition);
            }
        });
        return Collections.unmodifiableMap(enabled);
    }

    /**
     * Replace the snapshot with what the registry currently holds.
     */
    public synchronized Map<String, ScheduleDefinition> reload() throws Exception {
        Optional<Map<String, ScheduleDefinition>> stored = registry.getSchedules();
        if (stored.isEmpty()) {
            logger.debug("Registry not initialized, schedule is empty");
        }
        this.schedules = Collections.unmodifiableMap(new LinkedHashMap<>(stored.orElse(Collections.emptyMap())));
        return this.schedules;
    }

    /**
     * Drain the registry's change feed and refresh only the affected entries.
     *
     * @return the names that changed
     */
    public synchronized Set<String> applyChanges() throws Exception {
        Set<String> changed = registry.popChangedScheduleNames();
        if (changed.isEmpty()) {
            return changed;
        }

        Map<String, ScheduleDefinition> updated = new LinkedHashMap<>(schedules);
        for (String name : changed) {
            Optional<ScheduleDefinition> definition = registry.getSchedule(name);
            if (definition.isPresent()) {
                updated.put(name, definition.get());
            } else {
                updated.remove(name);
            }
        }
        this.schedules = Collections.unmodifiableMap(updated);
        logger.info("Applied {} schedule changes: {}", changed.size(), changed);
        return changed;
    }

    private static Map<String, ScheduleDefinition> prepareSchedule(Map<String, ScheduleDefinition> definitions) {
        Map<String, ScheduleDefinition> prepared = new LinkedHashMap<>();
        definitions.forEach((name, definition) ->
                prepared.put(name, definition.hasClassName() ? definition : definition.withClassName(name)));
        return prepared;
    }
}
