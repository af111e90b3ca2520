package com.umitunal.qdelay.storage;

import com.umitunal.qdelay.core.InvalidScheduleException;
import com.umitunal.qdelay.core.ScheduleRegistry;
import com.umitunal.qdelay.model.ScheduleDefinition;
import com.umitunal.qdelay.serialization.JsonCodec;
import com.umitunal.qdelay.serialization.PayloadCodec;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * RocksDB-backed implementation of ScheduleRegistry.
 *
 * <p>Definitions are compared by their canonical encoding, so re-storing an
 * equal definition neither rewrites it nor shows up in the change feed.
 */
public class RocksScheduleRegistry implements ScheduleRegistry {
    private static final Logger logger = LoggerFactory.getLogger(RocksScheduleRegistry.class);

    private final RocksStore store;
    private final PayloadCodec<ScheduleDefinition> codec;

    public RocksScheduleRegistry(RocksStore store) {
        this(store, new JsonCodec<>(ScheduleDefinition.class));
    }

    public RocksScheduleRegistry(RocksStore store, PayloadCodec<ScheduleDefinition> codec) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.codec = Objects.requireNonNull(codec, "codec cannot be null");
    }

    @Override
    public ScheduleDefinition setSchedule(String name, ScheduleDefinition definition) throws RocksDBException {
        ScheduleRegistry.validate(name, definition);

        byte[] key = StoreKeys.schedule(name);
        byte[] encoded = codec.encode(definition);

        boolean changed = store.inTransaction("setSchedule", txn -> {
            byte[] existing = txn.getForUpdate(key);
            if (existing != null && Arrays.equals(existing, encoded)) {
                return false;
            }
            txn.put(key, encoded);
            txn.put(StoreKeys.scheduleChanged(name), StoreKeys.EMPTY);
            txn.put(StoreKeys.SCHEDULES_META, StoreKeys.EMPTY);
            return true;
        });

        if (changed) {
            logger.debug("Stored schedule '{}': {}", name, definition);
        }
        return definition;
    }

    @Override
    public Optional<ScheduleDefinition> getSchedule(String name) throws RocksDBException {
        validateName(name);
        byte[] encoded = store.get(StoreKeys.schedule(name));
        return encoded == null ? Optional.empty() : Optional.of(codec.decode(encoded));
    }

    @Override
    public void removeSchedule(String name) throws RocksDBException {
        validateName(name);
        store.inTransaction("removeSchedule", txn -> {
            txn.delete(StoreKeys.schedule(name));
            txn.put(StoreKeys.scheduleChanged(name), StoreKeys.EMPTY);
            return null;
        });
        logger.debug("Removed schedule '{}'", name);
    }

    @Override
    public Optional<Map<String, ScheduleDefinition>> getSchedules() throws RocksDBException {
        if (store.get(StoreKeys.SCHEDULES_META) == null) {
            return Optional.empty();
        }

        Map<String, ScheduleDefinition> schedules = new LinkedHashMap<>();
        try (final RocksIterator iter = store.newScanIterator()) {
            for (iter.seek(StoreKeys.SCHEDULES);
                 iter.isValid() && StoreKeys.startsWith(iter.key(), StoreKeys.SCHEDULES);
                 iter.next()) {
                schedules.put(StoreKeys.nameOf(iter.key(), StoreKeys.SCHEDULES), codec.decode(iter.value()));
            }
        }
        return Optional.of(schedules);
    }

    @Override
    public Set<String> changedScheduleNames() {
        Set<String> names = new TreeSet<>();
        try (final RocksIterator iter = store.newScanIterator()) {
            for (iter.seek(StoreKeys.SCHEDULES_CHANGED);
                 iter.isValid() && StoreKeys.startsWith(iter.key(), StoreKeys.SCHEDULES_CHANGED);
                 iter.next()) {
                names.add(StoreKeys.nameOf(iter.key(), StoreKeys.SCHEDULES_CHANGED));
            }
        }
        return names;
    }

    @Override
    public Set<String> popChangedScheduleNames() throws RocksDBException {
        return store.inTransaction("popChangedSchedules", txn -> {
            List<byte[]> keys = new ArrayList<>();
            try (final RocksIterator iter = txn.newIterator()) {
                for (iter.seek(StoreKeys.SCHEDULES_CHANGED);
                     iter.isValid() && StoreKeys.startsWith(iter.key(), StoreKeys.SCHEDULES_CHANGED);
                     iter.next()) {
                    keys.add(iter.key());
                }
            }

            Set<String> names = new TreeSet<>();
            for (byte[] key : keys) {
                names.add(StoreKeys.nameOf(key, StoreKeys.SCHEDULES_CHANGED));
                txn.delete(key);
            }
            return names;
        });
    }

    private static void validateName(String name) {
        if (name == null || name.isEmpty()) {
            throw new InvalidScheduleException("Schedules must have a name");
        }
    }
}
