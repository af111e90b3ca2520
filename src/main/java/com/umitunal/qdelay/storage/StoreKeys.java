package com.umitunal.qdelay.storage;

import java.nio.ByteBuffer;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Key layout of the shared store.
 *
 * <pre>
 * schedules:&lt;name&gt;                   encoded schedule definition
 * schedules_meta                      marker, present once the registry was written
 * schedules_changed:&lt;name&gt;           change feed entry
 * delayed_queue_schedule:&lt;ts&gt;        index of due timestamps
 * delayed:&lt;ts&gt;                       bucket header (length, next sequence)
 * delayed_item:&lt;ts&gt;&lt;seq&gt;             bucket entry, encoded job
 * </pre>
 *
 * Timestamps and sequences are 8 bytes, big-endian with the sign bit flipped,
 * so that byte order is numeric order.
 */
final class StoreKeys {
    static final byte[] SCHEDULES = "schedules:".getBytes(UTF_8);
    static final byte[] SCHEDULES_META = "schedules_meta".getBytes(UTF_8);
    static final byte[] SCHEDULES_CHANGED = "schedules_changed:".getBytes(UTF_8);
    static final byte[] DELAYED_QUEUE_SCHEDULE = "delayed_queue_schedule:".getBytes(UTF_8);
    static final byte[] DELAYED = "delayed:".getBytes(UTF_8);
    static final byte[] DELAYED_ITEM = "delayed_item:".getBytes(UTF_8);

    static final byte[] EMPTY = new byte[0];

    private StoreKeys() {
    }

    static byte[] schedule(String name) {
        return concat(SCHEDULES, name.getBytes(UTF_8));
    }

    static byte[] scheduleChanged(String name) {
        return concat(SCHEDULES_CHANGED, name.getBytes(UTF_8));
    }

    static String nameOf(byte[] key, byte[] prefix) {
        return new String(key, prefix.length, key.length - prefix.length, UTF_8);
    }

    static byte[] index(long timestamp) {
        return ByteBuffer.allocate(DELAYED_QUEUE_SCHEDULE.length + 8)
                .put(DELAYED_QUEUE_SCHEDULE)
                .putLong(orderable(timestamp))
                .array();
    }

    static byte[] bucket(long timestamp) {
        return ByteBuffer.allocate(DELAYED.length + 8)
                .put(DELAYED)
                .putLong(orderable(timestamp))
                .array();
    }

    /**
     * Prefix shared by every entry of one bucket.
     */
    static byte[] itemPrefix(long timestamp) {
        return ByteBuffer.allocate(DELAYED_ITEM.length + 8)
                .put(DELAYED_ITEM)
                .putLong(orderable(timestamp))
                .array();
    }

    static byte[] item(long timestamp, long sequence) {
        return ByteBuffer.allocate(DELAYED_ITEM.length + 16)
                .put(DELAYED_ITEM)
                .putLong(orderable(timestamp))
                .putLong(orderable(sequence))
                .array();
    }

    /**
     * Timestamp stored right after {@code prefix} in an index or bucket key.
     */
    static long timestampOf(byte[] key, byte[] prefix) {
        return orderable(ByteBuffer.wrap(key, prefix.length, 8).getLong());
    }

    static boolean startsWith(byte[] key, byte[] prefix) {
        if (key.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (key[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    // Flipping the sign bit is its own inverse.
    private static long orderable(long value) {
        return value ^ Long.MIN_VALUE;
    }

    private static byte[] concat(byte[] prefix, byte[] suffix) {
        byte[] result = new byte[prefix.length + suffix.length];
        System.arraycopy(prefix, 0, result, 0, prefix.length);
        System.arraycopy(suffix, 0, result, prefix.length, suffix.length);
        return result;
    }
}
