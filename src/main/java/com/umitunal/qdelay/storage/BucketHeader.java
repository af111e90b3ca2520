package com.umitunal.qdelay.storage;

import java.nio.ByteBuffer;

/**
 * Per-timestamp bookkeeping: how many entries the bucket holds and the
 * sequence number the next appended entry gets.
 *
 * Binary format:
 * - length (8 bytes)
 * - nextSequence (8 bytes)
 */
final class BucketHeader {
    static final BucketHeader EMPTY = new BucketHeader(0, 0);

    private final long length;
    private final long nextSequence;

    BucketHeader(long length, long nextSequence) {
        this.length = length;
        this.nextSequence = nextSequence;
    }

    static BucketHeader decode(byte[] bytes) {
        if (bytes == null) {
            return EMPTY;
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        return new BucketHeader(buffer.getLong(), buffer.getLong());
    }

    byte[] encode() {
        return ByteBuffer.allocate(16)
                .putLong(length)
                .putLong(nextSequence)
                .array();
    }

    long length() { return length; }
    long nextSequence() { return nextSequence; }

    BucketHeader appended() {
        return new BucketHeader(length + 1, nextSequence + 1);
    }

    BucketHeader removed(long count) {
        return new BucketHeader(length - count, nextSequence);
    }

    @Override
    public String toString() {
        return "BucketHeader{length=" + length + ", nextSequence=" + nextSequence + "}";
    }
}
