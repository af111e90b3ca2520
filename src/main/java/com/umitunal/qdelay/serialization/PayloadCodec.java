package com.umitunal.qdelay.serialization;

/**
 * Interface for encoding and decoding stored values.
 *
 * <p>The encoded form doubles as the identity of a value: two values are the
 * same stored entry exactly when their encodings are byte-equal, so
 * implementations must be deterministic.
 *
 * @param <T> the type of value
 */
public interface PayloadCodec<T> {

    /**
     * Encode a value to bytes.
     */
    byte[] encode(T payload);

    /**
     * Decode bytes to a value.
     */
    T decode(byte[] bytes);
}
