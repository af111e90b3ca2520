package com.umitunal.qdelay.serialization;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;

/**
 * JSON codec using Jackson.
 *
 * <p>The default mapper writes canonical JSON: bean properties and map entries
 * are sorted by name and null properties are left out. Equal values therefore
 * always produce the same bytes, whatever order their maps were built in.
 *
 * @param <T> the type to serialize
 */
public class JsonCodec<T> implements PayloadCodec<T> {
    private final ObjectMapper mapper;
    private final Class<T> type;

    public JsonCodec(Class<T> type) {
        this(type, createCanonicalMapper());
    }

    public JsonCodec(Class<T> type, ObjectMapper mapper) {
        this.type = type;
        this.mapper = mapper;
    }

    @Override
    public byte[] encode(T payload) {
        try {
            return mapper.writeValueAsBytes(payload);
        } catch (IOException e) {
            throw new RuntimeException("Failed to serialize " + type.getSimpleName() + " to JSON", e);
        }
    }

    @Override
    public T decode(byte[] bytes) {
        try {
            return mapper.readValue(bytes, type);
        } catch (IOException e) {
            throw new RuntimeException("Failed to deserialize " + type.getSimpleName() + " from JSON", e);
        }
    }

    /**
     * Convert a loosely typed structure (maps, lists, scalars) into the codec's type.
     */
    public T convert(Object raw) {
        try {
            return mapper.convertValue(raw, type);
        } catch (IllegalArgumentException e) {
            throw new RuntimeException("Failed to convert value to " + type.getSimpleName(), e);
        }
    }

    public static ObjectMapper createCanonicalMapper() {
        return JsonMapper.builder()
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .serializationInclusion(JsonInclude.Include.NON_NULL)
                .build();
    }
}
