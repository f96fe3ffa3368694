/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.recordcache.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.recordcache.errors.RecordDecodingException;
import com.intuitivedesigns.recordcache.spi.RecordCodec;

import java.util.Map;
import java.util.Objects;

/**
 * JSON codec backed by Jackson. Records are stored as compact JSON objects.
 */
public final class JacksonRecordCodec<R> implements RecordCodec<R> {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;
    private final JavaType type;

    public JacksonRecordCodec(ObjectMapper mapper, Class<R> type) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.type = mapper.constructType(Objects.requireNonNull(type, "type"));
    }

    private JacksonRecordCodec(ObjectMapper mapper, JavaType type) {
        this.mapper = mapper;
        this.type = type;
    }

    public static <R> JacksonRecordCodec<R> forType(Class<R> type) {
        return new JacksonRecordCodec<>(new ObjectMapper(), type);
    }

    /**
     * Codec for schemaless records ({@code Map<String, Object>}).
     */
    public static JacksonRecordCodec<Map<String, Object>> forMaps() {
        ObjectMapper mapper = new ObjectMapper();
        return new JacksonRecordCodec<>(mapper, mapper.getTypeFactory().constructType(MAP_TYPE));
    }

    @Override
    public String encode(R record) {
        Objects.requireNonNull(record, "record");
        try {
            return mapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Record of type " + record.getClass().getName() + " is not serializable", e);
        }
    }

    @Override
    public R decode(String encoded) {
        try {
            return mapper.readValue(encoded, type);
        } catch (JsonProcessingException e) {
            throw new RecordDecodingException("Malformed cached record (" + e.getOriginalMessage() + ")", e);
        }
    }

    @Override
    public Map<String, Object> fields(R record) {
        Objects.requireNonNull(record, "record");
        try {
            return mapper.convertValue(record, MAP_TYPE);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Record of type " + record.getClass().getName() + " is not an object", e);
        }
    }
}
