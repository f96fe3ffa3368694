/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.recordcache.core;

import com.intuitivedesigns.recordcache.config.CacheSettings;
import com.intuitivedesigns.recordcache.config.IndexDefinition;
import com.intuitivedesigns.recordcache.errors.CacheConfigurationException;
import com.intuitivedesigns.recordcache.errors.UnknownIndexException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The secondary indexes of one cache, keyed by name.
 *
 * <p>Index keys have the form {@code <name>:<value-1>:<value-2>...}. Values containing the
 * separator are rejected, since {@code a:b} + {@code c} and {@code a} + {@code b:c} would
 * otherwise collide.</p>
 */
public final class IndexCatalog {

    public static final char SEPARATOR = ':';

    private static final IndexCatalog EMPTY = new IndexCatalog(List.of());

    private final Map<String, IndexDefinition> byName;

    public IndexCatalog(List<IndexDefinition> definitions) {
        Objects.requireNonNull(definitions, "definitions");
        Map<String, IndexDefinition> tmp = new LinkedHashMap<>();
        for (int i = 0; i < definitions.size(); i++) {
            IndexDefinition def = definitions.get(i);
            if (def == null) {
                throw new CacheConfigurationException(CacheSettings.KEY_INDEXES + "[" + i + "]", "Index definition must not be null");
            }
            if (tmp.putIfAbsent(def.name(), def) != null) {
                throw new CacheConfigurationException(CacheSettings.KEY_INDEXES + "[" + i + "].name", "Duplicate index name \"" + def.name() + "\"");
            }
        }
        this.byName = Collections.unmodifiableMap(tmp);
    }

    public static IndexCatalog empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return byName.isEmpty();
    }

    public boolean has(String name) {
        return name != null && byName.containsKey(name);
    }

    public Collection<IndexDefinition> definitions() {
        return byName.values();
    }

    public IndexDefinition require(String name) {
        IndexDefinition def = (name == null) ? null : byName.get(name);
        if (def == null) {
            throw new UnknownIndexException(name);
        }
        return def;
    }

    public String resolveKey(String name, IndexTuple tuple) {
        Objects.requireNonNull(tuple, "tuple");
        return resolveKey(name, tuple.values());
    }

    /**
     * Builds the key for a lookup; {@code values} follow the index's field order.
     */
    public String resolveKey(String name, List<String> values) {
        IndexDefinition def = require(name);
        Objects.requireNonNull(values, "values");
        if (values.size() != def.fields().size()) {
            throw new IllegalArgumentException("Index \"" + name + "\" expects " + def.fields().size()
                    + " value(s) " + def.fields() + " but got " + values.size());
        }
        StringBuilder key = new StringBuilder(def.name());
        for (int i = 0; i < values.size(); i++) {
            key.append(SEPARATOR).append(checkValue(def, def.fields().get(i), values.get(i)));
        }
        return key.toString();
    }

    /**
     * Builds the key for a record being stored, reading each indexed field from {@code fields}.
     */
    public String resolveKey(String name, Map<String, ?> fields) {
        IndexDefinition def = require(name);
        Objects.requireNonNull(fields, "fields");
        List<String> values = new ArrayList<>(def.fields().size());
        for (String field : def.fields()) {
            values.add(toValue(def, field, fields.get(field)));
        }
        return resolveKey(name, values);
    }

    /**
     * @return one key per index, in definition order
     */
    public List<String> resolveKeys(Map<String, ?> fields) {
        List<String> keys = new ArrayList<>(byName.size());
        for (String name : byName.keySet()) {
            keys.add(resolveKey(name, fields));
        }
        return keys;
    }

    private static String toValue(IndexDefinition def, String field, Object raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Record has no value for field \"" + field + "\" of index \"" + def.name() + "\"");
        }
        if (raw instanceof CharSequence || raw instanceof Number || raw instanceof Boolean || raw instanceof Character) {
            return raw.toString();
        }
        throw new IllegalArgumentException("Field \"" + field + "\" of index \"" + def.name()
                + "\" must be a scalar, got " + raw.getClass().getSimpleName());
    }

    private static String checkValue(IndexDefinition def, String field, String value) {
        if (value == null) {
            throw new IllegalArgumentException("Null value for field \"" + field + "\" of index \"" + def.name() + "\"");
        }
        if (value.indexOf(SEPARATOR) >= 0) {
            throw new IllegalArgumentException("Value for field \"" + field + "\" of index \"" + def.name()
                    + "\" must not contain '" + SEPARATOR + "': " + value);
        }
        return value;
    }
}
