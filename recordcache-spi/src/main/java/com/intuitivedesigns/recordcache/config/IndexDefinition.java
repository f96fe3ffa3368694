/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.recordcache.config;

import com.intuitivedesigns.recordcache.errors.CacheConfigurationException;

import java.util.List;

/**
 * A secondary index: keys are built from the record's {@code fields}, in order, prefixed by {@code name}.
 */
public record IndexDefinition(String name, List<String> fields) {

    public IndexDefinition {
        if (name == null || name.isBlank()) {
            throw new CacheConfigurationException("index.name", "Index name must not be blank");
        }
        if (fields == null || fields.isEmpty()) {
            throw new CacheConfigurationException("index[" + name + "].fields", "Index must have at least one field");
        }
        for (String field : fields) {
            if (field == null || field.isBlank()) {
                throw new CacheConfigurationException("index[" + name + "].fields", "Field names must not be blank");
            }
        }
        fields = List.copyOf(fields);
    }

    public static IndexDefinition of(String name, String... fields) {
        return new IndexDefinition(name, fields == null ? null : List.of(fields));
    }
}
