/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.recordcache.core;

import java.util.List;
import java.util.Objects;

/**
 * Field values for a secondary index lookup, in the index's field order.
 */
public record IndexTuple(List<String> values) {

    public IndexTuple {
        Objects.requireNonNull(values, "values");
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Index tuple must have at least one value");
        }
        for (String v : values) {
            Objects.requireNonNull(v, "Index tuple values must not be null");
        }
        values = List.copyOf(values);
    }

    public static IndexTuple of(String... values) {
        Objects.requireNonNull(values, "values");
        return new IndexTuple(List.of(values));
    }

    public int size() {
        return values.size();
    }
}
