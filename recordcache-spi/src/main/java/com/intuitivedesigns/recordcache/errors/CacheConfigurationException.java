/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.recordcache.errors;

/**
 * Raised while building a cache from configuration. Never raised at call time.
 */
public class CacheConfigurationException extends RecordCacheException {

    private final String field;

    public CacheConfigurationException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    public CacheConfigurationException(String field, String message, Throwable cause) {
        super(field + ": " + message, cause);
        this.field = field;
    }

    /**
     * @return path of the offending setting, e.g. {@code cache.indexes[1].fields}
     */
    public String field() {
        return field;
    }
}
