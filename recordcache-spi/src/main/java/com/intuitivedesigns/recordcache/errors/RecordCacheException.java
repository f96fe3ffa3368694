/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.recordcache.errors;

/**
 * Root of the record cache failure taxonomy.
 * Cache misses are never reported through exceptions.
 */
public class RecordCacheException extends RuntimeException {

    public RecordCacheException(String message) {
        super(message);
    }

    public RecordCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
