/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.recordcache.errors;

/**
 * Failure talking to the backing store (network, timeout, protocol).
 * The client library's exception is kept as the cause. Nothing in the cache retries.
 */
public class CacheTransportException extends RecordCacheException {

    public CacheTransportException(String message) {
        super(message);
    }

    public CacheTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
