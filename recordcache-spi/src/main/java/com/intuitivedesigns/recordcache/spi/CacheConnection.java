/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.recordcache.spi;

import com.intuitivedesigns.recordcache.config.ServerIdentity;

import java.util.List;

/**
 * Request/response transport to the backing key-value store.
 *
 * <p><b>Thread-safety Contract:</b></p>
 * One instance is shared by every cache configured for the same {@link ServerIdentity}, so all
 * methods must be safe for concurrent use.
 *
 * <p><b>Failure Contract:</b></p>
 * Transport failures surface as {@link com.intuitivedesigns.recordcache.errors.CacheTransportException}.
 * Implementations do not retry.
 */
public interface CacheConnection extends AutoCloseable {

    ServerIdentity identity();

    /**
     * @return the stored value, or null when the key does not exist
     */
    String get(String key);

    /**
     * @return one entry per key, in key order, null where the key does not exist
     */
    List<String> mget(List<String> keys);

    /**
     * @param ttlSeconds expiry in seconds, 0 to keep the entry forever
     * @return true when the store acknowledged the write
     */
    boolean set(String key, String value, long ttlSeconds);

    /**
     * Reads {@code key}; if present, uses its value as a second key and returns the value stored there.
     * Must execute as one atomic server-side operation, never as two client round trips.
     *
     * @return the dereferenced value, or null when either key is missing
     */
    String resolveIndirect(String key);

    /**
     * Opens a batch. Nothing is sent until {@link CachePipeline#execute()}.
     */
    CachePipeline pipeline();

    @Override
    void close();
}
