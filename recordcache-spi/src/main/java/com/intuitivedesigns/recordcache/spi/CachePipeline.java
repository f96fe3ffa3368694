/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.recordcache.spi;

import java.util.List;

/**
 * Operations queued for a single network round trip.
 *
 * <p>Operations run in the order they were queued and replies come back in that order. A pipeline
 * is not a transaction: if the connection drops mid-batch, some operations may have been applied
 * and others not.</p>
 *
 * <p>Not thread-safe. A pipeline belongs to the caller that opened it and is single use.</p>
 */
public interface CachePipeline extends AutoCloseable {

    String OK = "OK";

    void get(String key);

    void set(String key, String value, long ttlSeconds);

    void resolveIndirect(String key);

    int size();

    /**
     * Sends every queued operation and releases the pipeline.
     *
     * @return raw replies in queue order: values (or null) for reads, {@link #OK} for acknowledged writes
     */
    List<String> execute();

    /**
     * Releases the pipeline without sending anything if {@link #execute()} was never called.
     */
    @Override
    void close();
}
