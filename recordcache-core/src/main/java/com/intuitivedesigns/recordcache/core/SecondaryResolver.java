/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.recordcache.core;

import com.intuitivedesigns.recordcache.spi.CacheConnection;
import com.intuitivedesigns.recordcache.spi.CachePipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Resolves an index key to the record it points at.
 *
 * <p>An index entry holds the primary id. Reading the index entry and then the primary entry from
 * the client would race with expiry and overwrites, so the whole hop runs as one atomic operation
 * on the server ({@link CacheConnection#resolveIndirect}). Inside a batch each resolution is atomic
 * on its own; the batch as a whole is not.</p>
 */
public final class SecondaryResolver {

    private static final Logger log = LoggerFactory.getLogger(SecondaryResolver.class);

    private final CacheConnection connection;

    public SecondaryResolver(CacheConnection connection) {
        this.connection = Objects.requireNonNull(connection, "connection");
    }

    /**
     * @return the raw primary entry, or null when the index key or its target is missing
     */
    public String resolve(String indexKey) {
        Objects.requireNonNull(indexKey, "indexKey");
        String raw = connection.resolveIndirect(indexKey);
        if (log.isDebugEnabled()) {
            log.debug("Resolved index key {} ({})", indexKey, raw == null ? "miss" : "hit");
        }
        return raw;
    }

    /**
     * Queues the resolution of {@code indexKey}; its reply lands at this position of the pipeline's results.
     */
    public void enqueue(CachePipeline pipeline, String indexKey) {
        Objects.requireNonNull(pipeline, "pipeline");
        Objects.requireNonNull(indexKey, "indexKey");
        pipeline.resolveIndirect(indexKey);
    }
}
