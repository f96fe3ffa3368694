/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.recordcache.core;

import com.intuitivedesigns.recordcache.errors.CacheTransportException;
import com.intuitivedesigns.recordcache.spi.CacheConnection;
import com.intuitivedesigns.recordcache.spi.CachePipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs N reads or writes in one network round trip, returning results in input order.
 *
 * <p>Batches are sent together, not committed together: a connection lost mid-batch can leave
 * some writes applied and others not. Callers that write related keys (a record and its index
 * entries) live with that window.</p>
 */
public final class BatchExecutor {

    private static final Logger log = LoggerFactory.getLogger(BatchExecutor.class);

    /**
     * One SET in a batch.
     */
    public record Write(String key, String value, long ttlSeconds) {
        public Write {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
        }
    }

    private final CacheConnection connection;
    private final SecondaryResolver resolver;

    public BatchExecutor(CacheConnection connection, SecondaryResolver resolver) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    /**
     * Multi-get of primary keys.
     */
    public List<String> getAll(List<String> keys) {
        if (keys.isEmpty()) return List.of();
        List<String> raw = connection.mget(keys);
        return checkReplies(raw, keys.size(), "MGET");
    }

    /**
     * Atomic index resolutions, one per key, all in one pipeline.
     */
    public List<String> resolveAll(List<String> indexKeys) {
        if (indexKeys.isEmpty()) return List.of();
        try (CachePipeline pipeline = connection.pipeline()) {
            for (String key : indexKeys) {
                resolver.enqueue(pipeline, key);
            }
            return run(pipeline, indexKeys.size(), "resolve");
        }
    }

    /**
     * @return per-write acknowledgement, in input order
     */
    public List<Boolean> writeAll(List<Write> writes) {
        if (writes.isEmpty()) return List.of();
        try (CachePipeline pipeline = connection.pipeline()) {
            for (Write w : writes) {
                pipeline.set(w.key(), w.value(), w.ttlSeconds());
            }
            List<String> replies = run(pipeline, writes.size(), "SET");
            List<Boolean> acks = new ArrayList<>(replies.size());
            for (String reply : replies) {
                acks.add(CachePipeline.OK.equals(reply));
            }
            return acks;
        }
    }

    private static List<String> run(CachePipeline pipeline, int expected, String op) {
        long start = System.nanoTime();
        List<String> replies = pipeline.execute();
        if (log.isDebugEnabled()) {
            log.debug("Pipelined {} x{} in {}us", op, expected, (System.nanoTime() - start) / 1_000);
        }
        return checkReplies(replies, expected, op);
    }

    private static List<String> checkReplies(List<String> replies, int expected, String op) {
        if (replies == null || replies.size() != expected) {
            throw new CacheTransportException(op + " returned " + (replies == null ? "no" : replies.size())
                    + " replies for " + expected + " operations");
        }
        return replies;
    }
}
