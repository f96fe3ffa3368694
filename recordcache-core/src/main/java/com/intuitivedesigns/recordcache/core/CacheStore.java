/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.recordcache.core;

import com.intuitivedesigns.recordcache.config.CacheSettings;
import com.intuitivedesigns.recordcache.metrics.MetricsRuntime;
import com.intuitivedesigns.recordcache.spi.CacheConnection;
import com.intuitivedesigns.recordcache.spi.RecordCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Read-through record cache in front of a shared backing-store connection.
 *
 * <p>Each entry is either a record encoded by the {@link RecordCodec}, or the negative marker
 * {@value #NEGATIVE_MARKER} left by {@link #addMissing} for ids confirmed missing from the source
 * of truth. Lookups classify what they read into a {@link CacheResult}.</p>
 *
 * <p>Secondary indexes map {@code <index>:<values...>} to the primary id; index lookups
 * dereference that id atomically on the server.</p>
 *
 * <p><b>Thread-safety:</b> configuration is fixed at construction and the connection is
 * thread-safe, so one instance may be shared by any number of threads. Concurrent {@code store}
 * and {@code fetch} calls on the same id are not ordered; the last write the server applies wins.</p>
 *
 * <p>There is no delete: entries leave through TTL expiry in the backing store.</p>
 *
 * @param <R> record type
 */
public final class CacheStore<R> {

    private static final Logger log = LoggerFactory.getLogger(CacheStore.class);

    /** Wire value of a negative cache entry. */
    public static final String NEGATIVE_MARKER = "0";

    private final CacheConnection connection;
    private final IndexCatalog catalog;
    private final RecordCodec<R> codec;
    private final long ttlSeconds;
    private final MetricsRuntime metrics;

    private final SecondaryResolver resolver;
    private final BatchExecutor batch;

    public CacheStore(CacheConnection connection,
                      IndexCatalog catalog,
                      RecordCodec<R> codec,
                      Duration ttl,
                      MetricsRuntime metrics) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.catalog = (catalog == null) ? IndexCatalog.empty() : catalog;
        this.codec = Objects.requireNonNull(codec, "codec");
        this.ttlSeconds = CacheSettings.toSeconds(ttl);
        this.metrics = (metrics == null) ? MetricsRuntime.noop() : metrics;
        this.resolver = new SecondaryResolver(connection);
        this.batch = new BatchExecutor(connection, resolver);
    }

    public CacheStore(CacheConnection connection, CacheSettings settings, RecordCodec<R> codec, MetricsRuntime metrics) {
        this(connection, new IndexCatalog(settings.indexes()), codec, settings.ttl(), metrics);
    }

    // --- fetch ---

    public CacheResult<R> fetch(String id) {
        requireId(id);
        long start = System.nanoTime();
        try {
            return classify(connection.get(id));
        } finally {
            recordLatency(start);
        }
    }

    /**
     * Looks {@code id} up directly, or through {@code index} when one is given, in which case
     * {@code id} is the value of the index's single field.
     */
    public CacheResult<R> fetch(String id, String index) {
        if (index == null) {
            return fetch(id);
        }
        catalog.require(index);
        requireId(id);
        return fetch(IndexTuple.of(id), index);
    }

    public CacheResult<R> fetch(IndexTuple tuple, String index) {
        String key = indexKey(tuple, index);
        long start = System.nanoTime();
        try {
            return classify(resolver.resolve(key));
        } finally {
            recordLatency(start);
        }
    }

    /**
     * Fetches several ids in one round trip.
     *
     * @return one result per id, in input order
     */
    public List<CacheResult<R>> fetchAll(List<String> ids) {
        requireIds(ids);
        long start = System.nanoTime();
        try {
            return classifyAll(batch.getAll(ids));
        } finally {
            recordLatency(start);
        }
    }

    public List<CacheResult<R>> fetchAll(List<String> ids, String index) {
        if (index == null) {
            return fetchAll(ids);
        }
        catalog.require(index);
        requireIds(ids);
        List<IndexTuple> tuples = new ArrayList<>(ids.size());
        for (String id : ids) {
            tuples.add(IndexTuple.of(id));
        }
        return fetchAllByIndex(tuples, index);
    }

    /**
     * Resolves every tuple through {@code index}. The resolutions share one pipeline; each one is
     * atomic by itself.
     *
     * @return one result per tuple, in input order
     */
    public List<CacheResult<R>> fetchAllByIndex(List<IndexTuple> tuples, String index) {
        requireIndex(index);
        catalog.require(index);
        Objects.requireNonNull(tuples, "tuples");

        List<String> keys = new ArrayList<>(tuples.size());
        for (IndexTuple tuple : tuples) {
            keys.add(catalog.resolveKey(index, Objects.requireNonNull(tuple, "tuple")));
        }

        long start = System.nanoTime();
        try {
            return classifyAll(batch.resolveAll(keys));
        } finally {
            recordLatency(start);
        }
    }

    // --- store ---

    /**
     * Caches {@code record} under {@code id}, plus one entry per configured index pointing back at
     * {@code id}.
     *
     * <p>With indexes the writes go out as one pipeline. A pipeline is not a transaction: if the
     * connection drops mid-batch the record may be cached without all of its index entries, or the
     * reverse. Such gaps show up as index misses and heal on the next store or on expiry.</p>
     *
     * @return true when every write was acknowledged
     */
    public boolean store(String id, R record) {
        requireId(id);
        Objects.requireNonNull(record, "record");

        String encoded = codec.encode(record);
        if (NEGATIVE_MARKER.equals(encoded)) {
            throw new IllegalArgumentException("Encoded record for id " + id + " collides with the negative marker");
        }

        long start = System.nanoTime();
        try {
            if (catalog.isEmpty()) {
                boolean ok = connection.set(id, encoded, ttlSeconds);
                metrics.counter("cache.writes");
                return ok;
            }

            // Build every key before sending anything, so a bad field fails without a partial write
            Map<String, Object> fields = codec.fields(record);
            List<String> indexKeys = catalog.resolveKeys(fields);

            List<BatchExecutor.Write> writes = new ArrayList<>(indexKeys.size() + 1);
            writes.add(new BatchExecutor.Write(id, encoded, ttlSeconds));
            for (String key : indexKeys) {
                writes.add(new BatchExecutor.Write(key, id, ttlSeconds));
            }

            List<Boolean> acks = batch.writeAll(writes);
            metrics.counter("cache.writes");
            boolean ok = !acks.contains(Boolean.FALSE);
            if (!ok) {
                log.warn("Partial store for id={}: acknowledgements={}", id, acks);
            }
            return ok;
        } finally {
            recordLatency(start);
        }
    }

    // --- negative cache ---

    /**
     * Marks {@code id} as missing from the source of truth, with the cache's TTL.
     */
    public boolean addMissing(String id) {
        return addMissing(id, null);
    }

    /**
     * @param ttl overrides the cache's TTL for this marker; null keeps the cache's TTL, zero means never expire
     */
    public boolean addMissing(String id, Duration ttl) {
        requireId(id);
        long seconds = markerTtl(ttl);
        boolean ok = connection.set(id, NEGATIVE_MARKER, seconds);
        metrics.counter("cache.negative.writes");
        return ok;
    }

    public List<Boolean> addMissing(List<String> ids) {
        return addMissing(ids, null);
    }

    /**
     * Marks every id in one pipeline.
     *
     * @return one acknowledgement per id, in input order
     */
    public List<Boolean> addMissing(List<String> ids, Duration ttl) {
        requireIds(ids);
        long seconds = markerTtl(ttl);
        List<BatchExecutor.Write> writes = new ArrayList<>(ids.size());
        for (String id : ids) {
            writes.add(new BatchExecutor.Write(id, NEGATIVE_MARKER, seconds));
        }
        List<Boolean> acks = batch.writeAll(writes);
        metrics.counter("cache.negative.writes", acks.size());
        return acks;
    }

    // --- accessors ---

    public IndexCatalog indexes() {
        return catalog;
    }

    public long ttlSeconds() {
        return ttlSeconds;
    }

    // --- internals ---

    private CacheResult<R> classify(String raw) {
        if (raw == null || raw.isEmpty()) {
            metrics.counter("cache.misses");
            return CacheResult.absent();
        }
        if (NEGATIVE_MARKER.equals(raw)) {
            metrics.counter("cache.negatives");
            return CacheResult.negative();
        }
        metrics.counter("cache.hits");
        return CacheResult.found(codec.decode(raw));
    }

    private List<CacheResult<R>> classifyAll(List<String> raw) {
        List<CacheResult<R>> out = new ArrayList<>(raw.size());
        for (String r : raw) {
            out.add(classify(r));
        }
        return out;
    }

    private String indexKey(IndexTuple tuple, String index) {
        requireIndex(index);
        catalog.require(index);
        Objects.requireNonNull(tuple, "tuple");
        return catalog.resolveKey(index, tuple);
    }

    private long markerTtl(Duration ttl) {
        return (ttl == null) ? ttlSeconds : CacheSettings.toSeconds(ttl);
    }

    private void recordLatency(long startNs) {
        metrics.timer("cache.latency", System.nanoTime() - startNs);
    }

    private static void requireIndex(String index) {
        if (index == null || index.isBlank()) {
            throw new IllegalArgumentException("tuples can only be used when fetching a secondary index");
        }
    }

    private static void requireId(String id) {
        if (id == null) {
            throw new IllegalArgumentException("id must not be null");
        }
    }

    private static void requireIds(List<String> ids) {
        if (ids == null) {
            throw new IllegalArgumentException("ids must not be null");
        }
        for (int i = 0; i < ids.size(); i++) {
            if (ids.get(i) == null) {
                throw new IllegalArgumentException("ids[" + i + "] must not be null");
            }
        }
    }
}
