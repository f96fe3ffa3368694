/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.recordcache.connection;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.intuitivedesigns.recordcache.config.ServerIdentity;
import com.intuitivedesigns.recordcache.spi.CacheConnection;
import com.intuitivedesigns.recordcache.spi.CachePipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * In-process backing store on Caffeine, with per-entry expiry.
 *
 * Characteristics:
 * - Thread-safe
 * - Non-evicting: entries leave only through their TTL
 * - Bounded: beyond {@code maxEntries} new keys are refused, existing keys can still be overwritten
 *
 * Writes, indirect reads and whole pipelines run under one lock, which is what makes
 * {@link #resolveIndirect} and pipelined batches atomic here.
 */
public final class LocalConnection implements CacheConnection {

    private static final Logger log = LoggerFactory.getLogger(LocalConnection.class);

    private final ServerIdentity identity;
    private final Cache<String, Entry> entries;
    private final long maxEntries;
    private final Object lock = new Object();

    private record Entry(String value, long ttlNanos) {}

    public LocalConnection(ServerIdentity identity) {
        this(identity, Ticker.systemTicker(), 0);
    }

    /**
     * @param maxEntries safety valve against unbounded growth, 0 for no limit
     */
    public LocalConnection(ServerIdentity identity, Ticker ticker, long maxEntries) {
        this.identity = Objects.requireNonNull(identity, "identity");
        this.maxEntries = maxEntries;
        this.entries = Caffeine.newBuilder()
                .ticker(Objects.requireNonNull(ticker, "ticker"))
                .executor(Runnable::run)
                .expireAfter(new TtlExpiry())
                .build();
    }

    @Override
    public ServerIdentity identity() {
        return identity;
    }

    @Override
    public String get(String key) {
        Entry e = entries.getIfPresent(key);
        return e == null ? null : e.value();
    }

    @Override
    public List<String> mget(List<String> keys) {
        synchronized (lock) {
            List<String> out = new ArrayList<>(keys.size());
            for (String key : keys) {
                out.add(get(key));
            }
            return out;
        }
    }

    @Override
    public boolean set(String key, String value, long ttlSeconds) {
        synchronized (lock) {
            return write(key, value, ttlSeconds);
        }
    }

    @Override
    public String resolveIndirect(String key) {
        synchronized (lock) {
            String primary = get(key);
            return primary == null ? null : get(primary);
        }
    }

    @Override
    public CachePipeline pipeline() {
        return new LocalPipeline();
    }

    public long size() {
        entries.cleanUp();
        return entries.estimatedSize();
    }

    @Override
    public void close() {
        entries.invalidateAll();
        entries.cleanUp();
        log.debug("Local connection {} closed.", identity);
    }

    private boolean write(String key, String value, long ttlSeconds) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (ttlSeconds < 0) {
            throw new IllegalArgumentException("ttlSeconds must not be negative: " + ttlSeconds);
        }
        if (maxEntries > 0 && entries.estimatedSize() >= maxEntries && entries.getIfPresent(key) == null) {
            log.debug("Local connection {} full ({} entries), refusing key={}", identity, maxEntries, key);
            return false;
        }
        long ttlNanos = (ttlSeconds == 0) ? Long.MAX_VALUE : TimeUnit.SECONDS.toNanos(ttlSeconds);
        entries.put(key, new Entry(value, ttlNanos));
        return true;
    }

    private static final class TtlExpiry implements Expiry<String, Entry> {
        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }

    private final class LocalPipeline implements CachePipeline {
        private final List<Supplier<String>> ops = new ArrayList<>();
        private boolean done;

        @Override
        public void get(String key) {
            queue(() -> LocalConnection.this.get(key));
        }

        @Override
        public void set(String key, String value, long ttlSeconds) {
            queue(() -> write(key, value, ttlSeconds) ? OK : null);
        }

        @Override
        public void resolveIndirect(String key) {
            queue(() -> {
                String primary = LocalConnection.this.get(key);
                return primary == null ? null : LocalConnection.this.get(primary);
            });
        }

        @Override
        public int size() {
            return ops.size();
        }

        @Override
        public List<String> execute() {
            ensureOpen();
            done = true;
            synchronized (lock) {
                List<String> replies = new ArrayList<>(ops.size());
                for (Supplier<String> op : ops) {
                    replies.add(op.get());
                }
                return replies;
            }
        }

        @Override
        public void close() {
            done = true;
        }

        private void queue(Supplier<String> op) {
            ensureOpen();
            ops.add(op);
        }

        private void ensureOpen() {
            if (done) {
                throw new IllegalStateException("Pipeline already executed or closed");
            }
        }
    }
}
