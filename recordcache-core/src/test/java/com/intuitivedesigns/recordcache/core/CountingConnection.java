/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.recordcache.core;

import com.intuitivedesigns.recordcache.config.ServerIdentity;
import com.intuitivedesigns.recordcache.spi.CacheConnection;
import com.intuitivedesigns.recordcache.spi.CachePipeline;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Decorator counting network round trips: one per direct call, one per executed pipeline.
 */
class CountingConnection implements CacheConnection {

    private final CacheConnection delegate;

    final AtomicInteger gets = new AtomicInteger();
    final AtomicInteger mgets = new AtomicInteger();
    final AtomicInteger sets = new AtomicInteger();
    final AtomicInteger resolves = new AtomicInteger();
    final AtomicInteger pipelines = new AtomicInteger();
    final AtomicInteger pipelinedOps = new AtomicInteger();

    CountingConnection(CacheConnection delegate) {
        this.delegate = delegate;
    }

    int roundTrips() {
        return gets.get() + mgets.get() + sets.get() + resolves.get() + pipelines.get();
    }

    @Override
    public ServerIdentity identity() {
        return delegate.identity();
    }

    @Override
    public String get(String key) {
        gets.incrementAndGet();
        return delegate.get(key);
    }

    @Override
    public List<String> mget(List<String> keys) {
        mgets.incrementAndGet();
        return delegate.mget(keys);
    }

    @Override
    public boolean set(String key, String value, long ttlSeconds) {
        sets.incrementAndGet();
        return delegate.set(key, value, ttlSeconds);
    }

    @Override
    public String resolveIndirect(String key) {
        resolves.incrementAndGet();
        return delegate.resolveIndirect(key);
    }

    @Override
    public CachePipeline pipeline() {
        CachePipeline inner = delegate.pipeline();
        return new CachePipeline() {
            @Override public void get(String key) { inner.get(key); }
            @Override public void set(String key, String value, long ttlSeconds) { inner.set(key, value, ttlSeconds); }
            @Override public void resolveIndirect(String key) { inner.resolveIndirect(key); }
            @Override public int size() { return inner.size(); }

            @Override
            public List<String> execute() {
                pipelines.incrementAndGet();
                pipelinedOps.addAndGet(inner.size());
                return inner.execute();
            }

            @Override public void close() { inner.close(); }
        };
    }

    @Override
    public void close() {
        delegate.close();
    }
}
