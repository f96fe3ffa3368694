/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.recordcache.core;

import com.intuitivedesigns.recordcache.config.ServerIdentity;
import com.intuitivedesigns.recordcache.connection.LocalConnection;
import com.intuitivedesigns.recordcache.spi.CacheConnection;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionRegistryTest {

    private static final ServerIdentity A = new ServerIdentity("cache-a", 6379, 0);

    @Test
    void testSameIdentitySharesOneConnection() {
        ConnectionRegistry registry = new ConnectionRegistry();
        AtomicInteger created = new AtomicInteger();

        CacheConnection first = registry.getOrCreate(A, () -> {
            created.incrementAndGet();
            return new LocalConnection(A);
        });
        CacheConnection second = registry.getOrCreate(new ServerIdentity("cache-a", 6379, 0), () -> {
            created.incrementAndGet();
            return new LocalConnection(A);
        });

        assertSame(first, second);
        assertEquals(1, created.get());
    }

    @Test
    void testLogicalDatabaseIsPartOfIdentity() {
        ConnectionRegistry registry = new ConnectionRegistry();

        CacheConnection db0 = registry.getOrCreate(A, () -> new LocalConnection(A));
        ServerIdentity db1 = new ServerIdentity("cache-a", 6379, 1);
        CacheConnection other = registry.getOrCreate(db1, () -> new LocalConnection(db1));

        assertNotSame(db0, other);
        assertEquals(2, registry.size());
    }

    @Test
    void testConcurrentFirstUseCreatesOnce() throws Exception {
        ConnectionRegistry registry = new ConnectionRegistry();
        AtomicInteger created = new AtomicInteger();
        int threads = 16;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<CacheConnection>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return registry.getOrCreate(A, () -> {
                        created.incrementAndGet();
                        return new LocalConnection(A);
                    });
                }));
            }
            start.countDown();

            CacheConnection expected = futures.get(0).get(5, TimeUnit.SECONDS);
            for (Future<CacheConnection> f : futures) {
                assertSame(expected, f.get(5, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, created.get());
    }

    @Test
    void testFailedConnectIsNotCached() {
        ConnectionRegistry registry = new ConnectionRegistry();

        assertThrows(IllegalStateException.class, () -> registry.getOrCreate(A, () -> {
            throw new IllegalStateException("refused");
        }));
        assertFalse(registry.contains(A));

        CacheConnection retried = registry.getOrCreate(A, () -> new LocalConnection(A));
        assertNotNull(retried);
        assertTrue(registry.contains(A));
    }

    @Test
    void testCloseClosesEveryConnection() {
        ConnectionRegistry registry = new ConnectionRegistry();
        LocalConnection connection = new LocalConnection(A);
        registry.getOrCreate(A, () -> connection);
        connection.set("k", "v", 0);

        registry.close();

        assertEquals(0, registry.size());
        assertNull(connection.get("k"));
    }
}
