/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.recordcache.core;

import com.intuitivedesigns.recordcache.config.ServerIdentity;
import com.intuitivedesigns.recordcache.spi.CacheConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Shares one live connection per {@link ServerIdentity}.
 *
 * <p>At most one connection is ever created per identity, including under concurrent first use.
 * A failing {@code connect} propagates to the caller and leaves nothing registered, so the next
 * caller tries again.</p>
 */
public final class ConnectionRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final ConcurrentMap<ServerIdentity, CacheConnection> connections = new ConcurrentHashMap<>();

    public CacheConnection getOrCreate(ServerIdentity identity, Supplier<? extends CacheConnection> connect) {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(connect, "connect");

        CacheConnection existing = connections.get(identity);
        if (existing != null) {
            return existing;
        }

        // computeIfAbsent runs the supplier once per key; racing callers wait for the winner
        return connections.computeIfAbsent(identity, id -> {
            CacheConnection created = connect.get();
            if (created == null) {
                throw new IllegalStateException("Connection factory returned null for " + id);
            }
            log.info("Opened shared connection to {}", id);
            return created;
        });
    }

    public boolean contains(ServerIdentity identity) {
        return connections.containsKey(identity);
    }

    public int size() {
        return connections.size();
    }

    /**
     * Closes every registered connection. Failures are collected so one bad connection does not
     * leak the others; the first one is rethrown with the rest suppressed.
     */
    @Override
    public void close() {
        List<RuntimeException> failures = new ArrayList<>();
        for (ServerIdentity identity : List.copyOf(connections.keySet())) {
            CacheConnection connection = connections.remove(identity);
            if (connection == null) continue;
            try {
                connection.close();
                log.info("Closed shared connection to {}", identity);
            } catch (RuntimeException e) {
                log.warn("Failed closing connection to {}", identity, e);
                failures.add(e);
            }
        }
        if (!failures.isEmpty()) {
            RuntimeException first = failures.get(0);
            for (int i = 1; i < failures.size(); i++) {
                first.addSuppressed(failures.get(i));
            }
            throw first;
        }
    }
}
