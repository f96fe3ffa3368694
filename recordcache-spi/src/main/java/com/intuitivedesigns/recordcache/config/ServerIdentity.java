/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.recordcache.config;

import com.intuitivedesigns.recordcache.errors.CacheConfigurationException;

/**
 * Identifies one backing server. Caches with equal identities share a single connection.
 *
 * @param host server host name
 * @param port server port
 * @param db   logical database number
 */
public record ServerIdentity(String host, int port, int db) {

    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 6379;
    public static final int DEFAULT_DB = 0;

    public ServerIdentity {
        if (host == null || host.isBlank()) {
            throw new CacheConfigurationException("server.host", "Host must not be blank");
        }
        host = host.trim();
        if (port < 1 || port > 65_535) {
            throw new CacheConfigurationException("server.port", "Port out of range: " + port);
        }
        if (db < 0) {
            throw new CacheConfigurationException("server.db", "Logical database must not be negative: " + db);
        }
    }

    public static ServerIdentity defaults() {
        return new ServerIdentity(DEFAULT_HOST, DEFAULT_PORT, DEFAULT_DB);
    }

    @Override
    public String toString() {
        return host + ":" + port + "/" + db;
    }
}
