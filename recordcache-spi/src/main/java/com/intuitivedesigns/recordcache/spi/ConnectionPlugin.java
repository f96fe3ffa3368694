/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.recordcache.spi;

import com.intuitivedesigns.recordcache.config.CacheConfig;
import com.intuitivedesigns.recordcache.config.ServerIdentity;
import com.intuitivedesigns.recordcache.metrics.MetricsRuntime;

/**
 * SPI factory for backing-store connections, discovered through {@link java.util.ServiceLoader}.
 * Selected with {@code cache.connection.type}.
 */
public interface ConnectionPlugin extends ServicePlugin {

    /**
     * Opens a new connection. Called at most once per identity by the connection registry,
     * so implementations need not dedupe themselves.
     */
    CacheConnection connect(ServerIdentity identity, CacheConfig config, MetricsRuntime metrics);
}
