/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.recordcache.plugins;

import com.github.benmanes.caffeine.cache.Ticker;
import com.intuitivedesigns.recordcache.config.CacheConfig;
import com.intuitivedesigns.recordcache.config.ServerIdentity;
import com.intuitivedesigns.recordcache.connection.LocalConnection;
import com.intuitivedesigns.recordcache.metrics.MetricsRuntime;
import com.intuitivedesigns.recordcache.spi.CacheConnection;
import com.intuitivedesigns.recordcache.spi.ConnectionPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LocalConnectionPlugin implements ConnectionPlugin {

    public static final String ID = "LOCAL";
    private static final Logger log = LoggerFactory.getLogger(LocalConnectionPlugin.class);

    @Override
    public String id() {
        return ID;
    }

    @Override
    public CacheConnection connect(ServerIdentity identity, CacheConfig config, MetricsRuntime metrics) {
        long maxEntries = config.requireNonNegativeLong("cache.local.max.entries", 0);
        log.info("Creating Local Connection {} (maxEntries={})", identity, maxEntries == 0 ? "unbounded" : maxEntries);
        return new LocalConnection(identity, Ticker.systemTicker(), maxEntries);
    }
}
