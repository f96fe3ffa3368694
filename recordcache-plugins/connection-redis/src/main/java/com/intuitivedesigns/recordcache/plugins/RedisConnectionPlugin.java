/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.recordcache.plugins;

import com.intuitivedesigns.recordcache.config.CacheConfig;
import com.intuitivedesigns.recordcache.config.ServerIdentity;
import com.intuitivedesigns.recordcache.connection.RedisConnection;
import com.intuitivedesigns.recordcache.metrics.MetricsRuntime;
import com.intuitivedesigns.recordcache.spi.CacheConnection;
import com.intuitivedesigns.recordcache.spi.ConnectionPlugin;

public final class RedisConnectionPlugin implements ConnectionPlugin {

    public static final String ID = "REDIS";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public CacheConnection connect(ServerIdentity identity, CacheConfig config, MetricsRuntime metrics) {
        return RedisConnection.fromConfig(identity, config);
    }
}
