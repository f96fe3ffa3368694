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
import com.intuitivedesigns.recordcache.spi.ServicePluginRegistry;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RedisConnectionPluginTest {

    @Test
    void testDiscoveredThroughServiceLoader() {
        ServicePluginRegistry<ConnectionPlugin> registry = new ServicePluginRegistry<>(ConnectionPlugin.class);

        assertInstanceOf(RedisConnectionPlugin.class, registry.require("redis", "cache.connection.type"));
    }

    @Test
    void testConnectBuildsConnectionForIdentity() {
        ServerIdentity identity = new ServerIdentity("127.0.0.1", 6390, 4);
        CacheConfig config = CacheConfig.fromMap(Map.of("cache.redis.pool.min", "0"));

        try (CacheConnection connection = new RedisConnectionPlugin().connect(identity, config, MetricsRuntime.noop())) {
            assertInstanceOf(RedisConnection.class, connection);
            assertEquals(identity, connection.identity());
        }
    }
}
