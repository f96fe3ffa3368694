/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.recordcache.config;

import com.intuitivedesigns.recordcache.codec.JacksonRecordCodec;
import com.intuitivedesigns.recordcache.core.CacheStore;
import com.intuitivedesigns.recordcache.core.ConnectionRegistry;
import com.intuitivedesigns.recordcache.errors.CacheTransportException;
import com.intuitivedesigns.recordcache.errors.RecordCacheException;
import com.intuitivedesigns.recordcache.metrics.MetricsRuntime;
import com.intuitivedesigns.recordcache.spi.CacheConnection;
import com.intuitivedesigns.recordcache.spi.ConnectionPlugin;
import com.intuitivedesigns.recordcache.spi.PluginIds;
import com.intuitivedesigns.recordcache.spi.RecordCodec;
import com.intuitivedesigns.recordcache.spi.ServicePluginRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Wires configuration into {@link CacheStore}s.
 *
 * <p>Caches built by one factory for the same connection type and {@link ServerIdentity} share a
 * single connection. Closing the factory closes every connection it opened.</p>
 */
public final class RecordCacheFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RecordCacheFactory.class);

    // Config keys
    public static final String KEY_CONNECTION_TYPE = "cache.connection.type";

    // Defaults
    private static final String DEFAULT_CONNECTION = "REDIS";

    private final ServicePluginRegistry<ConnectionPlugin> plugins;
    private final MetricsRuntime metrics;
    private final Map<String, ConnectionRegistry> registries = new ConcurrentHashMap<>();

    public RecordCacheFactory(MetricsRuntime metrics) {
        this(new ServicePluginRegistry<>(ConnectionPlugin.class, resolveClassLoader()), metrics);
        logAvailablePlugins();
    }

    public RecordCacheFactory(ServicePluginRegistry<ConnectionPlugin> plugins, MetricsRuntime metrics) {
        this.plugins = Objects.requireNonNull(plugins, "plugins");
        this.metrics = (metrics == null) ? MetricsRuntime.noop() : metrics;
    }

    /**
     * Builds a cache of schemaless JSON records.
     */
    public CacheStore<Map<String, Object>> create(CacheConfig config) {
        return create(config, JacksonRecordCodec.forMaps());
    }

    public <R> CacheStore<R> create(CacheConfig config, RecordCodec<R> codec) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(codec, "codec");

        CacheSettings settings = CacheSettings.fromConfig(config);
        String type = normalizeId(config.getString(KEY_CONNECTION_TYPE, DEFAULT_CONNECTION), DEFAULT_CONNECTION);
        return create(settings, type, config, codec);
    }

    public <R> CacheStore<R> create(CacheSettings settings, String connectionType, CacheConfig config, RecordCodec<R> codec) {
        Objects.requireNonNull(settings, "settings");
        ConnectionPlugin plugin = plugins.require(connectionType, KEY_CONNECTION_TYPE);

        ConnectionRegistry registry = registries.computeIfAbsent(PluginIds.normalize(plugin.id()), id -> new ConnectionRegistry());
        CacheConnection connection = registry.getOrCreate(settings.server(),
                () -> connectSafe(plugin, settings.server(), config));
        metrics.gauge("cache.connections", connectionCount());

        log.info("Record cache ready: connection={} server={} ttl={}s indexes={}",
                plugin.id(), settings.server(), settings.ttlSeconds(),
                settings.indexes().stream().map(IndexDefinition::name).toList());
        return new CacheStore<>(connection, settings, codec, metrics);
    }

    public int connectionCount() {
        return registries.values().stream().mapToInt(ConnectionRegistry::size).sum();
    }

    public void logAvailablePlugins() {
        log.info("Connection plugins: {}", plugins.availableIds());
    }

    @Override
    public void close() {
        RuntimeException failure = null;
        for (ConnectionRegistry registry : registries.values()) {
            try {
                registry.close();
            } catch (RuntimeException e) {
                if (failure == null) failure = e;
                else failure.addSuppressed(e);
            }
        }
        registries.clear();
        if (failure != null) throw failure;
    }

    private CacheConnection connectSafe(ConnectionPlugin plugin, ServerIdentity identity, CacheConfig config) {
        try {
            return plugin.connect(identity, config, metrics);
        } catch (RecordCacheException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CacheTransportException("Failed creating connection [" + plugin.id() + "] to " + identity, e);
        }
    }

    private static String normalizeId(String raw, String fallback) {
        if (raw == null) return fallback;
        final String s = raw.trim();
        return s.isEmpty() ? fallback : s;
    }

    private static ClassLoader resolveClassLoader() {
        final ClassLoader ctx = Thread.currentThread().getContextClassLoader();
        return (ctx != null) ? ctx : RecordCacheFactory.class.getClassLoader();
    }
}
