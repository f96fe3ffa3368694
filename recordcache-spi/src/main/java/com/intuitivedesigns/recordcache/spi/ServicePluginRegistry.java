/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.recordcache.spi;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Plugins of one SPI type, keyed by their normalized {@link ServicePlugin#id()}.
 *
 * <p>The classpath is scanned once, at construction. Ids are matched case-insensitively, so
 * {@code cache.connection.type=local} selects the {@code LOCAL} plugin.</p>
 *
 * @param <T> the SPI type, e.g. {@link ConnectionPlugin}
 */
public final class ServicePluginRegistry<T extends ServicePlugin> {

    private final String spiName;
    private final Map<String, T> plugins;

    public ServicePluginRegistry(Class<T> spiType) {
        this(spiType, Thread.currentThread().getContextClassLoader());
    }

    public ServicePluginRegistry(Class<T> spiType, ClassLoader classLoader) {
        this(spiType.getSimpleName(), ServiceLoader.load(spiType, classLoader));
    }

    private ServicePluginRegistry(String spiName, Iterable<? extends T> discovered) {
        this.spiName = spiName;
        Map<String, T> index = new LinkedHashMap<>();
        for (T plugin : discovered) {
            String id = PluginIds.normalize(plugin.id());
            if (id.isEmpty()) {
                throw new IllegalStateException(spiName + " " + plugin.getClass().getName() + " has a blank id");
            }
            T previous = index.putIfAbsent(id, plugin);
            if (previous != null) {
                throw new IllegalStateException(spiName + " id " + id + " is claimed by both "
                        + previous.getClass().getName() + " and " + plugin.getClass().getName());
            }
        }
        this.plugins = Collections.unmodifiableMap(index);
    }

    /**
     * Builds a registry from explicit instances instead of a classpath scan.
     */
    public static <T extends ServicePlugin> ServicePluginRegistry<T> of(Class<T> spiType, Collection<? extends T> plugins) {
        return new ServicePluginRegistry<>(spiType.getSimpleName(), new ArrayList<>(plugins));
    }

    /**
     * @param configKey the setting {@code id} came from, named in the error
     * @throws IllegalArgumentException when no plugin has that id
     */
    public T require(String id, String configKey) {
        return get(id).orElseThrow(() -> new IllegalArgumentException(
                "Unknown " + spiName + " '" + id + "' for " + configKey + "; installed: " + plugins.keySet()));
    }

    public Optional<T> get(String id) {
        return Optional.ofNullable(plugins.get(PluginIds.normalize(id)));
    }

    public Set<String> availableIds() {
        return plugins.keySet();
    }
}
