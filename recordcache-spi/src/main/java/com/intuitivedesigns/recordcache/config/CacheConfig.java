/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.recordcache.config;

import com.intuitivedesigns.recordcache.errors.CacheConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;

/**
 * Flat key/value configuration for record caches.
 * Loads from -Drc.config.path or ENV 'RC_CONFIG_PATH', or from properties built in code.
 */
public final class CacheConfig {

    private static final Logger log = LoggerFactory.getLogger(CacheConfig.class);

    public static final String PATH_PROPERTY = "rc.config.path";
    public static final String PATH_ENV = "RC_CONFIG_PATH";

    private final Properties props;

    private CacheConfig(Properties props) {
        this.props = props;
    }

    public static CacheConfig fromProperties(Properties source) {
        Properties copy = new Properties();
        if (source != null) {
            for (String name : source.stringPropertyNames()) {
                copy.setProperty(name, source.getProperty(name));
            }
        }
        return new CacheConfig(copy);
    }

    public static CacheConfig fromMap(Map<String, String> values) {
        Properties props = new Properties();
        if (values != null) {
            values.forEach((k, v) -> {
                if (k != null && v != null) props.setProperty(k, v);
            });
        }
        return new CacheConfig(props);
    }

    public static CacheConfig load(Path path) {
        Properties props = new Properties();
        try (InputStream is = Files.newInputStream(path)) {
            props.load(is);
        } catch (IOException e) {
            throw new CacheConfigurationException(PATH_PROPERTY, "Failed to load config file " + path, e);
        }
        log.info("Loaded {} cache properties from {}", props.size(), path);
        return new CacheConfig(props);
    }

    /**
     * Resolves the config file from the system property first, then the environment.
     * Without either, an empty configuration is returned and every setting takes its default.
     */
    public static CacheConfig fromEnvironment() {
        String path = System.getProperty(PATH_PROPERTY);
        if (path == null || path.isBlank()) {
            path = System.getenv(PATH_ENV);
        }
        if (path == null || path.isBlank()) {
            log.warn("No cache configuration file specified (-D{} or {}); using defaults", PATH_PROPERTY, PATH_ENV);
            return new CacheConfig(new Properties());
        }
        return load(Path.of(path));
    }

    public String getString(String key, String defaultValue) {
        return props.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Long.parseLong(val.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /**
     * Strict variant of {@link #getLong}: a malformed or negative value is a configuration error.
     */
    public long requireNonNegativeLong(String key, long defaultValue) {
        String val = props.getProperty(key);
        if (val == null || val.isBlank()) return defaultValue;
        final long parsed;
        try {
            parsed = Long.parseLong(val.trim());
        } catch (NumberFormatException e) {
            throw new CacheConfigurationException(key, "Expected a non-negative integer but got '" + val + "'", e);
        }
        if (parsed < 0) {
            throw new CacheConfigurationException(key, "Must not be negative: " + parsed);
        }
        return parsed;
    }

    /**
     * {@link #requireNonNegativeLong} for int settings; values past {@link Integer#MAX_VALUE} are rejected, not wrapped.
     */
    public int requireNonNegativeInt(String key, int defaultValue) {
        long parsed = requireNonNegativeLong(key, defaultValue);
        if (parsed > Integer.MAX_VALUE) {
            throw new CacheConfigurationException(key, "Out of range: " + parsed);
        }
        return (int) parsed;
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String val = props.getProperty(key);
        return val == null ? defaultValue : Boolean.parseBoolean(val.trim());
    }

    public boolean hasPath(String key) {
        return props.containsKey(key);
    }
}
