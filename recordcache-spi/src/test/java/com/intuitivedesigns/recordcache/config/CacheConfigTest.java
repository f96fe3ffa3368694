/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.recordcache.config;

import com.intuitivedesigns.recordcache.errors.CacheConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class CacheConfigTest {

    @Test
    void testLoadFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("cache.properties");
        Files.writeString(file, "cache.ttl.seconds=60\ncache.redis.host=redis-1\n");

        CacheConfig config = CacheConfig.load(file);

        assertEquals(60, config.getLong("cache.ttl.seconds", 0));
        assertEquals("redis-1", config.getString("cache.redis.host", "localhost"));
        assertTrue(config.hasPath("cache.ttl.seconds"));
    }

    @Test
    void testMissingFileIsConfigurationError(@TempDir Path dir) {
        assertThrows(CacheConfigurationException.class, () -> CacheConfig.load(dir.resolve("nope.properties")));
    }

    @Test
    void testLenientGettersFallBackToDefault() {
        CacheConfig config = CacheConfig.fromMap(Map.of("pool.max", "lots", "flag", "true"));

        assertEquals(128, config.getInt("pool.max", 128));
        assertEquals(7L, config.getLong("absent", 7L));
        assertTrue(config.getBoolean("flag", false));
    }

    @Test
    void testStrictGetterRejectsNegative() {
        CacheConfig config = CacheConfig.fromMap(Map.of("n", "-3"));

        assertThrows(CacheConfigurationException.class, () -> config.requireNonNegativeLong("n", 0));
        assertEquals(5, config.requireNonNegativeLong("absent", 5));
    }

    @Test
    void testStrictIntGetterRejectsValuesPastIntRange() {
        CacheConfig config = CacheConfig.fromMap(Map.of("big", "2147483648", "max", "2147483647"));

        CacheConfigurationException e = assertThrows(CacheConfigurationException.class, () -> config.requireNonNegativeInt("big", 0));
        assertEquals("big", e.field());
        assertEquals(Integer.MAX_VALUE, config.requireNonNegativeInt("max", 0));
        assertEquals(6379, config.requireNonNegativeInt("absent", 6379));
    }

    @Test
    void testFromPropertiesCopiesSource() {
        Properties source = new Properties();
        source.setProperty("cache.redis.db", "2");

        CacheConfig config = CacheConfig.fromProperties(source);
        source.setProperty("cache.redis.db", "9");

        assertEquals(2, config.getInt("cache.redis.db", 0));
    }

    @Test
    void testFromEnvironmentUsesSystemProperty(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("rc.properties");
        Files.writeString(file, "cache.connection.type=LOCAL\n");

        String previous = System.getProperty(CacheConfig.PATH_PROPERTY);
        System.setProperty(CacheConfig.PATH_PROPERTY, file.toString());
        try {
            assertEquals("LOCAL", CacheConfig.fromEnvironment().getString("cache.connection.type", "REDIS"));
        } finally {
            if (previous == null) System.clearProperty(CacheConfig.PATH_PROPERTY);
            else System.setProperty(CacheConfig.PATH_PROPERTY, previous);
        }
    }
}
