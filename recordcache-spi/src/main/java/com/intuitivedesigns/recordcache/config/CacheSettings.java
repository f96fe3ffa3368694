/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.recordcache.config;

import com.intuitivedesigns.recordcache.errors.CacheConfigurationException;

import java.time.Duration;
import java.util.List;

/**
 * Immutable settings of one record cache.
 *
 * @param ttl     expiry applied to records, index entries and negative markers; zero means never expire
 * @param server  backing server
 * @param indexes secondary index definitions, possibly empty
 */
public record CacheSettings(Duration ttl, ServerIdentity server, List<IndexDefinition> indexes) {

    public static final String KEY_TTL_SECONDS = "cache.ttl.seconds";
    public static final String KEY_HOST = "cache.redis.host";
    public static final String KEY_PORT = "cache.redis.port";
    public static final String KEY_DB = "cache.redis.db";
    public static final String KEY_INDEXES = "cache.indexes";

    public CacheSettings {
        if (ttl == null) ttl = Duration.ZERO;
        if (ttl.isNegative()) {
            throw new CacheConfigurationException("ttl", "TTL must not be negative: " + ttl);
        }
        if (server == null) server = ServerIdentity.defaults();
        indexes = (indexes == null) ? List.of() : List.copyOf(indexes);
    }

    public static CacheSettings fromConfig(CacheConfig config) {
        long ttl = config.requireNonNegativeLong(KEY_TTL_SECONDS, 0);
        ServerIdentity server = new ServerIdentity(
                config.getString(KEY_HOST, ServerIdentity.DEFAULT_HOST),
                config.requireNonNegativeInt(KEY_PORT, ServerIdentity.DEFAULT_PORT),
                config.requireNonNegativeInt(KEY_DB, ServerIdentity.DEFAULT_DB));
        List<IndexDefinition> indexes = IndexDefinitions.parse(config.getString(KEY_INDEXES, null), KEY_INDEXES);
        return new CacheSettings(Duration.ofSeconds(ttl), server, indexes);
    }

    public long ttlSeconds() {
        return toSeconds(ttl);
    }

    /**
     * Whole seconds for the backing store's expiry. Sub-second remainders round up so that a
     * positive TTL never turns into "never expire".
     */
    public static long toSeconds(Duration ttl) {
        if (ttl == null || ttl.isZero()) return 0;
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must not be negative: " + ttl);
        }
        long seconds = ttl.getSeconds();
        return (ttl.getNano() > 0 && seconds < Long.MAX_VALUE) ? seconds + 1 : seconds;
    }
}
