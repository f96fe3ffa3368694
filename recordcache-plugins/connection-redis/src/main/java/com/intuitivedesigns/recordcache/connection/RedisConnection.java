/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.recordcache.connection;

import com.intuitivedesigns.recordcache.config.CacheConfig;
import com.intuitivedesigns.recordcache.config.ServerIdentity;
import com.intuitivedesigns.recordcache.errors.CacheTransportException;
import com.intuitivedesigns.recordcache.spi.CacheConnection;
import com.intuitivedesigns.recordcache.spi.CachePipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.Pipeline;
import redis.clients.jedis.Response;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.exceptions.JedisNoScriptException;
import redis.clients.jedis.params.SetParams;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Redis transport over a {@link JedisPool}.
 *
 * The pool is the shared, thread-safe object; every call borrows a client for its duration.
 * Index lookups run {@link IndirectGetScript} by SHA and fall back to EVAL when the server has
 * dropped its script cache (restart, SCRIPT FLUSH).
 */
public final class RedisConnection implements CacheConnection {

    private static final Logger log = LoggerFactory.getLogger(RedisConnection.class);

    private final JedisPool jedisPool;
    private final ServerIdentity identity;

    public RedisConnection(JedisPool pool, ServerIdentity identity) {
        this.jedisPool = Objects.requireNonNull(pool, "pool");
        this.identity = Objects.requireNonNull(identity, "identity");
    }

    /**
     * Builds the pool for {@code identity}. No connection is opened until first use.
     */
    public static RedisConnection fromConfig(ServerIdentity identity, CacheConfig config) {
        String password = config.getString("cache.redis.password", null);
        int timeout = config.getInt("cache.redis.timeout.ms", 2000);
        boolean ssl = config.getBoolean("cache.redis.ssl", false);

        JedisPoolConfig poolConfig = new JedisPoolConfig();
        poolConfig.setMaxTotal(config.getInt("cache.redis.pool.max", 128));
        poolConfig.setMaxIdle(config.getInt("cache.redis.pool.idle", 16));
        poolConfig.setMinIdle(config.getInt("cache.redis.pool.min", 4));
        poolConfig.setTestOnBorrow(false); // fast borrow
        poolConfig.setTestWhileIdle(true); // health check in background

        if (password != null && password.isBlank()) {
            password = null;
        }
        JedisPool pool = new JedisPool(poolConfig, identity.host(), identity.port(), timeout, password, identity.db(), ssl);

        log.info("Redis Connection Active: {} (timeout={}ms, pool.max={}, ssl={})", identity, timeout, poolConfig.getMaxTotal(), ssl);
        return new RedisConnection(pool, identity);
    }

    @Override
    public ServerIdentity identity() {
        return identity;
    }

    @Override
    public String get(String key) {
        try (Jedis jedis = jedisPool.getResource()) {
            return jedis.get(key);
        } catch (JedisException e) {
            throw failure("GET", key, e);
        }
    }

    @Override
    public List<String> mget(List<String> keys) {
        try (Jedis jedis = jedisPool.getResource()) {
            return jedis.mget(keys.toArray(new String[0]));
        } catch (JedisException e) {
            throw failure("MGET", keys.size() + " keys", e);
        }
    }

    @Override
    public boolean set(String key, String value, long ttlSeconds) {
        try (Jedis jedis = jedisPool.getResource()) {
            // Atomic Set-with-Expiry
            String reply = (ttlSeconds > 0)
                    ? jedis.set(key, value, SetParams.setParams().ex(ttlSeconds))
                    : jedis.set(key, value);
            return CachePipeline.OK.equals(reply);
        } catch (JedisException e) {
            throw failure("SET", key, e);
        }
    }

    @Override
    public String resolveIndirect(String key) {
        try (Jedis jedis = jedisPool.getResource()) {
            Object reply;
            try {
                reply = jedis.evalsha(IndirectGetScript.SHA1, 1, key);
            } catch (JedisNoScriptException e) {
                log.warn("Index script missing from {} script cache, sending source", identity);
                reply = jedis.eval(IndirectGetScript.SOURCE, 1, key);
            }
            return toReply(reply);
        } catch (JedisException e) {
            throw failure("EVALSHA", key, e);
        }
    }

    @Override
    public CachePipeline pipeline() {
        try {
            return new RedisPipeline(jedisPool.getResource());
        } catch (JedisException e) {
            throw failure("PIPELINE", "open", e);
        }
    }

    @Override
    public void close() {
        if (!jedisPool.isClosed()) {
            jedisPool.close();
            log.info("Redis Connection Closed: {}", identity);
        }
    }

    static String toReply(Object raw) {
        if (raw == null) return null;
        if (raw instanceof byte[]) return new String((byte[]) raw, StandardCharsets.UTF_8);
        return raw.toString();
    }

    private CacheTransportException failure(String op, String target, JedisException e) {
        return new CacheTransportException("Redis " + op + " failed on " + identity + " (" + target + "): " + e.getMessage(), e);
    }

    /**
     * Holds one borrowed client until executed or closed.
     * Index resolutions send the script source with EVAL, so a cold script cache cannot fail the batch.
     */
    private final class RedisPipeline implements CachePipeline {
        private final Jedis jedis;
        private final Pipeline pipeline;
        private final List<Response<?>> responses = new ArrayList<>();
        private boolean executed;
        private boolean done;

        RedisPipeline(Jedis jedis) {
            this.jedis = jedis;
            this.pipeline = jedis.pipelined();
        }

        @Override
        public void get(String key) {
            ensureOpen();
            responses.add(pipeline.get(key));
        }

        @Override
        public void set(String key, String value, long ttlSeconds) {
            ensureOpen();
            responses.add(ttlSeconds > 0
                    ? pipeline.set(key, value, SetParams.setParams().ex(ttlSeconds))
                    : pipeline.set(key, value));
        }

        @Override
        public void resolveIndirect(String key) {
            ensureOpen();
            responses.add(pipeline.eval(IndirectGetScript.SOURCE, 1, key));
        }

        @Override
        public int size() {
            return responses.size();
        }

        @Override
        public List<String> execute() {
            ensureOpen();
            executed = true;
            try {
                pipeline.sync();
                List<String> replies = new ArrayList<>(responses.size());
                for (Response<?> response : responses) {
                    replies.add(toReply(response.get()));
                }
                return replies;
            } catch (JedisException e) {
                throw failure("PIPELINE", responses.size() + " ops", e);
            } finally {
                close();
            }
        }

        @Override
        public void close() {
            if (done) return;
            done = true;
            if (!executed && !responses.isEmpty()) {
                // queued commands may sit in the output buffer; never hand that client back to the pool
                jedis.getConnection().setBroken();
            }
            jedis.close();
        }

        private void ensureOpen() {
            if (done) {
                throw new IllegalStateException("Pipeline already executed or closed");
            }
        }
    }
}
