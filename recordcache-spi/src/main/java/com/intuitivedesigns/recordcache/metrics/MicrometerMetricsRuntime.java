/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.recordcache.metrics;

import com.intuitivedesigns.recordcache.config.CacheConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link MetricsRuntime} on a Micrometer {@link MeterRegistry}.
 *
 * Meter names get an optional prefix ({@code metrics.prefix}). Counters and timers are looked up
 * once and reused, since they sit on the fetch path. Gauges are push-style: the last value set is
 * what Micrometer polls.
 */
public final class MicrometerMetricsRuntime implements MetricsRuntime {

    private static final Logger log = LoggerFactory.getLogger(MicrometerMetricsRuntime.class);

    private final MeterRegistry registry;
    private final String prefix;

    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();
    // double bits, read by the registered gauge
    private final Map<String, AtomicLong> gauges = new ConcurrentHashMap<>();

    public MicrometerMetricsRuntime() {
        this(inMemoryRegistry(), "");
    }

    public MicrometerMetricsRuntime(MeterRegistry registry, String prefix) {
        this.registry = (registry == null) ? inMemoryRegistry() : registry;
        this.prefix = (prefix == null || prefix.isBlank()) ? "" : prefix.trim() + ".";
    }

    public static MicrometerMetricsRuntime fromConfig(CacheConfig config) {
        MicrometerMetricsRuntime runtime = new MicrometerMetricsRuntime(inMemoryRegistry(), config.getString("metrics.prefix", ""));
        log.info("Cache metrics on Micrometer (prefix='{}')", runtime.prefix);
        return runtime;
    }

    /**
     * Composite with an in-memory child, so meters record even before a backend is attached.
     */
    private static MeterRegistry inMemoryRegistry() {
        CompositeMeterRegistry composite = new CompositeMeterRegistry();
        composite.add(new SimpleMeterRegistry());
        return composite;
    }

    @Override
    public Object registry() {
        return registry;
    }

    @Override
    public boolean enabled() {
        return true;
    }

    @Override
    public String type() {
        return "MICROMETER";
    }

    @Override
    public void counter(String name) {
        counterFor(name).increment();
    }

    @Override
    public void counter(String name, double increment) {
        if (increment > 0) {
            counterFor(name).increment(increment);
        }
    }

    @Override
    public void timer(String name, long durationNanos) {
        timers.computeIfAbsent(prefix + name, registry::timer).record(durationNanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void gauge(String name, double value) {
        long bits = Double.doubleToLongBits(value);
        gauges.computeIfAbsent(prefix + name, key -> {
            AtomicLong state = new AtomicLong(bits);
            Gauge.builder(key, state, s -> Double.longBitsToDouble(s.get())).register(registry);
            return state;
        }).set(bits);
    }

    @Override
    public void close() {
        registry.close();
        log.info("Cache metrics closed.");
    }

    private Counter counterFor(String name) {
        return counters.computeIfAbsent(prefix + name, registry::counter);
    }
}
