/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.recordcache.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsRuntimeTest {

    @Test
    void testRecordsUnderPrefix() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MicrometerMetricsRuntime metrics = new MicrometerMetricsRuntime(registry, "rc");

        metrics.counter("cache.hits");
        metrics.counter("cache.negative.writes", 3);
        metrics.counter("cache.negative.writes", 0);
        metrics.timer("cache.latency", TimeUnit.MILLISECONDS.toNanos(5));

        assertEquals(1.0, registry.get("rc.cache.hits").counter().count());
        assertEquals(3.0, registry.get("rc.cache.negative.writes").counter().count());
        assertEquals(1, registry.get("rc.cache.latency").timer().count());
        assertTrue(metrics.enabled());
    }

    @Test
    void testGaugeKeepsLatestValue() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        MicrometerMetricsRuntime metrics = new MicrometerMetricsRuntime(registry, null);

        metrics.gauge("cache.connections", 1);
        metrics.gauge("cache.connections", 2);

        assertEquals(2.0, registry.get("cache.connections").gauge().value());
        assertEquals(1, registry.find("cache.connections").gauges().size());
    }

    @Test
    void testNoopRecordsNothing() {
        MetricsRuntime metrics = MetricsRuntime.noop();

        metrics.counter("cache.hits");
        assertFalse(metrics.enabled());
        assertNull(metrics.registry());
    }
}
