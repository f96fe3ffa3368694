/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.recordcache.metrics;

/**
 * Vendor-agnostic metrics contract.
 *
 * Every instrumentation method defaults to a no-op, so caches run unchanged when nothing records.
 */
public interface MetricsRuntime extends AutoCloseable {

    MetricsRuntime NOOP = new MetricsRuntime() {
        @Override
        public Object registry() {
            return null;
        }
    };

    static MetricsRuntime noop() {
        return NOOP;
    }

    /**
     * Returns the underlying registry (e.g., MeterRegistry) for advanced usage, or null.
     */
    Object registry();

    default boolean enabled() { return false; }

    default String type() { return "NOOP"; }

    default void counter(String name) {}

    default void counter(String name, double increment) {}

    default void timer(String name, long durationNanos) {}

    default void gauge(String name, double value) {}

    @Override
    default void close() {
        // no-op by default
    }
}
