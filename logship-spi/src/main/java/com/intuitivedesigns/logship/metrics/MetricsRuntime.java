/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.metrics;

import java.util.Map;

/**
 * The vendor-agnostic contract for internal counters.
 *
 * <p>Sinks, the pool and the client record through this interface; the NOOP default keeps
 * them free of null checks when metrics are disabled.</p>
 */
public interface MetricsRuntime extends AutoCloseable {

    /**
     * @return true if metrics are actually being recorded.
     */
    default boolean enabled() { return false; }

    /**
     * @return A string identifier for the implementation (e.g., "MICROMETER", "NOOP").
     */
    default String type() { return "NOOP"; }

    default void counter(String name) {}

    default void timer(String name, long durationNanos) {}

    /**
     * @return current counter totals by name; empty when disabled
     */
    default Map<String, Double> snapshot() { return Map.of(); }

    @Override
    default void close() {
        // no-op by default
    }

    static MetricsRuntime noop() {
        return NoopHolder.NOOP;
    }

    final class NoopHolder {
        private static final MetricsRuntime NOOP = new MetricsRuntime() { };

        private NoopHolder() {}
    }
}
