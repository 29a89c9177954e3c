/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

/**
 * Metrics bridge for Micrometer.
 *
 * Backed by a {@link SimpleMeterRegistry}; the CLI reads {@link #snapshot()} at exit.
 */
public final class MicrometerMetricsRuntime implements MetricsRuntime {

    private static final Logger log = LoggerFactory.getLogger(MicrometerMetricsRuntime.class);

    private final MeterRegistry registry;

    public MicrometerMetricsRuntime() {
        this(new SimpleMeterRegistry());
    }

    public MicrometerMetricsRuntime(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public MeterRegistry registry() {
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
        registry.counter(name).increment();
    }

    @Override
    public void timer(String name, long durationNanos) {
        registry.timer(name).record(durationNanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public Map<String, Double> snapshot() {
        Map<String, Double> out = new TreeMap<>();
        for (Meter meter : registry.getMeters()) {
            String name = meter.getId().getName();
            if (meter instanceof Counter c) {
                out.put(name, c.count());
            } else if (meter instanceof Timer t) {
                out.put(name + ".count", (double) t.count());
                out.put(name + ".mean.ms", t.mean(TimeUnit.MILLISECONDS));
            }
        }
        return out;
    }

    @Override
    public void close() {
        registry.close();
        log.debug("Metrics runtime closed");
    }
}
