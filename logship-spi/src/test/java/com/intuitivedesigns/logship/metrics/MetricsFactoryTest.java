/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.metrics;

import com.intuitivedesigns.logship.config.PipelineConfig;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class MetricsFactoryTest {

    @Test
    void testDisabledByDefault() {
        MetricsRuntime metrics = MetricsFactory.init(PipelineConfig.empty());

        assertFalse(metrics.enabled());
        metrics.counter("ignored");
        assertEquals(Map.of(), metrics.snapshot());
    }

    @Test
    void testMicrometerSnapshot() {
        Properties props = new Properties();
        props.setProperty(MetricsFactory.KEY_ENABLED, "true");

        try (MetricsRuntime metrics = MetricsFactory.init(PipelineConfig.of(props))) {
            assertEquals("MICROMETER", metrics.type());
            metrics.counter("logship.sink.stdout.shipped");
            metrics.counter("logship.sink.stdout.shipped");
            metrics.timer("logship.client.lpush", 2_000_000L);

            Map<String, Double> snapshot = metrics.snapshot();
            assertEquals(2.0, snapshot.get("logship.sink.stdout.shipped"));
            assertEquals(1.0, snapshot.get("logship.client.lpush.count"));
            assertEquals(2.0, snapshot.get("logship.client.lpush.mean.ms"), 1e-9);
        }
    }
}
