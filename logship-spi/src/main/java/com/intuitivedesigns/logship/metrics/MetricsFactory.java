/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.metrics;

import com.intuitivedesigns.logship.config.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

public final class MetricsFactory {

    private static final Logger log = LoggerFactory.getLogger(MetricsFactory.class);

    public static final String KEY_ENABLED = "metrics.enabled";

    private MetricsFactory() {}

    public static MetricsRuntime init(PipelineConfig config) {
        Objects.requireNonNull(config, "config");

        if (!config.getBoolean(KEY_ENABLED, false)) {
            log.debug("Metrics disabled (NOOP active)");
            return MetricsRuntime.noop();
        }

        log.info("Metrics runtime initialized: MICROMETER");
        return new MicrometerMetricsRuntime();
    }
}
