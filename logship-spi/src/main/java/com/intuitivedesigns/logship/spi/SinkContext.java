/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.spi;

import com.intuitivedesigns.logship.config.PipelineConfig;
import com.intuitivedesigns.logship.metrics.MetricsRuntime;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Process-level collaborators handed to every sink at construction.
 *
 * @param config  file-based defaults (timeouts, hosts)
 * @param metrics internal counters
 * @param console the stream console sinks write to
 */
public record SinkContext(PipelineConfig config, MetricsRuntime metrics, PrintStream console) {

    public SinkContext {
        Objects.requireNonNull(config, "config");
        metrics = (metrics == null) ? MetricsRuntime.noop() : metrics;
        console = (console == null) ? System.out : console;
    }

    public static SinkContext defaults() {
        return new SinkContext(PipelineConfig.empty(), MetricsRuntime.noop(), System.out);
    }
}
