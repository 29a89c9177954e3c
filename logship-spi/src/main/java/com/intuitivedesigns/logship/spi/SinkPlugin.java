/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.spi;

import com.intuitivedesigns.logship.core.EventSink;

/**
 * SPI Definition for output sinks.
 */
public interface SinkPlugin extends ServicePlugin {

    String id(); // e.g. "redis", "stdout", "statsd_timer"

    @Override
    default PluginKind kind() {
        return PluginKind.SINK;
    }

    /**
     * Constructs a live sink. Sockets and pools are opened here, once.
     *
     * @throws Exception any failure; the registry reports it as a configuration error
     */
    EventSink create(Arguments arguments, SinkContext context) throws Exception;
}
