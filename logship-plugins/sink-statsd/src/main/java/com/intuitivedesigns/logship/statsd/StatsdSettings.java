/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.statsd;

import com.intuitivedesigns.logship.config.PipelineConfig;
import com.intuitivedesigns.logship.spi.Arguments;
import com.intuitivedesigns.logship.spi.ConfigurationException;

import java.net.DatagramSocket;
import java.net.SocketException;

/**
 * Daemon address shared by the statsd sinks. Sink arguments win over configuration.
 */
record StatsdSettings(String host, int port) {

    static final String ARG_METRIC = "metric";
    static final String ARG_HOST = "host";
    static final String ARG_PORT = "port";

    static final String HOST_KEY = "statsd.host";
    static final String PORT_KEY = "statsd.port";
    static final String DEFAULT_HOST = "127.0.0.1";
    static final int DEFAULT_PORT = 8125;

    StatsdSettings {
        if (port < 1 || port > 65535) {
            throw new ConfigurationException("statsd port out of range: " + port);
        }
    }

    static StatsdSettings from(Arguments arguments, PipelineConfig config) {
        String host = arguments.getString(ARG_HOST, config.getString(HOST_KEY, DEFAULT_HOST));
        int port = arguments.getInt(ARG_PORT, config.getInt(PORT_KEY, DEFAULT_PORT));
        return new StatsdSettings(host, port);
    }

    DatagramSocket connect() throws SocketException {
        return StatsdSink.connect(host, port);
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
