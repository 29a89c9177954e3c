/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.statsd;

import com.intuitivedesigns.logship.core.Event;
import com.intuitivedesigns.logship.metrics.MetricsRuntime;

import java.net.DatagramSocket;

/**
 * Sends {@code <metric>:1|c} per event.
 */
public final class StatsdCounterSink extends StatsdSink {

    public StatsdCounterSink(MetricTemplate metric, DatagramSocket socket, MetricsRuntime metrics) {
        super(StatsdCounterSinkPlugin.ID, metric, socket, metrics);
    }

    @Override
    protected String value(Event event) {
        return "1|c";
    }
}
