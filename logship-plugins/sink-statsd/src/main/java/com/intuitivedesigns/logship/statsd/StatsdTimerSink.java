/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.statsd;

import com.intuitivedesigns.logship.core.Event;
import com.intuitivedesigns.logship.metrics.MetricsRuntime;

import java.net.DatagramSocket;
import java.util.Locale;
import java.util.Objects;

/**
 * Sends {@code <metric>:<value>|ms}, where the value is read from {@code timedField}.
 * Numbers and numeric strings are accepted.
 */
public final class StatsdTimerSink extends StatsdSink {

    private final String timedField;

    public StatsdTimerSink(MetricTemplate metric, String timedField, DatagramSocket socket, MetricsRuntime metrics) {
        super(StatsdTimerSinkPlugin.ID, metric, socket, metrics);
        this.timedField = Objects.requireNonNull(timedField, "timedField");
    }

    @Override
    protected String value(Event event) throws MissingFieldException {
        Object raw = metric().value(event, timedField);
        return String.format(Locale.ROOT, "%f", toDouble(raw)) + "|ms";
    }

    private double toDouble(Object raw) {
        if (raw instanceof Number) {
            return ((Number) raw).doubleValue();
        }
        if (raw instanceof String) {
            try {
                return Double.parseDouble(((String) raw).trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("timed field '" + timedField + "' is not numeric: '" + raw + "'", e);
            }
        }
        throw new IllegalArgumentException("timed field '" + timedField + "' is not numeric: " + raw);
    }
}
