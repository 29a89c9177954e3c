/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.core;

import com.intuitivedesigns.logship.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Base class enforcing the {@link EventSink} failure contract.
 *
 * <p>Subclasses implement {@link #deliver(Event)} and may throw anything; {@link #ship(Event)}
 * turns every {@link Exception} into a WARN log line and a dropped-event count.
 * {@link Error}s are not caught.</p>
 */
public abstract class AbstractEventSink implements EventSink {

    private static final Logger log = LoggerFactory.getLogger(AbstractEventSink.class);

    private final String id;
    private final MetricsRuntime metrics;
    private final String shippedMetric;
    private final String droppedMetric;

    protected AbstractEventSink(String id, MetricsRuntime metrics) {
        this.id = Objects.requireNonNull(id, "id");
        this.metrics = (metrics != null) ? metrics : MetricsRuntime.noop();
        this.shippedMetric = "logship.sink." + id + ".shipped";
        this.droppedMetric = "logship.sink." + id + ".dropped";
    }

    @Override
    public final void ship(Event event) {
        if (event == null) return;
        try {
            deliver(event);
            metrics.counter(shippedMetric);
        } catch (Exception e) {
            metrics.counter(droppedMetric);
            log.warn("Sink [{}] could not ship event: {}", id, e.getMessage());
            log.debug("Sink [{}] failure detail", id, e);
        }
    }

    /**
     * Encode and transmit one event.
     *
     * @throws Exception on any encoding or transport failure; the event is then dropped
     */
    protected abstract void deliver(Event event) throws Exception;

    @Override
    public String id() {
        return id;
    }

    protected MetricsRuntime metrics() {
        return metrics;
    }
}
