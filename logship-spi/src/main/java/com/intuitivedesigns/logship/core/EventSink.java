/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.core;

/**
 * A pluggable destination for pipeline events.
 *
 * Examples:
 * - Redis list (queue) writer
 * - statsd counter or timer
 * - Console writer
 *
 * <p><b>Failure Contract:</b></p>
 * <ul>
 * <li>{@link #ship(Event)} must not throw. A failing sink logs, drops the event and returns,
 * so the next sink still receives it and the driver loop keeps running.</li>
 * <li>The event must not be modified; every sink sees the same content.</li>
 * </ul>
 */
public interface EventSink extends AutoCloseable {

    void ship(Event event);

    /**
     * Identifier used in logs and metric names (e.g. "redis", "stdout").
     */
    default String id() {
        return this.getClass().getSimpleName();
    }

    /**
     * Release sockets and connections.
     */
    @Override
    default void close() {
        // no-op by default
    }
}
