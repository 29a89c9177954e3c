/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.statsd;

import com.intuitivedesigns.logship.core.AbstractEventSink;
import com.intuitivedesigns.logship.core.Event;
import com.intuitivedesigns.logship.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Base for sinks that turn events into statsd datagrams of the form
 * {@code <metric>:<value>|<type>}.
 */
public abstract class StatsdSink extends AbstractEventSink {

    private static final Logger log = LoggerFactory.getLogger(StatsdSink.class);

    private final MetricTemplate metric;
    private final DatagramSocket socket;

    protected StatsdSink(String id, MetricTemplate metric, DatagramSocket socket, MetricsRuntime metrics) {
        super(id, metrics);
        this.metric = Objects.requireNonNull(metric, "metric");
        this.socket = Objects.requireNonNull(socket, "socket");
    }

    /**
     * Opens a UDP socket connected to the statsd daemon.
     */
    public static DatagramSocket connect(String host, int port) throws SocketException {
        DatagramSocket socket = new DatagramSocket();
        try {
            socket.connect(new InetSocketAddress(host, port));
        } catch (RuntimeException | SocketException e) {
            socket.close();
            throw e;
        }
        log.debug("statsd socket connected to {}:{}", host, port);
        return socket;
    }

    /**
     * @return the part after the colon, e.g. {@code 1|c}
     */
    protected abstract String value(Event event) throws MissingFieldException;

    public String format(Event event) throws MissingFieldException {
        return metric.render(event) + ":" + value(event);
    }

    @Override
    protected void deliver(Event event) throws MissingFieldException, IOException {
        byte[] payload = format(event).getBytes(StandardCharsets.UTF_8);
        socket.send(new DatagramPacket(payload, payload.length));
    }

    protected MetricTemplate metric() {
        return metric;
    }

    @Override
    public void close() {
        socket.close();
    }
}
