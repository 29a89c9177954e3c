/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.redis;

import com.intuitivedesigns.logship.core.AbstractEventSink;
import com.intuitivedesigns.logship.core.Event;
import com.intuitivedesigns.logship.core.TransportException;
import com.intuitivedesigns.logship.encoding.EventEncoder;
import com.intuitivedesigns.logship.metrics.MetricsRuntime;

import java.io.IOException;
import java.util.Objects;

/**
 * Pushes each encoded event onto a Redis list, failing over between endpoints.
 */
public final class RedisQueueSink extends AbstractEventSink {

    private final String key;
    private final EventEncoder encoder;
    private final ResilientClient<RedisConnection> client;

    public RedisQueueSink(String key,
                          EventEncoder encoder,
                          ResilientClient<RedisConnection> client,
                          MetricsRuntime metrics) {
        super(RedisSinkPlugin.ID, metrics);
        this.key = Objects.requireNonNull(key, "key");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    protected void deliver(Event event) throws IOException, TransportException {
        String payload = encoder.encode(event);
        client.execute("LPUSH", conn -> conn.lpush(key, payload));
    }

    public String key() {
        return key;
    }

    @Override
    public void close() {
        client.pool().close();
    }

    @Override
    public String toString() {
        return "RedisQueueSink[key=" + key + ", endpoints=" + client.pool().endpoints() + ", encoding=" + encoder + "]";
    }
}
