/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.redis;

import com.intuitivedesigns.logship.config.PipelineConfig;

/**
 * Creates {@link JedisRedisConnection}s with timeouts taken from configuration.
 */
public final class JedisConnectionFactory implements ConnectionFactory<RedisConnection> {

    public static final String CONNECT_TIMEOUT_KEY = "redis.connect.timeout.ms";
    public static final String SOCKET_TIMEOUT_KEY = "redis.socket.timeout.ms";
    public static final int DEFAULT_TIMEOUT_MS = 2000;

    private final int connectTimeoutMs;
    private final int socketTimeoutMs;

    public JedisConnectionFactory(int connectTimeoutMs, int socketTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
        this.socketTimeoutMs = socketTimeoutMs;
    }

    public static JedisConnectionFactory fromConfig(PipelineConfig config) {
        return new JedisConnectionFactory(
                config.getInt(CONNECT_TIMEOUT_KEY, DEFAULT_TIMEOUT_MS),
                config.getInt(SOCKET_TIMEOUT_KEY, DEFAULT_TIMEOUT_MS));
    }

    @Override
    public RedisConnection connect(Endpoint endpoint) {
        return new JedisRedisConnection(endpoint, connectTimeoutMs, socketTimeoutMs);
    }
}
