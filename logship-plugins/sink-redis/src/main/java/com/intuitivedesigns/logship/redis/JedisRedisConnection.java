/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.redis;

import com.intuitivedesigns.logship.core.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.exceptions.JedisException;

import java.util.Objects;

/**
 * A {@link RedisConnection} backed by one Jedis client. The socket is opened lazily by the
 * first command.
 */
public final class JedisRedisConnection implements RedisConnection {

    private static final Logger log = LoggerFactory.getLogger(JedisRedisConnection.class);

    private final Endpoint endpoint;
    private final Jedis jedis;

    public JedisRedisConnection(Endpoint endpoint, int connectTimeoutMs, int socketTimeoutMs) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.jedis = new Jedis(
                new HostAndPort(endpoint.host(), endpoint.port()),
                DefaultJedisClientConfig.builder()
                        .database(endpoint.database())
                        .connectionTimeoutMillis(connectTimeoutMs)
                        .socketTimeoutMillis(socketTimeoutMs)
                        .build());
    }

    @Override
    public Endpoint endpoint() {
        return endpoint;
    }

    @Override
    public long lpush(String key, String value) throws TransportException {
        try {
            return jedis.lpush(key, value);
        } catch (JedisException e) {
            throw new TransportException("LPUSH " + key + " to " + endpoint + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        try {
            jedis.close();
        } catch (JedisException e) {
            log.debug("Closing connection to {} failed", endpoint, e);
        }
    }

    @Override
    public String toString() {
        return "JedisRedisConnection[" + endpoint + "]";
    }
}
