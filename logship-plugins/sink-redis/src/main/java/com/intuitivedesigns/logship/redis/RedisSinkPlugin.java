/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.redis;

import com.intuitivedesigns.logship.config.PipelineConfig;
import com.intuitivedesigns.logship.core.EventSink;
import com.intuitivedesigns.logship.encoding.EventEncoder;
import com.intuitivedesigns.logship.spi.Arguments;
import com.intuitivedesigns.logship.spi.ConfigurationException;
import com.intuitivedesigns.logship.spi.ParameterShape;
import com.intuitivedesigns.logship.spi.SinkContext;
import com.intuitivedesigns.logship.spi.SinkPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Redis queue sink: {@code redis,redis://host1:6379,redis://host2:6380/1,key=logs}.
 * <p>
 * ID: redis
 */
public final class RedisSinkPlugin implements SinkPlugin {

    public static final String ID = "redis";
    public static final String ARG_KEY = "key";
    public static final String ARG_MAX_CONNECTIONS = "max_connections";
    public static final String DEFAULT_KEY = "logs";
    public static final String MAX_PER_ENDPOINT_KEY = "redis.pool.max.per.endpoint";

    private static final Logger log = LoggerFactory.getLogger(RedisSinkPlugin.class);
    private static final ParameterShape PARAMETERS = ParameterShape.builder()
            .positional(true)
            .optional(ARG_KEY, ARG_MAX_CONNECTIONS,
                    EventEncoder.ARG_BULK, EventEncoder.ARG_BULK_INDEX, EventEncoder.ARG_BULK_TYPE)
            .build();

    private final Function<PipelineConfig, ConnectionFactory<? extends RedisConnection>> factories;

    public RedisSinkPlugin() {
        this(JedisConnectionFactory::fromConfig);
    }

    RedisSinkPlugin(Function<PipelineConfig, ConnectionFactory<? extends RedisConnection>> factories) {
        this.factories = factories;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public ParameterShape parameters() {
        return PARAMETERS;
    }

    @Override
    public EventSink create(Arguments arguments, SinkContext context) {
        if (arguments.positional().isEmpty()) {
            throw new ConfigurationException("Sink 'redis' needs at least one endpoint URL, e.g. redis,redis://localhost:6379");
        }
        List<Endpoint> endpoints = new ArrayList<>();
        for (String url : arguments.positional()) {
            endpoints.add(Endpoint.parse(url));
        }

        PipelineConfig config = context.config();
        int maxPerEndpoint = arguments.getInt(ARG_MAX_CONNECTIONS, config.getInt(MAX_PER_ENDPOINT_KEY, 0));
        String key = arguments.getString(ARG_KEY, DEFAULT_KEY);
        EventEncoder encoder = EventEncoder.fromArguments(arguments);

        EndpointPool<RedisConnection> pool = new EndpointPool<>(
                endpoints,
                factories.apply(config),
                maxPerEndpoint,
                context.metrics(),
                () -> ProcessHandle.current().pid());
        ResilientClient<RedisConnection> client = new ResilientClient<>(pool, 0, context.metrics());

        log.info("Redis sink active: key={} endpoints={} encoding={}", key, endpoints, encoder);
        return new RedisQueueSink(key, encoder, client, context.metrics());
    }
}
