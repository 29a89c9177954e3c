/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.statsd;

import com.intuitivedesigns.logship.core.EventSink;
import com.intuitivedesigns.logship.spi.Arguments;
import com.intuitivedesigns.logship.spi.ParameterShape;
import com.intuitivedesigns.logship.spi.SinkContext;
import com.intuitivedesigns.logship.spi.SinkPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketException;
import java.util.List;

/**
 * statsd counter: {@code statsd,metric=app.%{@fields.status},host=10.0.0.5}.
 * <p>
 * ID: statsd_counter (alias: statsd)
 */
public final class StatsdCounterSinkPlugin implements SinkPlugin {

    public static final String ID = "statsd_counter";

    private static final Logger log = LoggerFactory.getLogger(StatsdCounterSinkPlugin.class);
    private static final ParameterShape PARAMETERS = ParameterShape.builder()
            .required(StatsdSettings.ARG_METRIC)
            .optional(StatsdSettings.ARG_HOST, StatsdSettings.ARG_PORT)
            .build();

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<String> aliases() {
        return List.of("statsd");
    }

    @Override
    public ParameterShape parameters() {
        return PARAMETERS;
    }

    @Override
    public EventSink create(Arguments arguments, SinkContext context) throws SocketException {
        StatsdSettings settings = StatsdSettings.from(arguments, context.config());
        MetricTemplate metric = new MetricTemplate(arguments.require(StatsdSettings.ARG_METRIC));
        log.info("statsd counter sink active: metric={} target={}", metric, settings);
        return new StatsdCounterSink(metric, settings.connect(), context.metrics());
    }
}
