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

/**
 * statsd timer: {@code statsd_timer,metric=app.%{@fields.action},timed_field=@fields.duration}.
 * <p>
 * ID: statsd_timer
 */
public final class StatsdTimerSinkPlugin implements SinkPlugin {

    public static final String ID = "statsd_timer";
    public static final String ARG_TIMED_FIELD = "timed_field";

    private static final Logger log = LoggerFactory.getLogger(StatsdTimerSinkPlugin.class);
    private static final ParameterShape PARAMETERS = ParameterShape.builder()
            .required(StatsdSettings.ARG_METRIC, ARG_TIMED_FIELD)
            .optional(StatsdSettings.ARG_HOST, StatsdSettings.ARG_PORT)
            .build();

    @Override
    public String id() {
        return ID;
    }

    @Override
    public ParameterShape parameters() {
        return PARAMETERS;
    }

    @Override
    public EventSink create(Arguments arguments, SinkContext context) throws SocketException {
        StatsdSettings settings = StatsdSettings.from(arguments, context.config());
        MetricTemplate metric = new MetricTemplate(arguments.require(StatsdSettings.ARG_METRIC));
        String timedField = arguments.require(ARG_TIMED_FIELD);
        log.info("statsd timer sink active: metric={} timed_field={} target={}", metric, timedField, settings);
        return new StatsdTimerSink(metric, timedField, settings.connect(), context.metrics());
    }
}
