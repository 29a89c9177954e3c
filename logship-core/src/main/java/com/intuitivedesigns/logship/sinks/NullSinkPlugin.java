/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.sinks;

import com.intuitivedesigns.logship.core.Event;
import com.intuitivedesigns.logship.core.EventSink;
import com.intuitivedesigns.logship.spi.Arguments;
import com.intuitivedesigns.logship.spi.ParameterShape;
import com.intuitivedesigns.logship.spi.SinkContext;
import com.intuitivedesigns.logship.spi.SinkPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Discards every event. Accepts and ignores any arguments.
 * <p>
 * ID: null
 */
public final class NullSinkPlugin implements SinkPlugin {

    public static final String ID = "null";
    private static final Logger log = LoggerFactory.getLogger(NullSinkPlugin.class);

    @Override
    public String id() {
        return ID;
    }

    @Override
    public ParameterShape parameters() {
        return ParameterShape.any();
    }

    @Override
    public EventSink create(Arguments arguments, SinkContext context) {
        log.info("Null sink active: events routed here are discarded");
        return new NullSink();
    }

    static final class NullSink implements EventSink {

        @Override
        public void ship(Event event) {
            // discard
        }

        @Override
        public String id() {
            return ID;
        }
    }
}
