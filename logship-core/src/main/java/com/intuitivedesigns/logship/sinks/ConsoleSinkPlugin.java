/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.sinks;

import com.intuitivedesigns.logship.core.AbstractEventSink;
import com.intuitivedesigns.logship.core.Event;
import com.intuitivedesigns.logship.core.EventSink;
import com.intuitivedesigns.logship.encoding.EventEncoder;
import com.intuitivedesigns.logship.metrics.MetricsRuntime;
import com.intuitivedesigns.logship.spi.Arguments;
import com.intuitivedesigns.logship.spi.ParameterShape;
import com.intuitivedesigns.logship.spi.SinkContext;
import com.intuitivedesigns.logship.spi.SinkPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.util.Objects;

/**
 * Writes each event to the console stream, one newline-terminated unit per event.
 * <p>
 * ID: stdout
 */
public final class ConsoleSinkPlugin implements SinkPlugin {

    public static final String ID = "stdout";

    private static final Logger log = LoggerFactory.getLogger(ConsoleSinkPlugin.class);
    private static final ParameterShape PARAMETERS = ParameterShape.builder()
            .optional(EventEncoder.ARG_BULK, EventEncoder.ARG_BULK_INDEX, EventEncoder.ARG_BULK_TYPE)
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
    public EventSink create(Arguments arguments, SinkContext context) {
        EventEncoder encoder = EventEncoder.fromArguments(arguments);
        log.info("Initialized console sink (encoding={})", encoder);
        return new ConsoleSink(context.console(), encoder, context.metrics());
    }

    public static final class ConsoleSink extends AbstractEventSink {

        private final PrintStream out;
        private final EventEncoder encoder;

        public ConsoleSink(PrintStream out, EventEncoder encoder, MetricsRuntime metrics) {
            super(ID, metrics);
            this.out = Objects.requireNonNull(out, "out");
            this.encoder = Objects.requireNonNull(encoder, "encoder");
        }

        @Override
        protected void deliver(Event event) throws IOException {
            String payload = encoder.encode(event);
            if (encoder.isBulk()) {
                out.print(payload);
            } else {
                out.println(payload);
            }
            out.flush();
            if (out.checkError()) {
                throw new IOException("console stream reported a write error");
            }
        }
    }
}
