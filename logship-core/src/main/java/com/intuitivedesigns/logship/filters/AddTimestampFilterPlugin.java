/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.filters;

import com.intuitivedesigns.logship.core.Event;
import com.intuitivedesigns.logship.core.Filter;
import com.intuitivedesigns.logship.spi.Arguments;
import com.intuitivedesigns.logship.spi.FilterPlugin;
import com.intuitivedesigns.logship.spi.ParameterShape;

import java.time.Clock;
import java.util.Objects;

/**
 * Stamps {@code @timestamp} with the time each event passes through.
 * Existing timestamps are kept unless {@code override=true}.
 * <p>
 * ID: add_timestamp
 */
public final class AddTimestampFilterPlugin implements FilterPlugin {

    public static final String ID = "add_timestamp";

    private static final ParameterShape PARAMETERS = ParameterShape.builder().optional("override").build();

    private final Clock clock;

    public AddTimestampFilterPlugin() {
        this(Clock.systemUTC());
    }

    public AddTimestampFilterPlugin(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
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
    public Filter<?, Event> create(Arguments arguments) {
        final boolean override = arguments.getBoolean("override", false);
        return EventFilters.perEvent(ID, event -> {
            if (override || !event.containsKey(Event.TIMESTAMP)) {
                event.put(Event.TIMESTAMP, Timestamps.now(clock));
            }
            return true;
        });
    }
}
