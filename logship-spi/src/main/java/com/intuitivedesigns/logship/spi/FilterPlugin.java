/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.spi;

import com.intuitivedesigns.logship.core.Event;
import com.intuitivedesigns.logship.core.Filter;

/**
 * SPI Definition for pipeline filters.
 *
 * <p><b>Generics Note:</b> {@code Filter<?, Event>} because the first stage of a chain turns
 * raw lines into events while every later stage maps events to events. {@link #inputType()}
 * lets the pipeline builder check that the stages line up.</p>
 */
public interface FilterPlugin extends ServicePlugin {

    String id(); // e.g. "init_txt", "add_timestamp"

    @Override
    default PluginKind kind() {
        return PluginKind.FILTER;
    }

    /**
     * @return {@code String.class} for line-reading stages, {@code Event.class} otherwise
     */
    default Class<?> inputType() {
        return Event.class;
    }

    /**
     * Binds the arguments and returns the ready filter. Arguments were already checked
     * against {@link #parameters()}.
     */
    Filter<?, Event> create(Arguments arguments);
}
