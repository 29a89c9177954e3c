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

import java.util.List;

/**
 * Appends every positional argument to {@code @tags}.
 * <p>
 * ID: add_tags
 */
public final class AddTagsFilterPlugin implements FilterPlugin {

    public static final String ID = "add_tags";

    private static final ParameterShape PARAMETERS = ParameterShape.builder().positional(true).build();

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
        final List<String> tags = arguments.positional();
        return EventFilters.perEvent(ID, event -> {
            event.tags().addAll(tags);
            return true;
        });
    }
}
