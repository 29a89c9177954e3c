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

import java.util.Map;

/**
 * Merges every {@code key=value} argument into {@code @fields}.
 * <p>
 * ID: add_fields
 */
public final class AddFieldsFilterPlugin implements FilterPlugin {

    public static final String ID = "add_fields";

    private static final ParameterShape PARAMETERS = ParameterShape.builder().anyKeywords().build();

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
        final Map<String, String> extra = arguments.keywords();
        return EventFilters.perEvent(ID, event -> {
            event.fields().putAll(extra);
            return true;
        });
    }
}
