/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.pipeline;

import com.intuitivedesigns.logship.spi.Arguments;

import java.util.Objects;

/**
 * One parsed filter clause, e.g. {@code add_tags:web:prod}.
 */
public record FilterSpec(String name, Arguments arguments) {

    public FilterSpec {
        Objects.requireNonNull(name, "name");
        arguments = (arguments == null) ? Arguments.empty() : arguments;
    }
}
