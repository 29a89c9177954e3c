/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.pipeline;

import com.intuitivedesigns.logship.spi.Arguments;

import java.util.Objects;

/**
 * One parsed sink description, e.g. {@code redis,redis://a:6379,key=logs}.
 */
public record SinkSpec(String name, Arguments arguments) {

    public SinkSpec {
        Objects.requireNonNull(name, "name");
        arguments = (arguments == null) ? Arguments.empty() : arguments;
    }
}
