/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.pipeline;

import com.intuitivedesigns.logship.spi.Arguments;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parsers for the two description grammars.
 *
 * <pre>
 * filters: name1:arg:arg2,name2:key=val,...
 * sink:    name,arg,key=val,...
 * </pre>
 */
public final class Descriptions {

    private Descriptions() {}

    public static List<FilterSpec> parseFilters(String description) {
        Objects.requireNonNull(description, "description");

        List<FilterSpec> specs = new ArrayList<>();
        for (String clause : DescriptionTokenizer.split(description, ',')) {
            List<String> parts = DescriptionTokenizer.split(clause, ':');
            specs.add(new FilterSpec(parts.get(0), Arguments.parse(parts.subList(1, parts.size()))));
        }
        return specs;
    }

    public static SinkSpec parseSink(String description) {
        Objects.requireNonNull(description, "description");

        List<String> clauses = DescriptionTokenizer.split(description, ',');
        return new SinkSpec(clauses.get(0), Arguments.parse(clauses.subList(1, clauses.size())));
    }
}
