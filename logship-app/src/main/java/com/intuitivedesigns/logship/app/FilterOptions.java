/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.app;

import picocli.CommandLine;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code -f} / {@code -a} options shared by the commands that run a filter pipeline.
 */
final class FilterOptions {

    static final String DEFAULT_FILTERS = "init_txt,add_timestamp,add_source_host";

    @CommandLine.Option(names = {"-f", "--filters"},
            defaultValue = DEFAULT_FILTERS,
            description = "Filters to apply to each log line (default: ${DEFAULT-VALUE})")
    String filters;

    @CommandLine.Option(names = {"-a", "--filters-append"},
            description = "Filters appended to the filter list; may be repeated")
    List<String> appended;

    /**
     * @return the full filter description, appended clauses last
     */
    String description() {
        List<String> parts = new ArrayList<>();
        parts.add(filters);
        if (appended != null) {
            parts.addAll(appended);
        }
        return String.join(",", parts);
    }
}
