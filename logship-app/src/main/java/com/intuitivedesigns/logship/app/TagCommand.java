/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.app;

import com.intuitivedesigns.logship.core.Event;
import com.intuitivedesigns.logship.encoding.EventEncoder;
import com.intuitivedesigns.logship.pipeline.FilterRegistry;
import com.intuitivedesigns.logship.pipeline.Pipeline;
import picocli.CommandLine;

import java.io.IOException;
import java.util.Iterator;
import java.util.concurrent.Callable;
import java.util.stream.Stream;

@CommandLine.Command(name = "tag",
        description = "Convert log data on STDIN to a stream of timestamped JSON documents on STDOUT.",
        mixinStandardHelpOptions = true)
final class TagCommand implements Callable<Integer> {

    @CommandLine.Mixin
    FilterOptions filterOptions = new FilterOptions();

    private final Console console;
    private final FilterRegistry filters;

    TagCommand(Console console, FilterRegistry filters) {
        this.console = console;
        this.filters = filters;
    }

    @Override
    public Integer call() throws IOException {
        Pipeline pipeline = filters.build(filterOptions.description()).requireLines();
        EventEncoder encoder = EventEncoder.plain();
        try (Stream<Event> events = pipeline.apply(console.lines())) {
            Iterator<Event> it = events.iterator();
            while (it.hasNext()) {
                console.out().println(encoder.encode(it.next()));
            }
        }
        console.out().flush();
        return 0;
    }
}
