/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.app;

import com.intuitivedesigns.logship.filters.Timestamps;
import picocli.CommandLine;

import java.time.Clock;
import java.util.concurrent.Callable;
import java.util.stream.Stream;

@CommandLine.Command(name = "stamp",
        description = "Prefix each line of STDIN with the current UTC timestamp.",
        mixinStandardHelpOptions = true)
final class StampCommand implements Callable<Integer> {

    private final Console console;
    private final Clock clock;

    StampCommand(Console console, Clock clock) {
        this.console = console;
        this.clock = clock;
    }

    @Override
    public Integer call() {
        try (Stream<String> lines = console.lines()) {
            lines.forEach(line -> console.out().println(Timestamps.now(clock) + " " + line));
        }
        console.out().flush();
        return 0;
    }
}
