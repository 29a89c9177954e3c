/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.app;

import com.intuitivedesigns.logship.pipeline.FilterRegistry;
import com.intuitivedesigns.logship.sinks.SinkRegistry;
import com.intuitivedesigns.logship.spi.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.time.Clock;

/**
 * Entry point: {@code logship ship|tag|stamp}.
 */
@CommandLine.Command(name = "logship",
        description = "Turn log lines into structured events and ship them.",
        mixinStandardHelpOptions = true,
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0: input fully processed",
                "1: unexpected failure",
                "2: invalid command line or configuration"
        })
public final class LogshipApp implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(LogshipApp.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_CONFIG = 2;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        System.exit(run(Console.system(), FilterRegistry.installed(), SinkRegistry.installed(), Clock.systemUTC(), args));
    }

    static int run(Console console, FilterRegistry filters, SinkRegistry sinks, Clock clock, String... args) {
        CommandLine cli = commandLine(console, filters, sinks, clock);
        cli.setOut(new PrintWriter(console.out(), true));
        return cli.execute(args);
    }

    static CommandLine commandLine(Console console, FilterRegistry filters, SinkRegistry sinks, Clock clock) {
        CommandLine cli = new CommandLine(new LogshipApp());
        cli.addSubcommand("ship", new ShipCommand(console, filters, sinks));
        cli.addSubcommand("tag", new TagCommand(console, filters));
        cli.addSubcommand("stamp", new StampCommand(console, clock));
        cli.setExecutionExceptionHandler(LogshipApp::handleFailure);
        return cli;
    }

    private static int handleFailure(Exception e, CommandLine cli, CommandLine.ParseResult parsed) {
        if (e instanceof ConfigurationException) {
            log.error("Configuration error: {}", e.getMessage());
            cli.getErr().println("logship: " + e.getMessage());
            return EXIT_CONFIG;
        }
        log.error("logship {} failed", cli.getCommandName(), e);
        return EXIT_FAILURE;
    }

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing subcommand: ship, tag or stamp");
    }
}
