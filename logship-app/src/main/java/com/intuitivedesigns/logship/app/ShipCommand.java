/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.app;

import com.intuitivedesigns.logship.config.PipelineConfig;
import com.intuitivedesigns.logship.core.EventSink;
import com.intuitivedesigns.logship.metrics.MetricsFactory;
import com.intuitivedesigns.logship.metrics.MetricsRuntime;
import com.intuitivedesigns.logship.pipeline.FilterRegistry;
import com.intuitivedesigns.logship.pipeline.Pipeline;
import com.intuitivedesigns.logship.sinks.SinkRegistry;
import com.intuitivedesigns.logship.spi.SinkContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "ship",
        description = "Ship log data from STDIN to one or more sinks, turning each line into a "
                + "JSON event on the way.",
        footerHeading = "%nSinks:%n",
        footer = {
                "  redis,URL[,URL...][,key=logs][,bulk=true][,bulk_index=logs][,bulk_type=message]",
                "  stdout[,bulk=true][,bulk_index=logs][,bulk_type=message]",
                "  statsd,metric=%%{@fields.status}.count[,host=127.0.0.1][,port=8125]",
                "  statsd_timer,metric=NAME,timed_field=FIELD[,host=...][,port=...]",
                "  null"
        },
        mixinStandardHelpOptions = true)
final class ShipCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ShipCommand.class);

    static final String DEFAULT_SINK = "redis,redis://localhost:6379";
    static final String SUMMARY_KEY = "metrics.summary.on.exit";

    @CommandLine.Mixin
    FilterOptions filterOptions = new FilterOptions();

    @CommandLine.Option(names = {"-s", "--sink"},
            arity = "1..*",
            defaultValue = DEFAULT_SINK,
            description = "Sink descriptions (name,arg,key=value,...); several may be given (default: ${DEFAULT-VALUE})")
    List<String> sinks;

    @CommandLine.Option(names = {"-c", "--config"},
            description = "Properties file with pipeline settings")
    String configPath;

    private final Console console;
    private final FilterRegistry filters;
    private final SinkRegistry sinkRegistry;

    ShipCommand(Console console, FilterRegistry filters, SinkRegistry sinkRegistry) {
        this.console = console;
        this.filters = filters;
        this.sinkRegistry = sinkRegistry;
    }

    @Override
    public Integer call() {
        PipelineConfig config = PipelineConfig.load(configPath);
        Pipeline pipeline = filters.build(filterOptions.description()).requireLines();

        MetricsRuntime metrics = MetricsFactory.init(config);
        List<EventSink> built = List.of();
        try {
            built = sinkRegistry.buildAll(sinks, new SinkContext(config, metrics, console.out()));
            log.info("Shipping with filters {} to {} sink(s)", pipeline, built.size());

            long events = ShipDriver.run(pipeline, console.lines(), built);
            log.info("Input exhausted after {} event(s)", events);
        } finally {
            for (EventSink sink : built) {
                sink.close();
            }
            if (metrics.enabled() && config.getBoolean(SUMMARY_KEY, true)) {
                logSummary(metrics.snapshot());
            }
            metrics.close();
        }
        return 0;
    }

    private static void logSummary(Map<String, Double> snapshot) {
        log.info("Metrics summary:");
        snapshot.forEach((name, value) -> log.info("  {} = {}", name, value));
    }
}
