/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.pipeline;

import com.intuitivedesigns.logship.core.Event;
import com.intuitivedesigns.logship.core.Filter;
import com.intuitivedesigns.logship.spi.Arguments;
import com.intuitivedesigns.logship.spi.ConfigurationException;
import com.intuitivedesigns.logship.spi.FilterPlugin;
import com.intuitivedesigns.logship.spi.ParameterShape;
import com.intuitivedesigns.logship.spi.PluginKind;
import com.intuitivedesigns.logship.spi.ServicePluginRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Maps filter names to filter plugins and builds pipelines from descriptions.
 *
 * <p>Build-time failures (unknown names, bad arguments, stages that do not line up) are all
 * raised from {@link #build(String)}, before any input is read.</p>
 */
public final class FilterRegistry {

    private static final Logger log = LoggerFactory.getLogger(FilterRegistry.class);

    private final ServicePluginRegistry<FilterPlugin> plugins;

    public FilterRegistry() {
        this(new ServicePluginRegistry<>(PluginKind.FILTER));
    }

    private FilterRegistry(ServicePluginRegistry<FilterPlugin> plugins) {
        this.plugins = plugins;
    }

    /**
     * A registry holding every {@link FilterPlugin} visible to {@code cl}.
     */
    public static FilterRegistry installed(ClassLoader cl) {
        FilterRegistry registry = new FilterRegistry(ServicePluginRegistry.load(PluginKind.FILTER, FilterPlugin.class, cl));
        log.debug("Filters available: {}", registry.names());
        return registry;
    }

    public static FilterRegistry installed() {
        ClassLoader ctx = Thread.currentThread().getContextClassLoader();
        return installed(ctx != null ? ctx : FilterRegistry.class.getClassLoader());
    }

    public FilterRegistry register(FilterPlugin plugin) {
        plugins.register(plugin);
        return this;
    }

    public FilterRegistry register(String name, FilterPlugin plugin) {
        plugins.register(name, plugin);
        return this;
    }

    /**
     * Registers an argument-less event filter under {@code name}.
     */
    public FilterRegistry register(String name, Filter<Event, Event> filter) {
        Objects.requireNonNull(filter, "filter");
        final String id = name;
        return register(name, new FilterPlugin() {
            @Override public String id() { return id; }
            @Override public ParameterShape parameters() { return ParameterShape.none(); }
            @Override public Filter<?, Event> create(Arguments arguments) { return filter; }
        });
    }

    public Optional<FilterPlugin> get(String name) {
        return plugins.get(name);
    }

    public Set<String> names() {
        return plugins.availableIds();
    }

    public Pipeline build(String description) {
        return build(Descriptions.parseFilters(description));
    }

    /**
     * Resolves every spec, then binds them in order.
     *
     * @throws com.intuitivedesigns.logship.spi.UnknownPluginException naming the first unknown filter
     * @throws ConfigurationException for argument or stage-order errors
     */
    @SuppressWarnings("unchecked")
    public Pipeline build(List<FilterSpec> specs) {
        Objects.requireNonNull(specs, "specs");
        if (specs.isEmpty()) {
            throw new ConfigurationException("A pipeline needs at least one filter");
        }

        // 1. Resolve all names first so an unknown name is always what gets reported
        List<FilterPlugin> resolved = new ArrayList<>(specs.size());
        for (FilterSpec spec : specs) {
            resolved.add(plugins.require(spec.name()));
        }

        // 2. Validate and bind
        Filter<Object, Object> chain = Filter.identity();
        for (int i = 0; i < specs.size(); i++) {
            FilterSpec spec = specs.get(i);
            FilterPlugin plugin = resolved.get(i);

            if (i > 0 && !plugin.inputType().isAssignableFrom(Event.class)) {
                throw new ConfigurationException("Filter '" + spec.name() + "' consumes "
                        + plugin.inputType().getSimpleName() + " items and must come first (follows '"
                        + specs.get(i - 1).name() + "')");
            }

            plugin.parameters().validate(PluginKind.FILTER, spec.name(), spec.arguments());
            Filter<Object, Object> step = (Filter<Object, Object>) (Filter<?, ?>) plugin.create(spec.arguments());
            chain = chain.andThen(Objects.requireNonNull(step, "filter '" + spec.name() + "' created null"));
        }

        Pipeline pipeline = new Pipeline(specs, resolved.get(0).inputType(), (Filter<Object, Event>) (Filter<?, ?>) chain);
        log.debug("Built {}", pipeline);
        return pipeline;
    }
}
