/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.sinks;

import com.intuitivedesigns.logship.core.EventSink;
import com.intuitivedesigns.logship.pipeline.Descriptions;
import com.intuitivedesigns.logship.pipeline.SinkSpec;
import com.intuitivedesigns.logship.spi.ConfigurationException;
import com.intuitivedesigns.logship.spi.PluginKind;
import com.intuitivedesigns.logship.spi.ServicePluginRegistry;
import com.intuitivedesigns.logship.spi.SinkContext;
import com.intuitivedesigns.logship.spi.SinkPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Maps sink names to sink plugins and constructs sinks from descriptions.
 */
public final class SinkRegistry {

    private static final Logger log = LoggerFactory.getLogger(SinkRegistry.class);

    private final ServicePluginRegistry<SinkPlugin> plugins;

    public SinkRegistry() {
        this(new ServicePluginRegistry<>(PluginKind.SINK));
    }

    private SinkRegistry(ServicePluginRegistry<SinkPlugin> plugins) {
        this.plugins = plugins;
    }

    public static SinkRegistry installed(ClassLoader cl) {
        SinkRegistry registry = new SinkRegistry(ServicePluginRegistry.load(PluginKind.SINK, SinkPlugin.class, cl));
        log.debug("Sinks available: {}", registry.names());
        return registry;
    }

    public static SinkRegistry installed() {
        ClassLoader ctx = Thread.currentThread().getContextClassLoader();
        return installed(ctx != null ? ctx : SinkRegistry.class.getClassLoader());
    }

    public SinkRegistry register(SinkPlugin plugin) {
        plugins.register(plugin);
        return this;
    }

    public SinkRegistry register(String name, SinkPlugin plugin) {
        plugins.register(name, plugin);
        return this;
    }

    public Optional<SinkPlugin> get(String name) {
        return plugins.get(name);
    }

    public Set<String> names() {
        return plugins.availableIds();
    }

    public EventSink build(String description, SinkContext context) {
        return build(Descriptions.parseSink(description), context);
    }

    /**
     * @throws com.intuitivedesigns.logship.spi.UnknownPluginException if no sink has that name
     * @throws ConfigurationException for argument errors or a failed construction
     */
    public EventSink build(SinkSpec spec, SinkContext context) {
        Objects.requireNonNull(spec, "spec");
        Objects.requireNonNull(context, "context");

        SinkPlugin plugin = plugins.require(spec.name());
        plugin.parameters().validate(PluginKind.SINK, spec.name(), spec.arguments());

        final EventSink sink;
        try {
            sink = plugin.create(spec.arguments(), context);
        } catch (ConfigurationException e) {
            throw e;
        } catch (Exception e) {
            throw new ConfigurationException("Failed creating sink [" + spec.name() + "]: " + e.getMessage(), e);
        }
        if (sink == null) {
            throw new ConfigurationException("Sink plugin [" + spec.name() + "] returned no sink");
        }
        return sink;
    }

    /**
     * Builds every sink in order. If one fails, the ones already built are closed before
     * the error is rethrown, so startup never leaves half a sink set open.
     */
    public List<EventSink> buildAll(List<String> descriptions, SinkContext context) {
        List<EventSink> sinks = new ArrayList<>(descriptions.size());
        try {
            for (String description : descriptions) {
                sinks.add(build(description, context));
            }
        } catch (RuntimeException e) {
            sinks.forEach(SinkRegistry::closeQuietly);
            throw e;
        }
        return sinks;
    }

    private static void closeQuietly(EventSink sink) {
        try {
            sink.close();
        } catch (RuntimeException e) {
            log.debug("Ignoring close failure for sink [{}]", sink.id(), e);
        }
    }
}
