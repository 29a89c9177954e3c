/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.filters;

import com.intuitivedesigns.logship.core.Event;
import com.intuitivedesigns.logship.core.Filter;
import com.intuitivedesigns.logship.spi.Arguments;
import com.intuitivedesigns.logship.spi.FilterPlugin;
import com.intuitivedesigns.logship.spi.ParameterShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Adds this machine's fully-qualified domain name as {@code @source_host}.
 * The name is resolved once per filter instance. Existing values are kept unless
 * {@code override=true}.
 * <p>
 * ID: add_source_host
 */
public final class AddSourceHostFilterPlugin implements FilterPlugin {

    public static final String ID = "add_source_host";

    private static final Logger log = LoggerFactory.getLogger(AddSourceHostFilterPlugin.class);
    private static final ParameterShape PARAMETERS = ParameterShape.builder().optional("override").build();

    private final Supplier<String> hostResolver;

    public AddSourceHostFilterPlugin() {
        this(AddSourceHostFilterPlugin::localFqdn);
    }

    public AddSourceHostFilterPlugin(Supplier<String> hostResolver) {
        this.hostResolver = Objects.requireNonNull(hostResolver, "hostResolver");
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public ParameterShape parameters() {
        return PARAMETERS;
    }

    @Override
    public Filter<?, Event> create(Arguments arguments) {
        final boolean override = arguments.getBoolean("override", false);
        final String sourceHost = hostResolver.get();
        return EventFilters.perEvent(ID, event -> {
            if (override || !event.containsKey(Event.SOURCE_HOST)) {
                event.put(Event.SOURCE_HOST, sourceHost);
            }
            return true;
        });
    }

    static String localFqdn() {
        try {
            return InetAddress.getLocalHost().getCanonicalHostName();
        } catch (UnknownHostException e) {
            log.warn("add_source_host: could not resolve local host name ({}); using 'localhost'", e.getMessage());
            return "localhost";
        }
    }
}
