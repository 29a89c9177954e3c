/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.spi;

import com.intuitivedesigns.logship.core.EventSink;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ServicePluginRegistryTest {

    private static SinkPlugin sink(String id, String... aliases) {
        return new SinkPlugin() {
            @Override public String id() { return id; }
            @Override public List<String> aliases() { return List.of(aliases); }
            @Override public EventSink create(Arguments arguments, SinkContext context) { return event -> { }; }
        };
    }

    @Test
    void testRegistersIdAndAliases() {
        ServicePluginRegistry<SinkPlugin> registry = new ServicePluginRegistry<>(PluginKind.SINK);
        SinkPlugin plugin = sink("statsd_counter", "statsd");
        registry.register(plugin);

        assertSame(plugin, registry.require("statsd"));
        assertSame(plugin, registry.require(" STATSD_COUNTER "));
        assertEquals(List.of("statsd_counter", "statsd"), List.copyOf(registry.availableIds()));
    }

    @Test
    void testDuplicateNameFails() {
        ServicePluginRegistry<SinkPlugin> registry = new ServicePluginRegistry<>(PluginKind.SINK);
        registry.register(sink("stdout"));

        DuplicatePluginException e = assertThrows(DuplicatePluginException.class, () -> registry.register(sink("stdout")));
        assertEquals("stdout", e.name());
    }

    @Test
    void testUnknownNameIsReportedAsGiven() {
        ServicePluginRegistry<SinkPlugin> registry = new ServicePluginRegistry<>(PluginKind.SINK);
        registry.register(sink("stdout"));

        UnknownPluginException e = assertThrows(UnknownPluginException.class, () -> registry.require("Kafka"));
        assertEquals("Kafka", e.name());
        assertEquals(PluginKind.SINK, e.kind());
        assertTrue(e.getMessage().contains("stdout"));
        assertTrue(registry.get("kafka").isEmpty());
    }

    @Test
    void testBlankNameRejected() {
        ServicePluginRegistry<SinkPlugin> registry = new ServicePluginRegistry<>(PluginKind.SINK);

        assertThrows(ConfigurationException.class, () -> registry.register("  ", sink("x")));
    }
}
