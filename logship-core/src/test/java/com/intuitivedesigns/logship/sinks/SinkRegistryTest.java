/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.sinks;

import com.intuitivedesigns.logship.core.Event;
import com.intuitivedesigns.logship.core.EventSink;
import com.intuitivedesigns.logship.spi.Arguments;
import com.intuitivedesigns.logship.spi.ConfigurationException;
import com.intuitivedesigns.logship.spi.ParameterShape;
import com.intuitivedesigns.logship.spi.SinkContext;
import com.intuitivedesigns.logship.spi.SinkPlugin;
import com.intuitivedesigns.logship.spi.UnknownPluginException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SinkRegistryTest {

    private static final class TrackingPlugin implements SinkPlugin {
        final List<String> closed = new ArrayList<>();

        @Override public String id() { return "tracking"; }
        @Override public ParameterShape parameters() { return ParameterShape.builder().positional(true).build(); }

        @Override
        public EventSink create(Arguments arguments, SinkContext context) {
            String label = arguments.positional().isEmpty() ? "?" : arguments.positional().get(0);
            return new EventSink() {
                @Override public void ship(Event event) { }
                @Override public void close() { closed.add(label); }
            };
        }
    }

    private static final class FailingPlugin implements SinkPlugin {
        @Override public String id() { return "failing"; }
        @Override public EventSink create(Arguments arguments, SinkContext context) throws IOException {
            throw new IOException("socket refused");
        }
    }

    @Test
    void testInstalledFindsBuiltins() {
        SinkRegistry registry = SinkRegistry.installed();

        assertTrue(registry.names().containsAll(List.of("stdout", "null")));
    }

    @Test
    void testUnknownSink() {
        UnknownPluginException e = assertThrows(UnknownPluginException.class,
                () -> new SinkRegistry().build("kafka,topic=x", SinkContext.defaults()));

        assertEquals("kafka", e.name());
    }

    @Test
    void testUnexpectedArgumentsAreFatal() {
        SinkRegistry registry = new SinkRegistry().register(new ConsoleSinkPlugin());

        assertThrows(ConfigurationException.class, () -> registry.build("stdout,somewhere", SinkContext.defaults()));
        assertThrows(ConfigurationException.class, () -> registry.build("stdout,colour=red", SinkContext.defaults()));
    }

    @Test
    void testConstructionFailureIsConfigurationError() {
        SinkRegistry registry = new SinkRegistry().register(new FailingPlugin());

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> registry.build("failing", SinkContext.defaults()));
        assertTrue(e.getMessage().contains("failing"));
        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    void testBuildAllClosesEarlierSinksOnFailure() {
        TrackingPlugin tracking = new TrackingPlugin();
        SinkRegistry registry = new SinkRegistry().register(tracking).register(new FailingPlugin());

        assertThrows(ConfigurationException.class,
                () -> registry.buildAll(List.of("tracking,one", "tracking,two", "failing"), SinkContext.defaults()));
        assertEquals(List.of("one", "two"), tracking.closed);
    }

    @Test
    void testNullSinkAcceptsAnything() {
        SinkRegistry registry = new SinkRegistry().register(new NullSinkPlugin());

        EventSink sink = registry.build("null,whatever,k=v", SinkContext.defaults());
        assertDoesNotThrow(() -> sink.ship(Event.ofMessage("gone")));
        assertEquals("null", sink.id());
    }
}
