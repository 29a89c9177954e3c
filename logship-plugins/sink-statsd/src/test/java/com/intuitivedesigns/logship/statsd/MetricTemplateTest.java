/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.statsd;

import com.intuitivedesigns.logship.core.Event;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MetricTemplateTest {

    private static final Event EVENT = new Event()
            .put("source", "web")
            .put("a.b", "literal")
            .put(Event.FIELDS, Map.of("status", 200, "req", Map.of("verb", "GET")));

    @Test
    void testResolvesPlaceholders() throws Exception {
        MetricTemplate template = new MetricTemplate("%{source}.nginx.%{@fields.status}.%{@fields.req.verb}");

        assertEquals("web.nginx.200.GET", template.render(EVENT));
    }

    @Test
    void testLiteralDottedKeyWins() throws Exception {
        assertEquals("literal", new MetricTemplate("%{a.b}").render(EVENT));
    }

    @Test
    void testTemplateWithoutPlaceholders() throws Exception {
        assertEquals("plain.metric", new MetricTemplate("plain.metric").render(new Event()));
    }

    @Test
    void testValueWithRegexSpecialCharacters() throws Exception {
        Event event = new Event().put("path", "$1\\x");

        assertEquals("p.$1\\x", new MetricTemplate("p.%{path}").render(event));
    }

    @Test
    void testMissingFieldNamesFieldAndTemplate() {
        MetricTemplate template = new MetricTemplate("app.%{@fields.controller}");

        MissingFieldException e = assertThrows(MissingFieldException.class, () -> template.render(EVENT));
        assertEquals("@fields.controller", e.field());
        assertTrue(e.getMessage().contains("app.%{@fields.controller}"));
    }
}
