/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.filters;

import com.intuitivedesigns.logship.LogCapture;
import com.intuitivedesigns.logship.core.Event;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ParseLogrageFilterPluginTest {

    @Test
    void testSplitsKeyValueTokens() {
        Event event = Event.ofMessage("status=200 path=/x time=0.05");

        List<Event> out = FilterRunner.run(new ParseLogrageFilterPlugin(), event);

        assertEquals(Map.of("status", "200", "path", "/x", "time", "0.05"), out.get(0).get(Event.FIELDS));
    }

    @Test
    void testSplitsAtFirstEqualsAndSkipsBareTokens() {
        Event event = Event.ofMessage("  method=GET   params=a=b noise\tcontroller=Home ");

        Map<?, ?> fields = (Map<?, ?>) FilterRunner.run(new ParseLogrageFilterPlugin(), event).get(0).get(Event.FIELDS);

        assertEquals(Map.of("method", "GET", "params", "a=b", "controller", "Home"), fields);
    }

    @Test
    void testMissingMessageIsDroppedWithWarning() {
        try (LogCapture logs = LogCapture.of(ParseLogrageFilterPlugin.class)) {
            List<Event> out = FilterRunner.run(new ParseLogrageFilterPlugin(), new Event().put("other", 1), Event.ofMessage("a=1"));

            assertEquals(1, out.size());
            assertTrue(logs.hasWarningContaining("@message"));
        }
    }

    @Test
    void testNonStringMessageIsDropped() {
        try (LogCapture logs = LogCapture.of(EventFilters.class)) {
            List<Event> out = FilterRunner.run(new ParseLogrageFilterPlugin(), new Event().put(Event.MESSAGE, 42));

            assertTrue(out.isEmpty());
            assertTrue(logs.hasWarningContaining("parse_lograge"));
        }
    }
}
