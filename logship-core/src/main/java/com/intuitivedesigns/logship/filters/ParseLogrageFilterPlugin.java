/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.filters;

import com.intuitivedesigns.logship.core.Event;
import com.intuitivedesigns.logship.core.Filter;
import com.intuitivedesigns.logship.spi.Arguments;
import com.intuitivedesigns.logship.spi.FilterPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads lograge-style {@code key=value} pairs out of {@code @message} into {@code @fields},
 * e.g. {@code status=200 path=/users/login time=125ms}. Tokens without {@code =} are ignored.
 * <p>
 * ID: parse_lograge
 */
public final class ParseLogrageFilterPlugin implements FilterPlugin {

    public static final String ID = "parse_lograge";

    private static final Logger log = LoggerFactory.getLogger(ParseLogrageFilterPlugin.class);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Filter<?, Event> create(Arguments arguments) {
        return EventFilters.perEvent(ID, ParseLogrageFilterPlugin::parse);
    }

    private static boolean parse(Event event) {
        if (!event.containsKey(Event.MESSAGE)) {
            log.warn("parse_lograge: skipping item missing \"{}\" key (\"{}\")", Event.MESSAGE, event);
            return false;
        }
        if (!(event.get(Event.MESSAGE) instanceof String message)) {
            throw new IllegalStateException(Event.MESSAGE + " is not a string");
        }

        Map<String, Object> fields = event.fields();
        for (String token : WHITESPACE.split(message.strip())) {
            int idx = token.indexOf('=');
            if (idx >= 0) {
                fields.put(token.substring(0, idx), token.substring(idx + 1));
            }
        }
        return true;
    }
}
