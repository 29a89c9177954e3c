/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.filters;

import com.intuitivedesigns.logship.core.Event;
import com.intuitivedesigns.logship.core.Filter;
import com.intuitivedesigns.logship.spi.Arguments;
import com.intuitivedesigns.logship.spi.FilterPlugin;

import java.util.stream.Stream;

/**
 * Wraps each raw line as {@code {"@message": line}}, minus trailing newlines.
 * <p>
 * ID: init_txt
 */
public final class InitTxtFilterPlugin implements FilterPlugin {

    public static final String ID = "init_txt";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Class<?> inputType() {
        return String.class;
    }

    @Override
    public Filter<?, Event> create(Arguments arguments) {
        return Filter.<String, Event>perItem(line -> Stream.of(Event.ofMessage(stripNewlines(line))));
    }

    static String stripNewlines(String line) {
        int end = line.length();
        while (end > 0 && line.charAt(end - 1) == '\n') {
            end--;
        }
        return line.substring(0, end);
    }
}
