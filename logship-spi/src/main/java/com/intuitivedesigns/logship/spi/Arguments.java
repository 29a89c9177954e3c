/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.spi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * The typed argument bundle of one filter or sink clause.
 *
 * <p>Raw argument strings are split at their first {@code '='}: {@code key=value} becomes a
 * keyword argument, anything else is positional. A repeated keyword keeps its last value.</p>
 *
 * @param positional ordered positional arguments
 * @param keywords   keyword arguments in the order they first appeared
 */
public record Arguments(List<String> positional, Map<String, String> keywords) {

    private static final Arguments EMPTY = new Arguments(List.of(), Map.of());

    public Arguments {
        positional = (positional == null) ? List.of() : List.copyOf(positional);
        keywords = (keywords == null)
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(keywords));
    }

    public static Arguments empty() {
        return EMPTY;
    }

    public static Arguments parse(List<String> raw) {
        if (raw == null || raw.isEmpty()) return EMPTY;

        List<String> args = new ArrayList<>();
        Map<String, String> kwargs = new LinkedHashMap<>();
        for (String arg : raw) {
            int idx = arg.indexOf('=');
            if (idx < 0) {
                args.add(arg);
            } else {
                kwargs.put(arg.substring(0, idx), arg.substring(idx + 1));
            }
        }
        return new Arguments(args, kwargs);
    }

    public boolean has(String key) {
        return keywords.containsKey(key);
    }

    public String getString(String key, String defaultValue) {
        return keywords.getOrDefault(key, defaultValue);
    }

    public String require(String key) {
        String v = keywords.get(key);
        if (v == null) {
            throw new ConfigurationException("Missing required argument: " + key);
        }
        return v;
    }

    /**
     * Strict boolean: only {@code true} and {@code false} (any case) are accepted.
     */
    public boolean getBoolean(String key, boolean defaultValue) {
        String v = keywords.get(key);
        if (v == null) return defaultValue;
        switch (v.trim().toLowerCase(Locale.ROOT)) {
            case "true":
                return true;
            case "false":
                return false;
            default:
                throw new ConfigurationException("Argument '" + key + "' must be true or false, got '" + v + "'");
        }
    }

    public int getInt(String key, int defaultValue) {
        String v = keywords.get(key);
        if (v == null) return defaultValue;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Argument '" + key + "' must be an integer, got '" + v + "'", e);
        }
    }

    @Override
    public String toString() {
        return "Arguments" + Objects.toString(positional) + Objects.toString(keywords);
    }
}
