/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One structured record produced from an input line.
 *
 * <p>Unlike the immutable envelopes used elsewhere, an Event is created by the first
 * pipeline stage and mutated in place by every later stage. Key order is preserved so the
 * encoded document reads in the order fields were added.</p>
 *
 * <p>Values are Strings, Numbers, Booleans, nested {@code Map<String, Object>} or Lists.</p>
 */
public final class Event {

    public static final String MESSAGE = "@message";
    public static final String TIMESTAMP = "@timestamp";
    public static final String SOURCE_HOST = "@source_host";
    public static final String FIELDS = "@fields";
    public static final String TAGS = "@tags";

    private final Map<String, Object> data;

    public Event() {
        this.data = new LinkedHashMap<>();
    }

    private Event(Map<String, Object> data) {
        this.data = data;
    }

    /**
     * Wraps a copy of the given mapping. Nested values are shared, not copied.
     */
    public static Event of(Map<String, ?> values) {
        Objects.requireNonNull(values, "values");
        return new Event(new LinkedHashMap<>(values));
    }

    public static Event ofMessage(String message) {
        Event e = new Event();
        e.put(MESSAGE, message);
        return e;
    }

    public Object get(String key) {
        return data.get(key);
    }

    public boolean containsKey(String key) {
        return data.containsKey(key);
    }

    public Event put(String key, Object value) {
        data.put(key, value);
        return this;
    }

    public Object remove(String key) {
        return data.remove(key);
    }

    public int size() {
        return data.size();
    }

    /**
     * @return the live backing map; changes are visible to the event.
     */
    public Map<String, Object> asMap() {
        return data;
    }

    /**
     * The {@code @fields} map, created if absent.
     *
     * @throws IllegalStateException if {@code @fields} holds something other than a map
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> fields() {
        Object current = data.get(FIELDS);
        if (current == null) {
            Map<String, Object> created = new LinkedHashMap<>();
            data.put(FIELDS, created);
            return created;
        }
        if (!(current instanceof Map)) {
            throw new IllegalStateException(FIELDS + " is not an object: " + current);
        }
        return (Map<String, Object>) current;
    }

    /**
     * The {@code @tags} list. Created if absent; replaced if it holds anything other than a list.
     */
    @SuppressWarnings("unchecked")
    public List<Object> tags() {
        Object current = data.get(TAGS);
        if (current instanceof List) {
            return (List<Object>) current;
        }
        List<Object> created = new ArrayList<>();
        data.put(TAGS, created);
        return created;
    }

    /**
     * Resolves a dotted path such as {@code @fields.status}.
     *
     * <p>The literal key is tried first, so keys that themselves contain dots still resolve.
     * Otherwise the path is walked one component at a time through nested maps.</p>
     *
     * @return the value, or empty if any component is missing
     */
    public Optional<Object> lookup(String path) {
        if (path == null) return Optional.empty();
        if (data.containsKey(path)) {
            return Optional.ofNullable(data.get(path));
        }

        Object current = data;
        for (String part : path.split("\\.", -1)) {
            if (!(current instanceof Map<?, ?> m) || !m.containsKey(part)) {
                return Optional.empty();
            }
            current = m.get(part);
        }
        return Optional.ofNullable(current);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return (o instanceof Event other) && data.equals(other.data);
    }

    @Override
    public int hashCode() {
        return data.hashCode();
    }

    @Override
    public String toString() {
        return "Event" + data;
    }
}
