/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.statsd;

import com.intuitivedesigns.logship.core.Event;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A metric name with {@code %{field.path}} placeholders, e.g.
 * {@code app.%{@fields.controller}.%{@fields.action}}. Each placeholder is replaced by the
 * string form of the event value at that path.
 */
public final class MetricTemplate {

    private static final Pattern PLACEHOLDER = Pattern.compile("%\\{([^}]*)\\}");

    private final String template;

    public MetricTemplate(String template) {
        this.template = Objects.requireNonNull(template, "template");
    }

    public String render(Event event) throws MissingFieldException {
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder(template.length());
        while (m.find()) {
            String field = m.group(1);
            m.appendReplacement(out, Matcher.quoteReplacement(String.valueOf(value(event, field))));
        }
        m.appendTail(out);
        return out.toString();
    }

    /**
     * Looks up one field the same way placeholders are resolved.
     */
    public Object value(Event event, String field) throws MissingFieldException {
        return event.lookup(field).orElseThrow(() -> new MissingFieldException(field, template));
    }

    @Override
    public String toString() {
        return template;
    }
}
