/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.filters;

import com.intuitivedesigns.logship.core.Event;
import com.intuitivedesigns.logship.core.Filter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.stream.Stream;

/**
 * Helpers for the common one-event-in, at-most-one-event-out filter shape.
 */
public final class EventFilters {

    private static final Logger log = LoggerFactory.getLogger(EventFilters.class);

    private EventFilters() {}

    /**
     * Mutates an event in place.
     */
    @FunctionalInterface
    public interface EventStep {
        /**
         * @return false to drop the event
         */
        boolean apply(Event event);
    }

    /**
     * Wraps {@code step} so a runtime failure on one event drops only that event.
     */
    public static Filter<Event, Event> perEvent(String filterName, EventStep step) {
        Objects.requireNonNull(step, "step");
        return Filter.<Event, Event>perItem(event -> {
            try {
                return step.apply(event) ? Stream.of(event) : Stream.empty();
            } catch (RuntimeException e) {
                log.warn("{}: dropping event {} ({})", filterName, event, e.getMessage());
                log.debug("{}: failure detail", filterName, e);
                return Stream.empty();
            }
        });
    }
}
