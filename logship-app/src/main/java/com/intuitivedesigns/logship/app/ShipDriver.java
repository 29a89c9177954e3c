/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.app;

import com.intuitivedesigns.logship.core.Event;
import com.intuitivedesigns.logship.core.EventSink;
import com.intuitivedesigns.logship.pipeline.Pipeline;

import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Feeds input lines through the pipeline and hands every event to every sink, in sink order.
 */
final class ShipDriver {

    private ShipDriver() {}

    /**
     * @return the number of events produced by the pipeline
     */
    static long run(Pipeline pipeline, Stream<String> lines, List<? extends EventSink> sinks) {
        long events = 0;
        try (Stream<Event> stream = pipeline.apply(lines)) {
            Iterator<Event> it = stream.iterator();
            while (it.hasNext()) {
                Event event = it.next();
                for (EventSink sink : sinks) {
                    sink.ship(event);
                }
                events++;
            }
        }
        return events;
    }
}
