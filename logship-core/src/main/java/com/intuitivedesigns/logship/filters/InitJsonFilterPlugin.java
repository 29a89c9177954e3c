/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.filters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.logship.core.Event;
import com.intuitivedesigns.logship.core.Filter;
import com.intuitivedesigns.logship.spi.Arguments;
import com.intuitivedesigns.logship.spi.FilterPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.stream.Stream;

/**
 * Parses each raw line as a JSON object.
 *
 * <p>Lines that are not valid JSON, or that hold something other than an object, are logged
 * at WARN and skipped; the stream carries on.</p>
 * <p>
 * ID: init_json
 */
public final class InitJsonFilterPlugin implements FilterPlugin {

    public static final String ID = "init_json";

    private static final Logger log = LoggerFactory.getLogger(InitJsonFilterPlugin.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() { };

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
        return Filter.<String, Event>perItem(InitJsonFilterPlugin::parse);
    }

    private static Stream<Event> parse(String line) {
        final JsonNode node;
        try {
            node = MAPPER.readTree(line);
        } catch (JsonProcessingException e) {
            log.warn("init_json: could not parse JSON message \"{}\"", line);
            log.warn("init_json: error was \"{}\"", e.getOriginalMessage());
            return Stream.empty();
        }

        if (node == null || !node.isObject()) {
            log.warn("init_json: skipping message \"{}\" (not a JSON object)", line);
            return Stream.empty();
        }

        return Stream.of(Event.of(MAPPER.convertValue(node, MAP_TYPE)));
    }
}
