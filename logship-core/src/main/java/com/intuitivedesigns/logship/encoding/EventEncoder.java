/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.encoding;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.logship.core.Event;
import com.intuitivedesigns.logship.spi.Arguments;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Serializes events into transport payloads.
 *
 * <ul>
 * <li><b>plain</b>: one compact JSON document.</li>
 * <li><b>bulk</b>: an index command line followed by the document line, both
 * newline-terminated, as batch-indexing write endpoints expect:
 * <pre>
 * {"index":{"_index":"logs","_type":"message"}}
 * {"@message":"..."}
 * </pre></li>
 * </ul>
 */
public final class EventEncoder {

    public static final String ARG_BULK = "bulk";
    public static final String ARG_BULK_INDEX = "bulk_index";
    public static final String ARG_BULK_TYPE = "bulk_type";

    public static final String DEFAULT_BULK_INDEX = "logs";
    public static final String DEFAULT_BULK_TYPE = "message";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final boolean bulk;
    private final String bulkIndex;
    private final String bulkType;

    private EventEncoder(boolean bulk, String bulkIndex, String bulkType) {
        this.bulk = bulk;
        this.bulkIndex = bulkIndex;
        this.bulkType = bulkType;
    }

    public static EventEncoder plain() {
        return new EventEncoder(false, null, null);
    }

    public static EventEncoder bulk(String index, String type) {
        return new EventEncoder(true, Objects.requireNonNull(index, "index"), Objects.requireNonNull(type, "type"));
    }

    /**
     * Reads {@code bulk}, {@code bulk_index} and {@code bulk_type} from sink arguments.
     */
    public static EventEncoder fromArguments(Arguments args) {
        if (!args.getBoolean(ARG_BULK, false)) {
            return plain();
        }
        return bulk(args.getString(ARG_BULK_INDEX, DEFAULT_BULK_INDEX), args.getString(ARG_BULK_TYPE, DEFAULT_BULK_TYPE));
    }

    public String encode(Event event) throws JsonProcessingException {
        String document = MAPPER.writeValueAsString(event.asMap());
        if (!bulk) {
            return document;
        }
        return indexCommand() + "\n" + document + "\n";
    }

    private String indexCommand() throws JsonProcessingException {
        Map<String, String> target = new LinkedHashMap<>();
        target.put("_index", bulkIndex);
        target.put("_type", bulkType);
        return MAPPER.writeValueAsString(Map.of("index", target));
    }

    /**
     * @return true when payloads already end with a newline
     */
    public boolean isBulk() {
        return bulk;
    }

    @Override
    public String toString() {
        return bulk ? "bulk(" + bulkIndex + "/" + bulkType + ")" : "plain";
    }
}
