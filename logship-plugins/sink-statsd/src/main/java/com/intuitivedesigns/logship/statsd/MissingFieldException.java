/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.statsd;

/**
 * An event lacks a field a metric needs.
 */
public final class MissingFieldException extends Exception {

    private final String field;

    public MissingFieldException(String field, String template) {
        super("key '" + field + "' not found in event when constructing metric '" + template + "'");
        this.field = field;
    }

    public String field() {
        return field;
    }
}
