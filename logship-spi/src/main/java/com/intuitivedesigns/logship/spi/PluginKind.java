/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.spi;

import java.util.Locale;

public enum PluginKind {
    FILTER,
    SINK;

    /**
     * Lower-case label used in error messages ("filter", "sink").
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
