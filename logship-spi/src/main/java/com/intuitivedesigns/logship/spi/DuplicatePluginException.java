/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.spi;

public final class DuplicatePluginException extends ConfigurationException {

    private final String name;

    public DuplicatePluginException(PluginKind kind, String name, String existing, String conflicting) {
        super("Duplicate " + kind.label() + " '" + name + "'. Conflict between: " + existing + " and " + conflicting);
        this.name = name;
    }

    public String name() {
        return name;
    }
}
