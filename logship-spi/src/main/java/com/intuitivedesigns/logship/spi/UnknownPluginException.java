/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.spi;

import java.util.Collection;

/**
 * No plugin is registered under the requested name.
 */
public final class UnknownPluginException extends ConfigurationException {

    private final PluginKind kind;
    private final String name;

    public UnknownPluginException(PluginKind kind, String name, Collection<String> available) {
        super("No such " + kind.label() + ": '" + name + "'. Available options: " + available);
        this.kind = kind;
        this.name = name;
    }

    public PluginKind kind() {
        return kind;
    }

    /**
     * @return the offending name exactly as it appeared in the description
     */
    public String name() {
        return name;
    }
}
