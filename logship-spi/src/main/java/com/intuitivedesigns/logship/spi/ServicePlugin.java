/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.spi;

import java.util.List;

public interface ServicePlugin {
    /**
     * @return The unique name of this plugin as written in descriptions (e.g. 'init_txt', 'redis').
     */
    String id();

    /**
     * @return Additional names this plugin answers to.
     */
    default List<String> aliases() {
        return List.of();
    }

    /**
     * @return The kind of plugin (FILTER or SINK).
     */
    PluginKind kind();

    /**
     * @return The positional and keyword arguments this plugin accepts.
     */
    default ParameterShape parameters() {
        return ParameterShape.none();
    }
}
