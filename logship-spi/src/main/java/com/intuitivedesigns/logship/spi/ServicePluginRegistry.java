/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.spi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Name table for one kind of plugin.
 *
 * <p>Instances are plain objects owned by whoever builds the pipeline; there is no
 * process-wide table. {@link #load} performs the ServiceLoader classpath scan once and
 * registers everything it finds; tests start from an empty registry instead.</p>
 *
 * @param <T> The SPI interface type (e.g., FilterPlugin)
 */
public final class ServicePluginRegistry<T extends ServicePlugin> {

    private final PluginKind kind;
    private final Map<String, T> byId = new LinkedHashMap<>();

    public ServicePluginRegistry(PluginKind kind) {
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public static <T extends ServicePlugin> ServicePluginRegistry<T> load(PluginKind kind, Class<T> spiType, ClassLoader cl) {
        ServicePluginRegistry<T> registry = new ServicePluginRegistry<>(kind);
        for (T plugin : ServiceLoader.load(spiType, cl)) {
            registry.register(plugin);
        }
        return registry;
    }

    /**
     * Registers the plugin under its id and every alias.
     *
     * @throws DuplicatePluginException if any of those names is taken
     */
    public void register(T plugin) {
        Objects.requireNonNull(plugin, "plugin");
        register(plugin.id(), plugin);
        for (String alias : plugin.aliases()) {
            register(alias, plugin);
        }
    }

    public void register(String name, T plugin) {
        Objects.requireNonNull(plugin, "plugin");
        String id = PluginIds.normalize(name);
        if (id.isEmpty()) {
            throw new ConfigurationException("Plugin name must not be blank for " + plugin.getClass().getName());
        }
        T existing = byId.get(id);
        if (existing != null) {
            throw new DuplicatePluginException(kind, id, existing.getClass().getName(), plugin.getClass().getName());
        }
        byId.put(id, plugin);
    }

    /**
     * @throws UnknownPluginException carrying {@code name} exactly as given
     */
    public T require(String name) {
        T plugin = byId.get(PluginIds.normalize(name));
        if (plugin == null) {
            throw new UnknownPluginException(kind, name, byId.keySet());
        }
        return plugin;
    }

    public Optional<T> get(String name) {
        return Optional.ofNullable(byId.get(PluginIds.normalize(name)));
    }

    public Set<String> availableIds() {
        return Collections.unmodifiableSet(byId.keySet());
    }

    public PluginKind kind() {
        return kind;
    }
}
