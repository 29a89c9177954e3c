/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.spi;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The declared argument shape of a filter or sink.
 *
 * <p>Checked once when a description is resolved, so a typo in a keyword name fails at
 * startup instead of being silently ignored.</p>
 */
public final class ParameterShape {

    private static final ParameterShape NONE = builder().build();
    private static final ParameterShape ANY = builder().positional(true).anyKeywords().build();

    private final boolean positionalAllowed;
    private final boolean anyKeywords;
    private final Set<String> keywords;
    private final Set<String> required;

    private ParameterShape(Builder b) {
        this.positionalAllowed = b.positionalAllowed;
        this.anyKeywords = b.anyKeywords;
        this.keywords = Collections.unmodifiableSet(new LinkedHashSet<>(b.keywords));
        this.required = Collections.unmodifiableSet(new LinkedHashSet<>(b.required));
    }

    /** No arguments at all. */
    public static ParameterShape none() {
        return NONE;
    }

    /** Anything goes. */
    public static ParameterShape any() {
        return ANY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @throws ConfigurationException naming the first offending argument
     */
    public void validate(PluginKind kind, String name, Arguments args) {
        if (!positionalAllowed && !args.positional().isEmpty()) {
            throw new ConfigurationException("Unexpected positional arguments to " + kind.label() + " '" + name + "': " + args.positional());
        }
        if (!anyKeywords) {
            for (String key : args.keywords().keySet()) {
                if (!keywords.contains(key)) {
                    throw new ConfigurationException("Unknown argument '" + key + "' for " + kind.label() + " '" + name + "'. Accepted: " + keywords);
                }
            }
        }
        for (String key : required) {
            if (!args.has(key)) {
                throw new ConfigurationException("Missing required argument '" + key + "' for " + kind.label() + " '" + name + "'");
            }
        }
    }

    public static final class Builder {
        private boolean positionalAllowed;
        private boolean anyKeywords;
        private final Set<String> keywords = new LinkedHashSet<>();
        private final Set<String> required = new LinkedHashSet<>();

        private Builder() {}

        public Builder positional(boolean allowed) {
            this.positionalAllowed = allowed;
            return this;
        }

        public Builder anyKeywords() {
            this.anyKeywords = true;
            return this;
        }

        public Builder optional(String... names) {
            keywords.addAll(List.of(names));
            return this;
        }

        public Builder required(String... names) {
            keywords.addAll(List.of(names));
            required.addAll(List.of(names));
            return this;
        }

        public ParameterShape build() {
            return new ParameterShape(this);
        }
    }
}
