/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.pipeline;

import com.intuitivedesigns.logship.core.Event;
import com.intuitivedesigns.logship.core.Filter;
import com.intuitivedesigns.logship.spi.ConfigurationException;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A built, ready-to-run filter chain.
 *
 * <p>Given filters {@code a, b, c} the pipeline yields {@code c(b(a(x)))}: every item
 * {@code a} produces is fed through {@code b}, and every item {@code b} produces through
 * {@code c}. The result is lazy; nothing is read from the input until the returned stream
 * is consumed, and each run starts from a fresh input stream.</p>
 */
public final class Pipeline {

    private final List<FilterSpec> specs;
    private final Class<?> inputType;
    private final Filter<Object, Event> chain;

    Pipeline(List<FilterSpec> specs, Class<?> inputType, Filter<Object, Event> chain) {
        this.specs = List.copyOf(specs);
        this.inputType = Objects.requireNonNull(inputType, "inputType");
        this.chain = Objects.requireNonNull(chain, "chain");
    }

    /**
     * Composes two filters: {@code pipeline(a, b).apply(x) == b.apply(a.apply(x))}.
     */
    public static <A, B, C> Filter<A, C> compose(Filter<A, B> first, Filter<B, C> second) {
        Objects.requireNonNull(first, "first");
        return first.andThen(second);
    }

    /**
     * Runs the chain over {@code input}.
     *
     * @throws ClassCastException when an item does not match {@link #inputType()}
     */
    public Stream<Event> apply(Stream<?> input) {
        Objects.requireNonNull(input, "input");
        Stream<Object> typed = input.map(item -> (Object) inputType.cast(item));
        return chain.apply(typed);
    }

    /**
     * @return the element type the first filter consumes
     */
    public Class<?> inputType() {
        return inputType;
    }

    public boolean acceptsLines() {
        return inputType == String.class;
    }

    /**
     * @return this pipeline
     * @throws ConfigurationException if the first filter does not read raw text lines
     */
    public Pipeline requireLines() {
        if (!acceptsLines()) {
            throw new ConfigurationException("The first filter must read raw lines (e.g. init_txt or init_json); got " + this);
        }
        return this;
    }

    public List<FilterSpec> specs() {
        return specs;
    }

    @Override
    public String toString() {
        return specs.stream().map(FilterSpec::name).collect(Collectors.joining(" -> ", "Pipeline[", "]"));
    }
}
