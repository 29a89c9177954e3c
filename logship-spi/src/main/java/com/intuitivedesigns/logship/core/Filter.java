/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.core;

import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * A streaming transformation step in the pipeline.
 *
 * <p>A filter maps a lazy sequence of inputs to a lazy sequence of outputs. Each input may
 * produce zero, one or several outputs; dropping an item means producing nothing for it.</p>
 *
 * <p><b>Contract:</b></p>
 * <ul>
 * <li>Never buffer the whole input: pull one item, emit its results, pull the next.</li>
 * <li>Preserve order.</li>
 * <li>A filter instance may be applied to any number of input streams (one per run).</li>
 * </ul>
 *
 * @param <I> Input element type
 * @param <O> Output element type
 */
@FunctionalInterface
public interface Filter<I, O> {

    Stream<O> apply(Stream<I> input);

    /**
     * Feeds every item this filter produces through {@code next}.
     */
    default <R> Filter<I, R> andThen(Filter<O, R> next) {
        Objects.requireNonNull(next, "next");
        return input -> next.apply(apply(input));
    }

    /**
     * Builds a filter from a per-item function returning the item's outputs.
     */
    static <I, O> Filter<I, O> perItem(Function<? super I, ? extends Stream<? extends O>> fn) {
        Objects.requireNonNull(fn, "fn");
        return input -> input.flatMap(fn);
    }

    static <T> Filter<T, T> identity() {
        return input -> input;
    }
}
