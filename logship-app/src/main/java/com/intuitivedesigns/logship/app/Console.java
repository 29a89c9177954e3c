/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.app;

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * The standard streams a command reads from and writes to. Tests substitute their own.
 */
record Console(InputStream in, PrintStream out) {

    Console {
        Objects.requireNonNull(in, "in");
        Objects.requireNonNull(out, "out");
    }

    static Console system() {
        return new Console(System.in, System.out);
    }

    /**
     * Lines of UTF-8 input without their terminators, read lazily.
     */
    Stream<String> lines() {
        return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)).lines();
    }
}
