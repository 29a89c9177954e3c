/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.logship.pipeline;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits one line of a description into fields, CSV style.
 *
 * <p>A field that starts with {@code "} runs until the closing quote, so it may contain the
 * delimiter; inside it {@code ""} stands for a literal quote. A quote anywhere else is an
 * ordinary character. An unterminated quote runs to the end of the text. There is no
 * failure mode: every input produces at least one (possibly empty) field.</p>
 */
public final class DescriptionTokenizer {

    private static final char QUOTE = '"';

    private DescriptionTokenizer() {}

    public static List<String> split(String text, char delimiter) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        boolean atFieldStart = true;

        final int n = text.length();
        for (int i = 0; i < n; i++) {
            char c = text.charAt(i);

            if (quoted) {
                if (c == QUOTE) {
                    if (i + 1 < n && text.charAt(i + 1) == QUOTE) {
                        current.append(QUOTE);
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    current.append(c);
                }
                continue;
            }

            if (c == delimiter) {
                fields.add(current.toString());
                current.setLength(0);
                atFieldStart = true;
                continue;
            }

            if (c == QUOTE && atFieldStart) {
                quoted = true;
            } else {
                current.append(c);
            }
            atFieldStart = false;
        }

        fields.add(current.toString());
        return fields;
    }
}
